package org.osm.overpass.engine.transpiler;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PostgresDialectTest {

    private final PostgresDialect dialect = PostgresDialect.INSTANCE;

    @Test
    void timeoutIsInMilliseconds() {
        assertEquals(Optional.of("SET statement_timeout = 25000;"), dialect.statementTimeout(25));
    }

    @Test
    void areaViewsAlreadyHoldAreaIds() {
        assertEquals("area.id = ANY (ARRAY[3600000005, 7])", dialect.areaIdIn("area", List.of(3_600_000_005L, 7L)));
        assertEquals("area.*", dialect.areaProjection("area"));
    }

    @Test
    void quoteStringLiteral() {
        assertEquals("'O''Brien'", dialect.quoteStringLiteral("O'Brien"));
        assertEquals("'a\\b'", dialect.quoteStringLiteral("a\\b"));
    }

    @Test
    void setsAreReadThroughSubqueries() {
        assertFalse(dialect.materializesSets());
        assertThrows(UnsupportedOperationException.class, () -> dialect.materialize("_a", "SELECT 1", 4326));
    }

    @Test
    void geometryConversion() {
        assertEquals("geom", dialect.toWgs84("geom", 4326));
        assertEquals("ST_Transform(geom, 4326)", dialect.toWgs84("geom", 3857));
    }
}
