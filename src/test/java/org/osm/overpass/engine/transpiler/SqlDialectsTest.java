package org.osm.overpass.engine.transpiler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlDialectsTest {

    @Test
    void knownDialects() {
        assertSame(PostgresDialect.INSTANCE, SqlDialects.forName("postgres"));
        assertSame(DuckDbDialect.INSTANCE, SqlDialects.forName("duckdb"));
        assertEquals(List.of("postgres", "duckdb"), SqlDialects.names());
    }

    @Test
    void dialectNamesMatchRegistry() {
        for (String name : SqlDialects.names()) {
            assertEquals(name, SqlDialects.forName(name).name());
        }
    }

    @Test
    void unknownDialect() {
        var ex = assertThrows(UnsupportedDialectException.class, () -> SqlDialects.forName("sqlite"));
        assertEquals("sqlite", ex.getDialectName());
        assertTrue(ex.getMessage().contains("postgres, duckdb"), ex.getMessage());
    }

    @Test
    void namesAreCaseSensitive() {
        assertThrows(UnsupportedDialectException.class, () -> SqlDialects.forName("Postgres"));
    }
}
