package org.osm.overpass.engine.transpiler;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AreaIdRuleTest {

    private final AreaIdRule rule = new AreaIdRule(AreaIdRule.OSM_RELATION_OFFSET, false);

    @ParameterizedTest
    @ValueSource(longs = {1L, 166718L, 7009125L, 2_000_000_000L})
    void relationAreasAreOffset(long relationId) {
        long areaId = rule.fromRelation(relationId);

        assertEquals(relationId + 3_600_000_000L, areaId);
        assertTrue(rule.isRelationArea(areaId));
        assertEquals(relationId, rule.sourceId(areaId));
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7009125L, 1_200_000_000L})
    void wayAreasKeepTheirId(long wayId) {
        long areaId = rule.fromWay(wayId);

        assertEquals(wayId, areaId);
        assertFalse(rule.isRelationArea(areaId));
        assertEquals(wayId, rule.sourceId(areaId));
    }

    @Test
    void offsetMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new AreaIdRule(0, true));
    }

    @Test
    void dialectRules() {
        assertTrue(PostgresDialect.INSTANCE.areaIds().viewsExposeAreaIds());
        assertFalse(DuckDbDialect.INSTANCE.areaIds().viewsExposeAreaIds());
        assertEquals(AreaIdRule.OSM_RELATION_OFFSET, DuckDbDialect.INSTANCE.areaIds().relationOffset());
    }
}
