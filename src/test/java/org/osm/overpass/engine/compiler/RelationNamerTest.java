package org.osm.overpass.engine.compiler;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelationNamerTest {

    @Test
    void reassignedSetsGetFreshNames() {
        var namer = new RelationNamer();
        assertEquals("_a", namer.forSet("a"));
        assertEquals("_a_2", namer.forSet("a"));
        assertEquals("_a_3", namer.forSet("a"));
    }

    @Test
    void anonymousNamesNeverCollideWithSetNames() {
        var namer = new RelationNamer();
        assertEquals("__1", namer.anonymous());
        assertEquals("__1_2", namer.forSet("_1"));
        assertEquals("__2", namer.anonymous());
    }

    @Test
    void namesDifferingOnlyInCaseCollide() {
        var namer = new RelationNamer();
        assertEquals("_Area", namer.forSet("Area"));
        assertEquals("_area_2", namer.forSet("area"));
    }
}
