package org.osm.overpass.engine.transpiler;

import org.junit.jupiter.api.Test;
import org.osm.overpass.dsl.EntityKind;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ViewLayoutTest {

    @Test
    void unifiedLayoutUsesOneViewPerKind() {
        var views = ViewLayout.unified();

        assertFalse(views.isSplit());
        assertEquals("relation", views.view(EntityKind.RELATION, true));
        assertEquals("relation", views.view(EntityKind.RELATION, false));
        assertEquals("nwr", views.geometry(EntityKind.ANY));
    }

    @Test
    void splitLayout() {
        var views = ViewLayout.split("_by_id", "_by_geom");

        assertTrue(views.isSplit());
        assertEquals("way_by_id", views.view(EntityKind.WAY, true));
        assertEquals("way_by_geom", views.view(EntityKind.WAY, false));
        assertEquals("area_by_geom", views.geometry(EntityKind.AREA));
    }

    @Test
    void everyKindNeedsAView() {
        assertThrows(IllegalArgumentException.class,
                () -> new ViewLayout(Map.of(EntityKind.NODE, "n"), Map.of(EntityKind.NODE, "n")));
    }
}
