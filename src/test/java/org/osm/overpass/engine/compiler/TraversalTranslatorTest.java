package org.osm.overpass.engine.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.osm.overpass.dsl.EntityKind;
import org.osm.overpass.dsl.Traverse.Direction;
import org.osm.overpass.engine.transpiler.PostgresDialect;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.osm.overpass.dsl.EntityKind.AREA;
import static org.osm.overpass.dsl.EntityKind.NODE;
import static org.osm.overpass.dsl.EntityKind.RELATION;
import static org.osm.overpass.dsl.EntityKind.WAY;

class TraversalTranslatorTest {

    @Test
    void childrenOfWaysAreNodes() {
        assertEquals(EnumSet.of(NODE), TraversalTranslator.resultKinds(Direction.CHILDREN, EnumSet.of(WAY)));
    }

    @Test
    void nodesHaveNoChildren() {
        assertEquals(EnumSet.noneOf(EntityKind.class),
                TraversalTranslator.resultKinds(Direction.CHILDREN, EnumSet.of(NODE)));
    }

    @Test
    void parentsOfNodesAreWaysAndRelations() {
        assertEquals(EnumSet.of(WAY, RELATION), TraversalTranslator.resultKinds(Direction.PARENTS, EnumSet.of(NODE)));
        assertEquals(EnumSet.of(RELATION), TraversalTranslator.resultKinds(Direction.PARENTS, EnumSet.of(WAY)));
    }

    @Test
    void descendantsIncludeTheInput() {
        assertEquals(EnumSet.of(NODE, WAY), TraversalTranslator.resultKinds(Direction.DESCENDANTS, EnumSet.of(WAY)));
        assertEquals(EnumSet.of(NODE, WAY, RELATION),
                TraversalTranslator.resultKinds(Direction.DESCENDANTS, EnumSet.of(RELATION)));
    }

    @Test
    void ancestorsOfNodes() {
        assertEquals(EnumSet.of(NODE, WAY, RELATION),
                TraversalTranslator.resultKinds(Direction.ANCESTORS, EnumSet.of(NODE)));
    }

    @Test
    void areasAreNotWalked() {
        assertTrue(TraversalTranslator.resultKinds(Direction.DESCENDANTS, EnumSet.of(AREA)).isEmpty());
        assertTrue(TraversalTranslator.resultKinds(Direction.PARENTS, EnumSet.of(AREA)).isEmpty());
    }

    @Test
    @DisplayName("walking a closure again reaches nothing new")
    void closureIsIdempotent() {
        for (Set<EntityKind> input : subsets()) {
            for (Direction direction : List.of(Direction.DESCENDANTS, Direction.ANCESTORS)) {
                Set<EntityKind> once = TraversalTranslator.resultKinds(direction, input);
                assertEquals(once, TraversalTranslator.resultKinds(direction, once), direction + " from " + input);
            }
        }
    }

    @Test
    void oneLevelRejectsTransitiveDirections() {
        var translator = new TraversalTranslator(PostgresDialect.INSTANCE);
        assertThrows(IllegalArgumentException.class, () -> translator.oneLevel(Direction.DESCENDANTS, "_a"));
        assertThrows(IllegalArgumentException.class, () -> translator.closure(Direction.PARENTS, "_a", "_c"));
    }

    private static List<Set<EntityKind>> subsets() {
        EntityKind[] kinds = {NODE, WAY, RELATION, AREA};
        List<Set<EntityKind>> subsets = new ArrayList<>();
        for (int mask = 0; mask < 1 << kinds.length; mask++) {
            Set<EntityKind> subset = EnumSet.noneOf(EntityKind.class);
            for (int i = 0; i < kinds.length; i++) {
                if ((mask & (1 << i)) != 0) {
                    subset.add(kinds[i]);
                }
            }
            subsets.add(subset);
        }
        return subsets;
    }
}
