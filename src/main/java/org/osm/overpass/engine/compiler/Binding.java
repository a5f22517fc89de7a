package org.osm.overpass.engine.compiler;

import org.osm.overpass.dsl.EntityKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A compiled set: the SQL relation holding its rows and the entity kinds
 * those rows can have.
 *
 * @param relation The CTE or temp table name
 * @param kinds    The possible kinds; empty for a set that is always empty
 */
public record Binding(String relation, Set<EntityKind> kinds) {

    public Binding {
        Objects.requireNonNull(relation, "Relation cannot be null");
        Objects.requireNonNull(kinds, "Kinds cannot be null");
        if (kinds.contains(EntityKind.ANY)) {
            throw new IllegalArgumentException("Kinds must be concrete, got " + kinds);
        }
        EnumSet<EntityKind> copy = EnumSet.noneOf(EntityKind.class);
        copy.addAll(kinds);
        kinds = Collections.unmodifiableSet(copy);
    }

    public boolean holdsOnlyAreas() {
        return kinds.equals(EnumSet.of(EntityKind.AREA));
    }

    @Override
    public String toString() {
        return relation + kinds;
    }
}
