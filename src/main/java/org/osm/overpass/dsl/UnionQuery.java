package org.osm.overpass.dsl;

import java.util.List;
import java.util.Objects;

/**
 * A union block {@code ( stmt; stmt; )->.name}. Every member is a branch;
 * the result is the set union of the branch results.
 *
 * @param members    The branch statements, in query order
 * @param assignment The {@code ->.name} target, or null
 */
public record UnionQuery(
        List<Statement> members,
        String assignment) implements Statement {

    public UnionQuery {
        members = List.copyOf(Objects.requireNonNull(members, "Members cannot be null"));
        if (members.isEmpty()) {
            throw new IllegalArgumentException("A union needs at least one member");
        }
        for (Statement member : members) {
            if (member instanceof Emit) {
                throw new IllegalArgumentException("out is not allowed inside a union");
            }
        }
    }

    @Override
    public String toString() {
        return OverpassWriter.write(this);
    }
}
