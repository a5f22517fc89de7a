package org.osm.overpass.dsl;

import java.util.Objects;

/**
 * A recursion statement walking the structural references between entities.
 *
 * @param source     The {@code .name} input set, or null for the default set
 * @param direction  Which way and how far to walk
 * @param assignment The {@code ->.name} target, or null
 */
public record Traverse(
        String source,
        Direction direction,
        String assignment) implements Statement {

    public Traverse {
        Objects.requireNonNull(direction, "Direction cannot be null");
    }

    public enum Direction {
        /** {@code >}: nodes of ways, members of relations. */
        CHILDREN(">", true, false),
        /** {@code >>}: children, transitively. */
        DESCENDANTS(">>", true, true),
        /** {@code <}: ways and relations referencing the input. */
        PARENTS("<", false, false),
        /** {@code <<}: parents, transitively. */
        ANCESTORS("<<", false, true);

        private final String symbol;
        private final boolean down;
        private final boolean transitive;

        Direction(String symbol, boolean down, boolean transitive) {
            this.symbol = symbol;
            this.down = down;
            this.transitive = transitive;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isDown() {
            return down;
        }

        public boolean isTransitive() {
            return transitive;
        }

        public static Direction fromSymbol(String symbol) {
            for (Direction direction : values()) {
                if (direction.symbol.equals(symbol)) {
                    return direction;
                }
            }
            throw new IllegalArgumentException("Unknown recursion operator: " + symbol);
        }
    }

    @Override
    public String toString() {
        return OverpassWriter.write(this);
    }
}
