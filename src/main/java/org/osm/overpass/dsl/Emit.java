package org.osm.overpass.dsl;

import java.util.Objects;

/**
 * An {@code out} statement.
 *
 * @param source   The {@code .name} set to print, or null for the default set
 * @param geometry The geometry modifier
 * @param detail   The level of detail modifier
 */
public record Emit(
        String source,
        GeometryMode geometry,
        DetailLevel detail) implements Statement {

    public Emit {
        Objects.requireNonNull(geometry, "Geometry mode cannot be null");
        Objects.requireNonNull(detail, "Detail level cannot be null");
    }

    public static Emit defaults() {
        return new Emit(null, GeometryMode.NONE, DetailLevel.BODY);
    }

    /**
     * out never assigns a set.
     */
    @Override
    public String assignment() {
        return null;
    }

    public enum GeometryMode {
        NONE(null),
        GEOM("geom"),
        BB("bb"),
        CENTER("center");

        private final String keyword;

        GeometryMode(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public static GeometryMode fromKeyword(String keyword) {
            return switch (keyword) {
                case "geom" -> GEOM;
                case "bb" -> BB;
                case "center" -> CENTER;
                default -> throw new IllegalArgumentException("Unknown geometry mode: " + keyword);
            };
        }
    }

    /**
     * Levels are cumulative: each one prints everything the previous one does.
     */
    public enum DetailLevel {
        IDS("ids"),
        SKEL("skel"),
        BODY("body"),
        TAGS("tags"),
        META("meta");

        private final String keyword;

        DetailLevel(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }

        public boolean includes(DetailLevel other) {
            return compareTo(other) >= 0;
        }

        public static DetailLevel fromKeyword(String keyword) {
            return switch (keyword) {
                case "ids" -> IDS;
                case "skel" -> SKEL;
                case "body" -> BODY;
                case "tags" -> TAGS;
                case "meta" -> META;
                default -> throw new IllegalArgumentException("Unknown level of detail: " + keyword);
            };
        }
    }

    @Override
    public String toString() {
        return OverpassWriter.write(this);
    }
}
