package org.osm.overpass.dsl;

import java.util.EnumSet;
import java.util.Set;

/**
 * The entity kinds an Overpass query can select.
 * Each concrete kind carries the one-letter discriminant stored in the
 * {@code osm_type} column of the backend views.
 */
public enum EntityKind {
    NODE("node", "n"),
    WAY("way", "w"),
    RELATION("rel", "r"),
    AREA("area", "a"),
    ANY("nwr", null);

    private final String keyword;
    private final String typeCode;

    EntityKind(String keyword, String typeCode) {
        this.keyword = keyword;
        this.typeCode = typeCode;
    }

    /**
     * @return The canonical query keyword
     */
    public String keyword() {
        return keyword;
    }

    /**
     * @return The {@code osm_type} value, or null for {@link #ANY}
     */
    public String typeCode() {
        return typeCode;
    }

    /**
     * @return The concrete kinds rows selected by this kind can have
     */
    public Set<EntityKind> concreteKinds() {
        return this == ANY ? EnumSet.of(NODE, WAY, RELATION) : EnumSet.of(this);
    }

    public static EntityKind fromKeyword(String keyword) {
        return switch (keyword) {
            case "node" -> NODE;
            case "way" -> WAY;
            case "rel", "relation" -> RELATION;
            case "area" -> AREA;
            case "nwr" -> ANY;
            default -> throw new IllegalArgumentException("Unknown entity kind: " + keyword);
        };
    }
}
