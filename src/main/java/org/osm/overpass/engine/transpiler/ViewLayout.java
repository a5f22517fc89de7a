package org.osm.overpass.engine.transpiler;

import org.osm.overpass.dsl.EntityKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The backend views holding each entity kind.
 * A backend either has one view per kind serving both id lookups and
 * spatial scans, or two specialised views per kind.
 *
 * @param lookupViews   View per kind to use when searching by id
 * @param geometryViews View per kind to use for every other search
 */
public record ViewLayout(
        Map<EntityKind, String> lookupViews,
        Map<EntityKind, String> geometryViews) {

    public ViewLayout {
        Objects.requireNonNull(lookupViews, "Lookup views cannot be null");
        Objects.requireNonNull(geometryViews, "Geometry views cannot be null");
        for (EntityKind kind : EntityKind.values()) {
            if (!lookupViews.containsKey(kind) || !geometryViews.containsKey(kind)) {
                throw new IllegalArgumentException("No view for entity kind " + kind);
            }
        }
        lookupViews = Map.copyOf(lookupViews);
        geometryViews = Map.copyOf(geometryViews);
    }

    /**
     * One view per kind, named after the kind: node, way, relation, area, nwr.
     */
    public static ViewLayout unified() {
        Map<EntityKind, String> views = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            views.put(kind, baseName(kind));
        }
        return new ViewLayout(views, views);
    }

    /**
     * Two views per kind, {@code <kind><lookupSuffix>} and {@code <kind><geometrySuffix>}.
     */
    public static ViewLayout split(String lookupSuffix, String geometrySuffix) {
        Map<EntityKind, String> lookup = new EnumMap<>(EntityKind.class);
        Map<EntityKind, String> geometry = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            lookup.put(kind, baseName(kind) + lookupSuffix);
            geometry.put(kind, baseName(kind) + geometrySuffix);
        }
        return new ViewLayout(lookup, geometry);
    }

    public String lookup(EntityKind kind) {
        return lookupViews.get(kind);
    }

    public String geometry(EntityKind kind) {
        return geometryViews.get(kind);
    }

    public String view(EntityKind kind, boolean byId) {
        return byId ? lookup(kind) : geometry(kind);
    }

    public boolean isSplit() {
        return !lookupViews.equals(geometryViews);
    }

    private static String baseName(EntityKind kind) {
        return switch (kind) {
            case NODE -> "node";
            case WAY -> "way";
            case RELATION -> "relation";
            case AREA -> "area";
            case ANY -> "nwr";
        };
    }
}
