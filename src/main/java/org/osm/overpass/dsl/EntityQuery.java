package org.osm.overpass.dsl;

import java.util.List;
import java.util.Objects;

/**
 * An entity query such as {@code nwr.a["amenity"="cafe"](area.b)->.c}.
 *
 * @param kind       The entity kind keyword
 * @param source     The {@code .name} set to search in, or null to search
 *                   the whole kind
 * @param selectors  Tag selectors, in query order
 * @param filters    Spatial and id filters, in query order
 * @param assignment The {@code ->.name} target, or null
 */
public record EntityQuery(
        EntityKind kind,
        String source,
        List<Selector> selectors,
        List<Filter> filters,
        String assignment) implements Statement {

    public EntityQuery {
        Objects.requireNonNull(kind, "Entity kind cannot be null");
        selectors = List.copyOf(Objects.requireNonNull(selectors, "Selectors cannot be null"));
        filters = List.copyOf(Objects.requireNonNull(filters, "Filters cannot be null"));
    }

    public boolean hasIdFilter() {
        return filters.stream().anyMatch(IdFilter.class::isInstance);
    }

    @Override
    public String toString() {
        return OverpassWriter.write(this);
    }
}
