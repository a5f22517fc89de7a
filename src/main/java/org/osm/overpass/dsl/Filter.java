package org.osm.overpass.dsl;

/**
 * Sealed interface for the parenthesised filters of an entity query.
 */
public sealed interface Filter
        permits BoundingBoxFilter, PolygonFilter, IdFilter, AreaFilter, AroundFilter {
}
