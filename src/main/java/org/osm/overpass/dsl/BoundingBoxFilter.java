package org.osm.overpass.dsl;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * {@code (south, west, north, east)} in degrees, in the order Overpass writes it.
 */
public record BoundingBoxFilter(
        BigDecimal south,
        BigDecimal west,
        BigDecimal north,
        BigDecimal east) implements Filter {

    public BoundingBoxFilter {
        Objects.requireNonNull(south, "South cannot be null");
        Objects.requireNonNull(west, "West cannot be null");
        Objects.requireNonNull(north, "North cannot be null");
        Objects.requireNonNull(east, "East cannot be null");
    }
}
