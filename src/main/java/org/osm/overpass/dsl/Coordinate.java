package org.osm.overpass.dsl;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A latitude/longitude pair in degrees.
 */
public record Coordinate(BigDecimal lat, BigDecimal lon) {

    public Coordinate {
        Objects.requireNonNull(lat, "Latitude cannot be null");
        Objects.requireNonNull(lon, "Longitude cannot be null");
    }

    @Override
    public String toString() {
        return lat.toPlainString() + " " + lon.toPlainString();
    }
}
