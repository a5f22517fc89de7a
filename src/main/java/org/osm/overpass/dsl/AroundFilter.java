package org.osm.overpass.dsl;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * {@code (around.name:radius)}: keeps entities within {@code radius} metres of
 * any entity of a named set. {@code (around:radius)} reads the default set.
 */
public record AroundFilter(String binding, BigDecimal radius) implements Filter {

    public AroundFilter {
        Objects.requireNonNull(binding, "Binding cannot be null");
        Objects.requireNonNull(radius, "Radius cannot be null");
        if (radius.signum() < 0) {
            throw new IllegalArgumentException("Radius cannot be negative: " + radius.toPlainString());
        }
    }
}
