package org.osm.overpass.dsl;

import java.util.Objects;

/**
 * {@code (area.name)}: keeps entities inside the areas of a named set.
 * {@code (area)} reads the default set.
 */
public record AreaFilter(String binding) implements Filter {

    public AreaFilter {
        Objects.requireNonNull(binding, "Binding cannot be null");
    }
}
