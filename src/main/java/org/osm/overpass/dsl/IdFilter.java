package org.osm.overpass.dsl;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@code (123)} or {@code (id:1,2,3)}. A single id is a one-element list.
 */
public record IdFilter(List<Long> ids) implements Filter {

    public IdFilter {
        ids = List.copyOf(Objects.requireNonNull(ids, "Ids cannot be null"));
        if (ids.isEmpty()) {
            throw new IllegalArgumentException("An id filter needs at least one id");
        }
    }

    public static IdFilter of(long... ids) {
        return new IdFilter(Arrays.stream(ids).boxed().toList());
    }
}
