package org.osm.overpass.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@code (poly:"lat lon lat lon ...")}.
 *
 * @param points The polygon vertices in query order; the ring is not closed
 */
public record PolygonFilter(List<Coordinate> points) implements Filter {

    public PolygonFilter {
        points = List.copyOf(Objects.requireNonNull(points, "Points cannot be null"));
        if (points.size() < 3) {
            throw new IllegalArgumentException("A polygon needs at least 3 points, got " + points.size());
        }
    }

    /**
     * @return The vertices with the first point repeated at the end when the
     *         query did not already close the ring
     */
    public List<Coordinate> closedRing() {
        if (points.get(0).equals(points.get(points.size() - 1))) {
            return points;
        }
        List<Coordinate> ring = new ArrayList<>(points);
        ring.add(points.get(0));
        return List.copyOf(ring);
    }
}
