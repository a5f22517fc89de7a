package org.osm.overpass.engine.compiler;

/**
 * Thrown when a filter cannot apply to the set it references,
 * e.g. {@code (area.a)} where {@code .a} may hold something other than areas.
 */
public class FilterApplicabilityException extends OverpassCompileException {

    public FilterApplicabilityException(String message) {
        super(message);
    }
}
