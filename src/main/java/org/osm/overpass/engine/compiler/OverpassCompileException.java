package org.osm.overpass.engine.compiler;

/**
 * Exception thrown when a syntactically valid request cannot be lowered to SQL.
 */
public class OverpassCompileException extends RuntimeException {

    public OverpassCompileException(String message) {
        super(message);
    }

    public OverpassCompileException(String message, Throwable cause) {
        super(message, cause);
    }
}
