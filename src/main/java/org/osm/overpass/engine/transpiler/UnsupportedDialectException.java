package org.osm.overpass.engine.transpiler;

import java.util.List;

/**
 * Thrown when a dialect name matches no known backend.
 */
public class UnsupportedDialectException extends RuntimeException {

    private final String dialectName;

    public UnsupportedDialectException(String dialectName, List<String> supported) {
        super("Unsupported dialect '" + dialectName + "', expected one of " + String.join(", ", supported));
        this.dialectName = dialectName;
    }

    public String getDialectName() {
        return dialectName;
    }
}
