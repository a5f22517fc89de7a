package org.osm.overpass.engine.compiler;

import java.util.List;
import java.util.Objects;

/**
 * The SQL statements compiled from one request, in execution order:
 * session settings, set materialisations, then one SELECT per {@code out}.
 */
public record SqlScript(List<String> statements) {

    public SqlScript {
        statements = List.copyOf(Objects.requireNonNull(statements, "Statements cannot be null"));
    }

    /**
     * @return The statements separated by blank lines
     */
    public String toSql() {
        return String.join("\n\n", statements) + "\n";
    }

    @Override
    public String toString() {
        return toSql();
    }
}
