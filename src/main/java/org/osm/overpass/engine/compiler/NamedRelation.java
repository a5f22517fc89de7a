package org.osm.overpass.engine.compiler;

import java.util.List;
import java.util.Objects;

/**
 * A common table expression produced by one statement.
 *
 * @param name      The relation name
 * @param columns   Explicit column names, empty to take the query's
 * @param query     The SELECT defining the relation
 * @param recursive True when the query reads the relation itself
 */
record NamedRelation(String name, List<String> columns, String query, boolean recursive) {

    NamedRelation {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(query, "Query cannot be null");
        columns = List.copyOf(columns);
    }

    String render() {
        String head = columns.isEmpty() ? name : name + "(" + String.join(", ", columns) + ")";
        return head + " AS (\n" + indent(query) + "\n)";
    }

    static String indent(String sql) {
        return "    " + sql.replace("\n", "\n    ");
    }
}
