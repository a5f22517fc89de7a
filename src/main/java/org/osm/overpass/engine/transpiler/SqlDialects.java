package org.osm.overpass.engine.transpiler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of the supported dialects, by command-line name.
 */
public final class SqlDialects {

    private static final Map<String, SqlDialect> DIALECTS = new LinkedHashMap<>();

    static {
        DIALECTS.put("postgres", PostgresDialect.INSTANCE);
        DIALECTS.put("duckdb", DuckDbDialect.INSTANCE);
    }

    private SqlDialects() {
        // Static utility class
    }

    /**
     * @throws UnsupportedDialectException if the name matches no dialect
     */
    public static SqlDialect forName(String name) {
        SqlDialect dialect = DIALECTS.get(name);
        if (dialect == null) {
            throw new UnsupportedDialectException(name, names());
        }
        return dialect;
    }

    public static List<String> names() {
        return List.copyOf(DIALECTS.keySet());
    }
}
