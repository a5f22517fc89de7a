package org.osm.overpass.engine.compiler;

import org.osm.overpass.dsl.Emit;
import org.osm.overpass.dsl.Emit.DetailLevel;
import org.osm.overpass.engine.transpiler.SqlDialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Chooses the columns an {@code out} statement projects.
 *
 * Detail levels are cumulative:
 * ids    osm_type, id
 * skel   + type (node/way/relation/area)
 * body   + tags, nodes, members (tags is the same as body)
 * meta   + version, created
 *
 * The geometry mode adds geom, center or bounds, always in EPSG:4326.
 */
public final class OutputFormatter {

    static final String TYPE_NAME = "CASE osm_type WHEN 'n' THEN 'node' WHEN 'w' THEN 'way'"
            + " WHEN 'r' THEN 'relation' WHEN 'a' THEN 'area' END AS type";

    private final SqlDialect dialect;
    private final int srid;

    public OutputFormatter(SqlDialect dialect, int srid) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.srid = srid;
    }

    public List<String> columns(Emit emit) {
        List<String> columns = new ArrayList<>(List.of("osm_type", "id"));
        DetailLevel detail = emit.detail();
        if (detail.includes(DetailLevel.SKEL)) {
            columns.add(TYPE_NAME);
        }
        if (detail.includes(DetailLevel.BODY)) {
            columns.addAll(List.of("tags", "nodes", "members"));
        }
        if (detail.includes(DetailLevel.META)) {
            columns.addAll(List.of("version", "created"));
        }

        String geometry = dialect.toWgs84("geom", srid);
        switch (emit.geometry()) {
            case GEOM -> columns.add(geometry + " AS geom");
            case CENTER -> columns.add("ST_Centroid(" + geometry + ") AS center");
            case BB -> columns.add("ST_Envelope(" + geometry + ") AS bounds");
            case NONE -> {
                // no geometry column
            }
        }
        return columns;
    }

    /**
     * @return The terminal SELECT reading the set's relation, without WITH clause
     */
    public String select(Emit emit, String relation) {
        return "SELECT " + String.join(", ", columns(emit)) + " FROM " + relation;
    }
}
