package org.osm.overpass.engine.transpiler;

import org.osm.overpass.dsl.BoundingBoxFilter;
import org.osm.overpass.dsl.Coordinate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * SQL dialect implementation for DuckDB with the spatial extension.
 *
 * Each entity kind has an id-partitioned {@code <kind>_by_id} view and a
 * geometry-sorted {@code <kind>_by_geom} view, both with a {@code bbox}
 * struct column (xmin, ymin, xmax, ymax) used to prune row groups before
 * exact spatial tests. Area views hold the native way/relation id and kind;
 * area ids are derived at query time.
 *
 * Sets read by spatial filters are materialised into temp tables, with their
 * extent and unioned geometry kept in a session variable.
 */
public final class DuckDbDialect implements SqlDialect {

    public static final DuckDbDialect INSTANCE = new DuckDbDialect();

    private static final ViewLayout VIEWS = ViewLayout.split("_by_id", "_by_geom");
    private static final AreaIdRule AREA_IDS = new AreaIdRule(AreaIdRule.OSM_RELATION_OFFSET, false);

    private DuckDbDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "duckdb";
    }

    @Override
    public ViewLayout views() {
        return VIEWS;
    }

    @Override
    public AreaIdRule areaIds() {
        return AREA_IDS;
    }

    @Override
    public Optional<String> statementTimeout(int timeoutSeconds) {
        return Optional.empty();
    }

    @Override
    public String tagExists(String table, String key) {
        return "(" + tagValue(table, key) + " IS NOT NULL)";
    }

    @Override
    public String tagValue(String table, String key) {
        return "(" + table + ".tags->>" + quoteStringLiteral(key) + ")";
    }

    @Override
    public String regexMatch(String subject, String pattern, boolean caseInsensitive, boolean negated) {
        String match = "regexp_matches(" + subject + ", " + quoteStringLiteral(pattern)
                + (caseInsensitive ? ", 'i')" : ")");
        return negated ? "NOT " + match : match;
    }

    @Override
    public String idIn(String column, List<Long> ids) {
        return ids.stream()
                .map(id -> column + " = " + id)
                .collect(Collectors.joining(" OR ", "(", ")"));
    }

    @Override
    public String intersectsBox(String table, BoundingBoxFilter box, int srid) {
        String envelope = fromWgs84("ST_MakeEnvelope(" + box.west().toPlainString() + ", "
                + box.south().toPlainString() + ", " + box.east().toPlainString() + ", "
                + box.north().toPlainString() + ")", srid);
        String intersects = "ST_Intersects(" + table + ".geom, " + envelope + ")";
        if (srid != 4326) {
            return intersects;
        }
        return extentOverlaps(table, box.west().toPlainString(), box.south().toPlainString(),
                box.east().toPlainString(), box.north().toPlainString()) + " AND " + intersects;
    }

    @Override
    public String withinPolygon(String table, List<Coordinate> ring, int srid) {
        String wkt = ring.stream()
                .map(c -> c.lon().toPlainString() + " " + c.lat().toPlainString())
                .collect(Collectors.joining(", ", "POLYGON((", "))"));
        return "ST_Within(" + table + ".geom, " + fromWgs84("ST_GeomFromText(" + quoteStringLiteral(wkt) + ")", srid) + ")";
    }

    @Override
    public String withinSet(String table, String setRelation, int srid) {
        String extent = variable(setRelation);
        return extentOverlaps(table, extent + ".xmin", extent + ".ymin", extent + ".xmax", extent + ".ymax")
                + " AND ST_Within(" + table + ".geom, " + extent + ".geom)";
    }

    @Override
    public String aroundSet(String table, String setRelation, BigDecimal radiusMeters, int srid) {
        String extent = variable(setRelation);
        return "ST_DWithin(" + toUtm(table + ".geom", extent, srid) + ", "
                + toUtm(extent + ".geom", extent, srid) + ", " + radiusMeters.toPlainString() + ")";
    }

    @Override
    public String toWgs84(String geometry, int srid) {
        return srid == 4326 ? geometry
                : "ST_Transform(" + geometry + ", 'EPSG:" + srid + "', 'EPSG:4326', always_xy := true)";
    }

    private String fromWgs84(String geometry, int srid) {
        return srid == 4326 ? geometry
                : "ST_Transform(" + geometry + ", 'EPSG:4326', 'EPSG:" + srid + "', always_xy := true)";
    }

    private String toUtm(String geometry, String extent, int srid) {
        return "ST_Transform(" + geometry + ", 'EPSG:" + srid + "', " + extent + ".utm, always_xy := true)";
    }

    @Override
    public String arrayContains(String array, String element) {
        return "list_contains(" + array + ", " + element + ")";
    }

    @Override
    public String wayNodes(String wayTable, String alias) {
        return "(SELECT unnest(" + wayTable + ".nodes) AS ref) AS " + alias;
    }

    @Override
    public String relationMembers(String relationTable, String alias) {
        return "(SELECT unnest(" + relationTable + ".members, recursive := true)) AS " + alias;
    }

    @Override
    public boolean materializesSets() {
        return true;
    }

    @Override
    public List<String> materialize(String setRelation, String definition, int srid) {
        String centroid = toWgs84("ST_Centroid(ST_Union_Agg(geom))", srid);
        // UTM zone of the set centroid, used as a metric CRS by around
        String utmZone = "'EPSG:' || CAST(CASE WHEN ST_Y(" + centroid + ") >= 0 THEN 32601 ELSE 32701 END"
                + " + least(floor((ST_X(" + centroid + ") + 180) / 6), 59) AS INTEGER)";
        return List.of(
                "CREATE OR REPLACE TEMP TABLE " + setRelation + " AS\n" + definition + ";",
                "SET VARIABLE " + setRelation + "_bbox = (\n"
                        + "    SELECT STRUCT_PACK(\n"
                        + "        xmin := min(bbox.xmin),\n"
                        + "        ymin := min(bbox.ymin),\n"
                        + "        xmax := max(bbox.xmax),\n"
                        + "        ymax := max(bbox.ymax),\n"
                        + "        geom := ST_Union_Agg(geom),\n"
                        + "        utm := " + utmZone + "\n"
                        + "    )\n"
                        + "    FROM " + setRelation + "\n"
                        + ");");
    }

    private static String variable(String setRelation) {
        return "getvariable('" + setRelation + "_bbox')";
    }

    private static String extentOverlaps(String table, String xmin, String ymin, String xmax, String ymax) {
        return table + ".bbox.xmin <= " + xmax + " AND "
                + table + ".bbox.xmax >= " + xmin + " AND "
                + table + ".bbox.ymin <= " + ymax + " AND "
                + table + ".bbox.ymax >= " + ymin;
    }
}
