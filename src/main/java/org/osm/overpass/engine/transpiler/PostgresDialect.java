package org.osm.overpass.engine.transpiler;

import org.osm.overpass.dsl.BoundingBoxFilter;
import org.osm.overpass.dsl.Coordinate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * SQL dialect implementation for PostgreSQL with PostGIS.
 * One plain view per entity kind; tags are jsonb; area views already carry
 * derived area ids.
 */
public final class PostgresDialect implements SqlDialect {

    public static final PostgresDialect INSTANCE = new PostgresDialect();

    private static final ViewLayout VIEWS = ViewLayout.unified();
    private static final AreaIdRule AREA_IDS = new AreaIdRule(AreaIdRule.OSM_RELATION_OFFSET, true);

    private PostgresDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "postgres";
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
        // statement_timeout is in milliseconds
        return Optional.of("SET statement_timeout = " + (timeoutSeconds * 1000L) + ";");
    }

    @Override
    public String tagExists(String table, String key) {
        return table + ".tags?" + quoteStringLiteral(key);
    }

    @Override
    public String tagValue(String table, String key) {
        return table + ".tags->>" + quoteStringLiteral(key);
    }

    @Override
    public String regexMatch(String subject, String pattern, boolean caseInsensitive, boolean negated) {
        String operator = (negated ? "!~" : "~") + (caseInsensitive ? "*" : "");
        return subject + " " + operator + " " + quoteStringLiteral(pattern);
    }

    @Override
    public String idIn(String column, List<Long> ids) {
        return column + " = ANY (ARRAY[" + ids.stream().map(String::valueOf).collect(Collectors.joining(", ")) + "])";
    }

    @Override
    public String intersectsBox(String table, BoundingBoxFilter box, int srid) {
        String envelope = "ST_MakeEnvelope(" + box.west().toPlainString() + ", " + box.south().toPlainString() + ", "
                + box.east().toPlainString() + ", " + box.north().toPlainString() + ", 4326)";
        return "ST_Intersects(" + table + ".geom, " + fromWgs84(envelope, srid) + ")";
    }

    @Override
    public String withinPolygon(String table, List<Coordinate> ring, int srid) {
        String wkt = ring.stream()
                .map(c -> c.lon().toPlainString() + " " + c.lat().toPlainString())
                .collect(Collectors.joining(", ", "POLYGON((", "))"));
        String polygon = "ST_GeomFromText(" + quoteStringLiteral(wkt) + ", 4326)";
        return "ST_Within(" + table + ".geom, " + fromWgs84(polygon, srid) + ")";
    }

    @Override
    public String withinSet(String table, String setRelation, int srid) {
        return "ST_Within(" + table + ".geom, (SELECT ST_Union(" + setRelation + ".geom) FROM " + setRelation + "))";
    }

    @Override
    public String aroundSet(String table, String setRelation, BigDecimal radiusMeters, int srid) {
        return "EXISTS (SELECT 1 FROM " + setRelation + " AS core WHERE ST_DWithin("
                + toWgs84("core.geom", srid) + "::geography, "
                + toWgs84(table + ".geom", srid) + "::geography, "
                + radiusMeters.toPlainString() + "))";
    }

    @Override
    public String toWgs84(String geometry, int srid) {
        return srid == 4326 ? geometry : "ST_Transform(" + geometry + ", 4326)";
    }

    private String fromWgs84(String geometry, int srid) {
        return srid == 4326 ? geometry : "ST_Transform(" + geometry + ", " + srid + ")";
    }

    @Override
    public String arrayContains(String array, String element) {
        return element + " = ANY (" + array + ")";
    }

    @Override
    public String wayNodes(String wayTable, String alias) {
        return "unnest(" + wayTable + ".nodes) AS " + alias + "(ref)";
    }

    @Override
    public String relationMembers(String relationTable, String alias) {
        return "jsonb_to_recordset(" + relationTable + ".members) AS " + alias + "(ref bigint, role text, type text)";
    }

    @Override
    public boolean materializesSets() {
        return false;
    }

    @Override
    public List<String> materialize(String setRelation, String definition, int srid) {
        throw new UnsupportedOperationException("PostgreSQL reads sets through subqueries");
    }
}
