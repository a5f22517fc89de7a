package org.osm.overpass.engine.transpiler;

import org.osm.overpass.dsl.BoundingBoxFilter;
import org.osm.overpass.dsl.Coordinate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Interface defining backend-specific SQL generation.
 * Everything that depends on the backend schema or SQL flavour lives here:
 * view names, area id arithmetic, tag access, spatial predicates and the way
 * named sets are handed from one statement to the next.
 *
 * Table arguments are the qualifier to use for columns of the scanned
 * relation (a view name or a set relation name).
 */
public interface SqlDialect {

    /**
     * @return The dialect name as given on the command line
     */
    String name();

    /**
     * @return The views holding each entity kind
     */
    ViewLayout views();

    /**
     * @return How area ids are derived on this backend
     */
    AreaIdRule areaIds();

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    default String quoteStringLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * @param timeoutSeconds The effective request timeout
     * @return The statement setting the timeout, if the backend has one
     */
    Optional<String> statementTimeout(int timeoutSeconds);

    // ==================== Tags ====================

    /**
     * @return A predicate true when the row has the tag key
     */
    String tagExists(String table, String key);

    /**
     * @return An expression for the tag value as text, null when absent
     */
    String tagValue(String table, String key);

    /**
     * @param subject         A text expression
     * @param pattern         The unanchored regular expression
     * @param caseInsensitive True for the {@code ,i} flag
     * @param negated         True for a non-match
     * @return A regex match predicate
     */
    String regexMatch(String subject, String pattern, boolean caseInsensitive, boolean negated);

    // ==================== Ids ====================

    /**
     * @return A predicate true when the column equals one of the ids
     */
    String idIn(String column, List<Long> ids);

    /**
     * Area views may hold native ids; the requested area ids are then mapped
     * back to the kind and id of the way or relation through {@link #areaIds()}.
     *
     * @return A predicate selecting the requested areas from an area view
     */
    default String areaIdIn(String view, List<Long> areaIds) {
        AreaIdRule rule = areaIds();
        if (rule.viewsExposeAreaIds()) {
            return idIn(view + ".id", areaIds);
        }
        return areaIds.stream()
                .map(areaId -> "(" + view + ".osm_type = '" + (rule.isRelationArea(areaId) ? "r" : "w")
                        + "' AND " + view + ".id = " + rule.sourceId(areaId) + ")")
                .collect(Collectors.joining(" OR ", "(", ")"));
    }

    /**
     * @return The select list reading an area view with derived area ids
     */
    default String areaProjection(String view) {
        AreaIdRule rule = areaIds();
        if (rule.viewsExposeAreaIds()) {
            return view + ".*";
        }
        return view + ".* REPLACE ('a' AS osm_type, CASE " + view + ".osm_type WHEN 'r' THEN "
                + view + ".id + " + rule.relationOffset() + " ELSE " + view + ".id END AS id)";
    }

    // ==================== Geometry ====================

    /**
     * @return A predicate true when the row geometry intersects the box
     */
    String intersectsBox(String table, BoundingBoxFilter box, int srid);

    /**
     * @param ring The closed ring in EPSG:4326
     * @return A predicate true when the row geometry lies within the polygon
     */
    String withinPolygon(String table, List<Coordinate> ring, int srid);

    /**
     * @return A predicate true when the row geometry lies within the union
     *         of the geometries of a set
     */
    String withinSet(String table, String setRelation, int srid);

    /**
     * @return A predicate true when the row geometry is at most
     *         {@code radiusMeters} away from a geometry of a set
     */
    String aroundSet(String table, String setRelation, BigDecimal radiusMeters, int srid);

    /**
     * @return The expression converting a geometry in the view SRID to EPSG:4326
     */
    String toWgs84(String geometry, int srid);

    // ==================== Structure ====================

    /**
     * @return A predicate true when a bigint array/list contains the element
     */
    String arrayContains(String array, String element);

    /**
     * @return A lateral FROM item exposing the nodes of a way as {@code alias.ref}
     */
    String wayNodes(String wayTable, String alias);

    /**
     * @return A lateral FROM item exposing the members of a relation as
     *         {@code alias.ref}, {@code alias.role} and {@code alias.type}
     */
    String relationMembers(String relationTable, String alias);

    // ==================== Named sets ====================

    /**
     * Backends that scan static files cannot push a set's geometry into a
     * per-row subquery cheaply. Those sets are materialised once, before the
     * first statement filtering against them.
     *
     * @return True when sets read by spatial filters are materialised
     */
    boolean materializesSets();

    /**
     * @param setRelation The set relation name
     * @param definition  A full SELECT statement producing the set
     * @return The statements materialising the set under its relation name
     */
    List<String> materialize(String setRelation, String definition, int srid);
}
