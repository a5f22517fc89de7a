package org.osm.overpass.engine.compiler;

import org.osm.overpass.dsl.AreaFilter;
import org.osm.overpass.dsl.AroundFilter;
import org.osm.overpass.dsl.BoundingBoxFilter;
import org.osm.overpass.dsl.Filter;
import org.osm.overpass.dsl.IdFilter;
import org.osm.overpass.dsl.PolygonFilter;
import org.osm.overpass.engine.transpiler.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * Lowers spatial and id filters to predicates on the scanned relation.
 */
final class FilterTranslator {

    private static final Logger logger = LoggerFactory.getLogger(FilterTranslator.class);

    private final SqlDialect dialect;
    private final int srid;

    FilterTranslator(SqlDialect dialect, int srid) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.srid = srid;
    }

    /**
     * @param table    Qualifier of the scanned relation
     * @param areaView True when the table is the backend area view itself,
     *                 whose ids go through the dialect's area id rule
     */
    String translate(String table, boolean areaView, Filter filter,
            BindingEnvironment environment, CompilationState state) {
        if (filter instanceof BoundingBoxFilter box) {
            return dialect.intersectsBox(table, box, srid);
        }
        if (filter instanceof PolygonFilter polygon) {
            return dialect.withinPolygon(table, polygon.closedRing(), srid);
        }
        if (filter instanceof IdFilter ids) {
            return areaView ? dialect.areaIdIn(table, ids.ids()) : dialect.idIn(table + ".id", ids.ids());
        }
        if (filter instanceof AreaFilter area) {
            Binding binding = environment.resolve(area.binding());
            if (!binding.holdsOnlyAreas()) {
                throw new FilterApplicabilityException("(area." + area.binding() + ") needs a set of areas, but '."
                        + area.binding() + "' can hold " + describe(binding, environment));
            }
            String relation = state.readForSpatialFilter(binding);
            logger.debug("Area filter reads {}", relation);
            return dialect.withinSet(table, relation, srid);
        }
        if (filter instanceof AroundFilter around) {
            Binding binding = environment.resolve(around.binding());
            String relation = state.readForSpatialFilter(binding);
            return dialect.aroundSet(table, relation, around.radius(), srid);
        }
        throw new OverpassCompileException("Unknown filter type: " + filter.getClass().getSimpleName());
    }

    private static String describe(Binding binding, BindingEnvironment environment) {
        if (environment.isEmptySentinel(binding) || binding.kinds().isEmpty()) {
            return "nothing";
        }
        return binding.kinds().toString().toLowerCase(Locale.ROOT);
    }
}
