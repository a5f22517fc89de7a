package org.osm.overpass.engine.compiler;

import org.osm.overpass.dsl.EntityKind;
import org.osm.overpass.engine.transpiler.SqlDialect;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one compilation: the relations defined so far, the
 * statements emitted so far and the sets already materialised.
 * Union branches share it, so every relation lands in one flat WITH list.
 */
final class CompilationState {

    private final SqlDialect dialect;
    private final int srid;
    private final RelationNamer namer = new RelationNamer();
    private final Map<String, NamedRelation> relations = new LinkedHashMap<>();
    private final Set<String> materialized = new HashSet<>();
    private final List<String> statements = new ArrayList<>();
    private final Binding empty;
    private boolean emptyDefined;

    CompilationState(SqlDialect dialect, int srid) {
        this.dialect = dialect;
        this.srid = srid;
        this.empty = new Binding(namer.fresh("_empty"), Set.of());
    }

    Binding emptyBinding() {
        return empty;
    }

    RelationNamer namer() {
        return namer;
    }

    void define(String name, String query) {
        relations.put(name, new NamedRelation(name, List.of(), query, false));
    }

    void defineRecursive(String name, List<String> columns, String query) {
        relations.put(name, new NamedRelation(name, columns, query, true));
    }

    /**
     * @return The relation holding the set's rows
     */
    String read(Binding binding) {
        if (binding == empty && !emptyDefined) {
            String view = dialect.views().lookup(EntityKind.ANY);
            define(empty.relation(), "SELECT " + view + ".* FROM " + view + " WHERE false");
            emptyDefined = true;
        }
        return binding.relation();
    }

    /**
     * Reads a set for a spatial filter, materialising it first when the
     * dialect needs that.
     */
    String readForSpatialFilter(Binding binding) {
        String relation = read(binding);
        if (dialect.materializesSets() && !materialized.contains(relation)) {
            String definition = withClause(relation) + "SELECT * FROM " + relation;
            statements.addAll(dialect.materialize(relation, definition, srid));
            relations.remove(relation);
            materialized.add(relation);
        }
        return relation;
    }

    void addStatement(String sql) {
        statements.add(sql);
    }

    /**
     * @return A complete statement running the SELECT against every relation
     *         defined so far
     */
    String statement(String select) {
        return withClause(null) + select + ";";
    }

    List<String> statements() {
        return statements;
    }

    private String withClause(String upTo) {
        List<NamedRelation> included = new ArrayList<>();
        for (NamedRelation relation : relations.values()) {
            included.add(relation);
            if (relation.name().equals(upTo)) {
                break;
            }
        }
        if (included.isEmpty()) {
            return "";
        }
        boolean recursive = included.stream().anyMatch(NamedRelation::recursive);
        StringBuilder sb = new StringBuilder(recursive ? "WITH RECURSIVE\n" : "WITH\n");
        for (int i = 0; i < included.size(); i++) {
            sb.append(included.get(i).render()).append(i < included.size() - 1 ? ",\n" : "\n");
        }
        return sb.toString();
    }
}
