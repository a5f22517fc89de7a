package org.osm.overpass.engine.compiler;

import org.osm.overpass.dsl.EntityKind;
import org.osm.overpass.dsl.Traverse.Direction;
import org.osm.overpass.engine.transpiler.SqlDialect;
import org.osm.overpass.engine.transpiler.ViewLayout;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Lowers recursion statements.
 *
 * One level ({@code >}, {@code <}) joins the input set with way node lists
 * and relation member lists. All levels ({@code >>}, {@code <<}) build a
 * recursive closure of (osm_type, id) keys seeded with the input set itself,
 * then join the keys back to the lookup view. The seed makes the closure
 * reflexive, so walking it again adds nothing.
 */
final class TraversalTranslator {

    private static final String DEDUPLICATE_HEAD = "SELECT DISTINCT ON (osm_type, id) * FROM (\n";
    private static final String DEDUPLICATE_TAIL = "\n) AS t\nORDER BY osm_type, id";

    private final SqlDialect dialect;

    TraversalTranslator(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    /**
     * @return The query for a one-level walk from the input relation
     */
    String oneLevel(Direction direction, String input) {
        if (direction.isTransitive()) {
            throw new IllegalArgumentException("Not a one-level walk: " + direction.symbol());
        }
        return direction.isDown() ? children(input) : parents(input);
    }

    private String children(String input) {
        ViewLayout views = dialect.views();
        String wayNodes = "SELECT c.* FROM " + input + " AS p JOIN " + views.lookup(EntityKind.NODE)
                + " AS c ON " + dialect.arrayContains("p.nodes", "c.id") + " WHERE p.osm_type = 'w'";
        return DEDUPLICATE_HEAD
                + NamedRelation.indent(wayNodes
                        + "\nUNION ALL\n" + memberRows(input, EntityKind.NODE)
                        + "\nUNION ALL\n" + memberRows(input, EntityKind.WAY)
                        + "\nUNION ALL\n" + memberRows(input, EntityKind.RELATION))
                + DEDUPLICATE_TAIL;
    }

    private String memberRows(String input, EntityKind kind) {
        return "SELECT c.* FROM " + input + " AS p"
                + " JOIN LATERAL " + dialect.relationMembers("p", "m") + " ON true"
                + " JOIN " + dialect.views().lookup(kind) + " AS c ON c.id = m.ref"
                + " WHERE p.osm_type = 'r' AND m.type = '" + kind.typeCode() + "'";
    }

    private String parents(String input) {
        ViewLayout views = dialect.views();
        String ways = "SELECT p.* FROM " + views.lookup(EntityKind.WAY) + " AS p JOIN " + input
                + " AS c ON c.osm_type = 'n' AND " + dialect.arrayContains("p.nodes", "c.id");
        String relations = "SELECT p.* FROM " + views.lookup(EntityKind.RELATION) + " AS p"
                + " JOIN LATERAL " + dialect.relationMembers("p", "m") + " ON true"
                + " JOIN " + input + " AS c ON c.osm_type = m.type AND c.id = m.ref";
        return DEDUPLICATE_HEAD + NamedRelation.indent(ways + "\nUNION ALL\n" + relations) + DEDUPLICATE_TAIL;
    }

    /**
     * @param closure The name of the recursive relation this query defines
     * @return The recursive query of (osm_type, id) keys reachable from the input
     */
    String closure(Direction direction, String input, String closure) {
        if (!direction.isTransitive()) {
            throw new IllegalArgumentException("Not a transitive walk: " + direction.symbol());
        }
        String seed = "SELECT CAST(i.osm_type AS TEXT) AS osm_type, i.id FROM " + input
                + " AS i WHERE i.osm_type IN ('n', 'w', 'r')";
        String step = direction.isDown() ? childKeys() : parentKeys();
        return seed
                + "\nUNION\n"
                + "SELECT s.osm_type, s.id FROM " + closure + " AS k JOIN LATERAL (\n"
                + NamedRelation.indent(step)
                + "\n) AS s ON true";
    }

    private String childKeys() {
        ViewLayout views = dialect.views();
        return "SELECT CAST('n' AS TEXT) AS osm_type, x.ref AS id FROM " + views.lookup(EntityKind.WAY) + " AS p"
                + " JOIN LATERAL " + dialect.wayNodes("p", "x") + " ON true"
                + " WHERE k.osm_type = 'w' AND p.id = k.id"
                + "\nUNION ALL\n"
                + "SELECT m.type AS osm_type, m.ref AS id FROM " + views.lookup(EntityKind.RELATION) + " AS p"
                + " JOIN LATERAL " + dialect.relationMembers("p", "m") + " ON true"
                + " WHERE k.osm_type = 'r' AND p.id = k.id";
    }

    private String parentKeys() {
        ViewLayout views = dialect.views();
        return "SELECT CAST('w' AS TEXT) AS osm_type, p.id FROM " + views.lookup(EntityKind.WAY) + " AS p"
                + " WHERE k.osm_type = 'n' AND " + dialect.arrayContains("p.nodes", "k.id")
                + "\nUNION ALL\n"
                + "SELECT CAST('r' AS TEXT) AS osm_type, p.id FROM " + views.lookup(EntityKind.RELATION) + " AS p"
                + " JOIN LATERAL " + dialect.relationMembers("p", "m") + " ON true"
                + " WHERE m.type = k.osm_type AND m.ref = k.id";
    }

    /**
     * @return The rows of the entities whose keys the closure holds
     */
    String closureRows(String closure) {
        String view = dialect.views().lookup(EntityKind.ANY);
        return "SELECT v.* FROM " + closure + " AS k JOIN " + view
                + " AS v ON v.osm_type = k.osm_type AND v.id = k.id";
    }

    /**
     * @return The kinds a walk can reach from a set holding the given kinds
     */
    static Set<EntityKind> resultKinds(Direction direction, Set<EntityKind> input) {
        Set<EntityKind> result = EnumSet.noneOf(EntityKind.class);
        if (!direction.isTransitive()) {
            return direction.isDown() ? childKinds(input) : parentKinds(input);
        }
        for (EntityKind kind : input) {
            if (kind != EntityKind.AREA) {
                result.add(kind);
            }
        }
        while (true) {
            Set<EntityKind> next = direction.isDown() ? childKinds(result) : parentKinds(result);
            if (!result.addAll(next)) {
                return result;
            }
        }
    }

    private static Set<EntityKind> childKinds(Set<EntityKind> input) {
        Set<EntityKind> kinds = EnumSet.noneOf(EntityKind.class);
        if (input.contains(EntityKind.WAY)) {
            kinds.add(EntityKind.NODE);
        }
        if (input.contains(EntityKind.RELATION)) {
            kinds.addAll(EntityKind.ANY.concreteKinds());
        }
        return kinds;
    }

    private static Set<EntityKind> parentKinds(Set<EntityKind> input) {
        Set<EntityKind> kinds = EnumSet.noneOf(EntityKind.class);
        if (input.contains(EntityKind.NODE)) {
            kinds.add(EntityKind.WAY);
        }
        if (!input.isEmpty() && !input.equals(EnumSet.of(EntityKind.AREA))) {
            kinds.add(EntityKind.RELATION);
        }
        return kinds;
    }
}
