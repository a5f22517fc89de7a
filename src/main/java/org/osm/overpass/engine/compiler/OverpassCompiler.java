package org.osm.overpass.engine.compiler;

import org.osm.overpass.dsl.AreaFilter;
import org.osm.overpass.dsl.Emit;
import org.osm.overpass.dsl.EntityKind;
import org.osm.overpass.dsl.EntityQuery;
import org.osm.overpass.dsl.Filter;
import org.osm.overpass.dsl.OverpassRequest;
import org.osm.overpass.dsl.Selector;
import org.osm.overpass.dsl.Statement;
import org.osm.overpass.dsl.Traverse;
import org.osm.overpass.dsl.UnionQuery;
import org.osm.overpass.dsl.antlr.AntlrOverpassParserAdapter;
import org.osm.overpass.engine.transpiler.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles Overpass requests into SQL for one backend dialect.
 *
 * Statements compile in textual order. Each set-producing statement becomes a
 * named relation (a CTE, or a temp table on dialects that materialise sets)
 * and is bound to its {@code ->.name} target or to the default set. Each
 * {@code out} becomes one terminal SELECT over every relation defined so far.
 *
 * Instances are immutable; every call to {@link #compile} owns its state.
 */
public final class OverpassCompiler {

    private static final Logger logger = LoggerFactory.getLogger(OverpassCompiler.class);

    private final SqlDialect dialect;
    private final CompilerOptions options;
    private final SelectorTranslator selectors;
    private final FilterTranslator filters;
    private final TraversalTranslator traversals;
    private final OutputFormatter formatter;

    public OverpassCompiler(SqlDialect dialect) {
        this(dialect, CompilerOptions.defaults());
    }

    public OverpassCompiler(SqlDialect dialect, CompilerOptions options) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.selectors = new SelectorTranslator(dialect);
        this.filters = new FilterTranslator(dialect, options.srid());
        this.traversals = new TraversalTranslator(dialect);
        this.formatter = new OutputFormatter(dialect, options.srid());
    }

    /**
     * Parses and compiles an Overpass query.
     *
     * @throws org.osm.overpass.dsl.OverpassParseException if the query is not valid Overpass QL
     * @throws OverpassCompileException if the query cannot be lowered to SQL
     */
    public SqlScript compile(String query) {
        return compile(AntlrOverpassParserAdapter.parse(query));
    }

    /**
     * Compiles a parsed request. Either every statement compiles or an
     * exception is thrown; no partial script is returned.
     */
    public SqlScript compile(OverpassRequest request) {
        CompilationState state = new CompilationState(dialect, options.srid());
        BindingEnvironment environment = new BindingEnvironment(state.emptyBinding());

        int timeout = options.effectiveTimeout(request.timeoutSeconds());
        dialect.statementTimeout(timeout).ifPresent(state::addStatement);

        for (Statement statement : request.statements()) {
            if (statement instanceof Emit emit) {
                compileEmit(emit, environment, state);
            } else {
                compileSet(statement, environment, state);
            }
        }

        logger.debug("Compiled {} statements into {} SQL statements for {}",
                request.statements().size(), state.statements().size(), dialect.name());
        return new SqlScript(state.statements());
    }

    // ==================== Set statements ====================

    private Binding compileSet(Statement statement, BindingEnvironment environment, CompilationState state) {
        Binding result;
        if (statement instanceof EntityQuery query) {
            result = compileEntityQuery(query, environment, state);
        } else if (statement instanceof Traverse traverse) {
            result = compileTraverse(traverse, environment, state);
        } else if (statement instanceof UnionQuery union) {
            result = compileUnion(union, environment, state);
        } else {
            throw new OverpassCompileException("Cannot compile statement to a set: " + statement);
        }

        environment.define(statement.assignment() == null ? Statement.DEFAULT_SET : statement.assignment(), result);
        logger.debug("Compiled '{}' into {}", statement, result);
        return result;
    }

    private Binding compileEntityQuery(EntityQuery query, BindingEnvironment environment, CompilationState state) {
        EntityKind kind = query.kind();
        List<Filter> queryFilters = new ArrayList<>();
        List<String> predicates = new ArrayList<>();
        String table;
        String projection;
        Set<EntityKind> kinds;
        boolean areaView;

        Binding source = query.source() == null ? null : environment.resolve(query.source());
        if (source != null && kind != EntityKind.AREA && source.holdsOnlyAreas()) {
            // areas as input select what lies inside them: nwr.a is nwr(area.a)
            queryFilters.add(new AreaFilter(query.source()));
            source = null;
        }
        queryFilters.addAll(query.filters());

        if (source != null) {
            table = state.read(source);
            projection = table + ".*";
            areaView = false;
            kinds = EnumSet.noneOf(EntityKind.class);
            kinds.addAll(source.kinds());
            kinds.retainAll(kind.concreteKinds());
            if (!kind.concreteKinds().containsAll(source.kinds())) {
                predicates.add(kindCheck(table, kind));
            }
        } else {
            table = dialect.views().view(kind, query.hasIdFilter());
            areaView = kind == EntityKind.AREA;
            projection = areaView ? dialect.areaProjection(table) : table + ".*";
            kinds = kind.concreteKinds();
        }

        for (Selector selector : query.selectors()) {
            predicates.add(selectors.translate(table, selector));
        }
        for (Filter filter : queryFilters) {
            predicates.add(filters.translate(table, areaView, filter, environment, state));
        }

        String sql = "SELECT " + projection + " FROM " + table;
        if (!predicates.isEmpty()) {
            sql += "\nWHERE " + String.join("\n  AND ", predicates);
        }
        String relation = relationName(query, state);
        state.define(relation, sql);
        return new Binding(relation, kinds);
    }

    private Binding compileTraverse(Traverse traverse, BindingEnvironment environment, CompilationState state) {
        Binding input = traverse.source() == null
                ? environment.defaultBinding()
                : environment.resolve(traverse.source());
        String inputRelation = state.read(input);
        String relation = relationName(traverse, state);
        Traverse.Direction direction = traverse.direction();

        if (direction.isTransitive()) {
            String closure = state.namer().fresh(relation + "_closure");
            state.defineRecursive(closure, List.of("osm_type", "id"),
                    traversals.closure(direction, inputRelation, closure));
            state.define(relation, traversals.closureRows(closure));
        } else {
            state.define(relation, traversals.oneLevel(direction, inputRelation));
        }
        return new Binding(relation, TraversalTranslator.resultKinds(direction, input.kinds()));
    }

    /**
     * Every member compiles against its own copy of the environment. The
     * result is the union of the member results, deduplicated by kind and id.
     * Named sets assigned inside the members become visible afterwards, later
     * members winning.
     *
     * Members do not see each other's results through the default set: in
     * {@code (way[highway]; >;)} the recursion starts from the default set as
     * it was before the union, not from the ways. Overpass itself chains the
     * default set from one member to the next; write
     * {@code way[highway]->.w; (way.w; .w >;);} to get that result here.
     */
    private Binding compileUnion(UnionQuery union, BindingEnvironment environment, CompilationState state) {
        List<String> memberRelations = new ArrayList<>();
        List<BindingEnvironment> branches = new ArrayList<>();
        Set<EntityKind> kinds = EnumSet.noneOf(EntityKind.class);

        for (Statement member : union.members()) {
            BindingEnvironment branch = environment.copy();
            Binding result = compileSet(member, branch, state);
            memberRelations.add(state.read(result));
            kinds.addAll(result.kinds());
            branches.add(branch);
        }

        for (BindingEnvironment branch : branches) {
            for (Map.Entry<String, Binding> assignment : branch.assignments().entrySet()) {
                environment.define(assignment.getKey(), assignment.getValue());
            }
        }

        String members = memberRelations.stream()
                .map(relation -> "SELECT * FROM " + relation)
                .collect(Collectors.joining("\nUNION ALL\n"));
        String sql = "SELECT DISTINCT ON (osm_type, id) * FROM (\n"
                + NamedRelation.indent(members)
                + "\n) AS t\nORDER BY osm_type, id";
        String relation = relationName(union, state);
        state.define(relation, sql);
        return new Binding(relation, kinds);
    }

    // ==================== Output ====================

    private void compileEmit(Emit emit, BindingEnvironment environment, CompilationState state) {
        Binding source = emit.source() == null
                ? environment.defaultBinding()
                : environment.resolve(emit.source());
        String relation = state.read(source);
        state.addStatement(state.statement(formatter.select(emit, relation)));
    }

    // ==================== Helpers ====================

    private static String relationName(Statement statement, CompilationState state) {
        return statement.isAssigned()
                ? state.namer().forSet(statement.assignment())
                : state.namer().anonymous();
    }

    private static String kindCheck(String table, EntityKind kind) {
        Set<EntityKind> concrete = kind.concreteKinds();
        if (concrete.size() == 1) {
            return table + ".osm_type = '" + kind.typeCode() + "'";
        }
        return concrete.stream()
                .map(k -> "'" + k.typeCode() + "'")
                .collect(Collectors.joining(", ", table + ".osm_type IN (", ")"));
    }
}
