package org.osm.overpass.dsl.antlr;

import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.osm.overpass.dsl.AreaFilter;
import org.osm.overpass.dsl.AroundFilter;
import org.osm.overpass.dsl.BoundingBoxFilter;
import org.osm.overpass.dsl.Coordinate;
import org.osm.overpass.dsl.Emit;
import org.osm.overpass.dsl.EntityKind;
import org.osm.overpass.dsl.EntityQuery;
import org.osm.overpass.dsl.Filter;
import org.osm.overpass.dsl.IdFilter;
import org.osm.overpass.dsl.OverpassParseException;
import org.osm.overpass.dsl.OverpassRequest;
import org.osm.overpass.dsl.PolygonFilter;
import org.osm.overpass.dsl.Selector;
import org.osm.overpass.dsl.Statement;
import org.osm.overpass.dsl.TagValue;
import org.osm.overpass.dsl.Traverse;
import org.osm.overpass.dsl.UnionQuery;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * ANTLR visitor that converts the OverpassQL parse tree to the request AST.
 *
 * The grammar structure:
 * - request: metadata? statement+ EOF
 * - statement: (entityQuery | traverse | union | emit) ';'
 * - entityQuery: entityKind bindingRef? (selector | filter)* assignment?
 * - union: '(' unionMember+ ')' assignment?
 */
public class OverpassAstBuilder extends OverpassQLBaseVisitor<Object> {

    // ========================================
    // ENTRY POINT - Request
    // ========================================

    @Override
    public OverpassRequest visitRequest(OverpassQLParser.RequestContext ctx) {
        String outputFormat = null;
        Integer timeout = null;
        if (ctx.metadata() != null) {
            for (OverpassQLParser.SettingContext setting : ctx.metadata().setting()) {
                if (setting instanceof OverpassQLParser.OutputFormatSettingContext out) {
                    outputFormat = out.word().getText();
                } else if (setting instanceof OverpassQLParser.TimeoutSettingContext t) {
                    timeout = parseInt(t.INTEGER());
                }
            }
        }

        List<Statement> statements = new ArrayList<>();
        for (OverpassQLParser.StatementContext statement : ctx.statement()) {
            statements.add(visitStatement(statement));
        }
        return new OverpassRequest(outputFormat, timeout, statements);
    }

    // ========================================
    // STATEMENTS
    // ========================================

    @Override
    public Statement visitStatement(OverpassQLParser.StatementContext ctx) {
        if (ctx.entityQuery() != null) {
            return visitEntityQuery(ctx.entityQuery());
        }
        if (ctx.traverse() != null) {
            return visitTraverse(ctx.traverse());
        }
        if (ctx.union() != null) {
            return visitUnion(ctx.union());
        }
        return visitEmit(ctx.emit());
    }

    @Override
    public Statement visitUnionMember(OverpassQLParser.UnionMemberContext ctx) {
        if (ctx.entityQuery() != null) {
            return visitEntityQuery(ctx.entityQuery());
        }
        if (ctx.traverse() != null) {
            return visitTraverse(ctx.traverse());
        }
        return visitUnion(ctx.union());
    }

    @Override
    public EntityQuery visitEntityQuery(OverpassQLParser.EntityQueryContext ctx) {
        EntityKind kind = EntityKind.fromKeyword(ctx.entityKind().getText());

        List<Selector> selectors = new ArrayList<>();
        for (OverpassQLParser.SelectorContext selector : ctx.selector()) {
            selectors.add(visitSelector(selector));
        }
        List<Filter> filters = new ArrayList<>();
        for (OverpassQLParser.FilterContext filter : ctx.filter()) {
            filters.add((Filter) visit(filter.filterBody()));
        }

        return new EntityQuery(kind, bindingName(ctx.bindingRef()), selectors, filters,
                assignmentName(ctx.assignment()));
    }

    @Override
    public Traverse visitTraverse(OverpassQLParser.TraverseContext ctx) {
        Traverse.Direction direction = Traverse.Direction.fromSymbol(ctx.traverseOperator().getText());
        return new Traverse(bindingName(ctx.bindingRef()), direction, assignmentName(ctx.assignment()));
    }

    @Override
    public UnionQuery visitUnion(OverpassQLParser.UnionContext ctx) {
        List<Statement> members = new ArrayList<>();
        for (OverpassQLParser.UnionMemberContext member : ctx.unionMember()) {
            members.add(visitUnionMember(member));
        }
        return new UnionQuery(members, assignmentName(ctx.assignment()));
    }

    @Override
    public Emit visitEmit(OverpassQLParser.EmitContext ctx) {
        Emit.GeometryMode geometry = ctx.geometryMode() == null
                ? Emit.GeometryMode.NONE
                : Emit.GeometryMode.fromKeyword(ctx.geometryMode().getText());
        Emit.DetailLevel detail = ctx.detailLevel() == null
                ? Emit.DetailLevel.BODY
                : Emit.DetailLevel.fromKeyword(ctx.detailLevel().getText());
        return new Emit(bindingName(ctx.bindingRef()), geometry, detail);
    }

    // ========================================
    // SELECTORS
    // ========================================

    @Override
    public Selector visitSelector(OverpassQLParser.SelectorContext ctx) {
        String key = text(ctx.key);
        if (ctx.selectorOperator() == null) {
            return ctx.NOT() != null ? Selector.notExists(key) : Selector.exists(key);
        }

        Selector.Operator operator = Selector.Operator.fromSymbol(ctx.selectorOperator().getText());
        boolean caseInsensitive = ctx.caseFlag() != null;
        if (caseInsensitive && !operator.isRegex()) {
            throw error(ctx.caseFlag().COMMA().getSymbol(),
                    "case-insensitive flag ',i' is only allowed with '~' and '!~'");
        }
        return new Selector(key, ctx.NOT() != null, operator, tagValue(ctx.value), caseInsensitive);
    }

    private TagValue tagValue(OverpassQLParser.TagValueContext ctx) {
        if (ctx.QUOTED() != null) {
            return TagValue.string(unquote(ctx.QUOTED().getText()));
        }
        if (ctx.FLOAT() != null) {
            return TagValue.number(ctx.FLOAT().getText());
        }
        OverpassQLParser.WordContext word = ctx.word();
        return word.INTEGER() != null ? TagValue.number(word.getText()) : TagValue.string(word.getText());
    }

    private String text(OverpassQLParser.TagTextContext ctx) {
        return ctx.QUOTED() != null ? unquote(ctx.QUOTED().getText()) : ctx.getText();
    }

    // ========================================
    // FILTERS
    // ========================================

    @Override
    public BoundingBoxFilter visitBoundingBoxFilter(OverpassQLParser.BoundingBoxFilterContext ctx) {
        List<OverpassQLParser.NumberContext> numbers = ctx.number();
        return new BoundingBoxFilter(
                decimal(numbers.get(0)),
                decimal(numbers.get(1)),
                decimal(numbers.get(2)),
                decimal(numbers.get(3)));
    }

    @Override
    public PolygonFilter visitPolygonFilter(OverpassQLParser.PolygonFilterContext ctx) {
        Token token = ctx.QUOTED().getSymbol();
        String body = unquote(token.getText()).trim();
        String[] parts = body.isEmpty() ? new String[0] : body.split("\\s+");
        if (parts.length % 2 != 0) {
            throw error(token, "polygon needs an even number of coordinates, got " + parts.length);
        }
        if (parts.length < 6) {
            throw error(token, "polygon needs at least 3 points, got " + parts.length / 2);
        }
        List<Coordinate> points = new ArrayList<>();
        for (int i = 0; i < parts.length; i += 2) {
            try {
                points.add(new Coordinate(new BigDecimal(parts[i]), new BigDecimal(parts[i + 1])));
            } catch (NumberFormatException e) {
                throw error(token, "invalid polygon coordinate '" + parts[i] + " " + parts[i + 1] + "'");
            }
        }
        return new PolygonFilter(points);
    }

    @Override
    public IdFilter visitIdFilter(OverpassQLParser.IdFilterContext ctx) {
        return new IdFilter(List.of(parseLong(ctx.INTEGER())));
    }

    @Override
    public IdFilter visitIdListFilter(OverpassQLParser.IdListFilterContext ctx) {
        List<Long> ids = new ArrayList<>();
        for (TerminalNode id : ctx.INTEGER()) {
            ids.add(parseLong(id));
        }
        return new IdFilter(ids);
    }

    @Override
    public AreaFilter visitAreaFilter(OverpassQLParser.AreaFilterContext ctx) {
        return new AreaFilter(filterSource(ctx.bindingRef()));
    }

    @Override
    public AroundFilter visitAroundFilter(OverpassQLParser.AroundFilterContext ctx) {
        BigDecimal radius = decimal(ctx.number());
        if (radius.signum() < 0) {
            throw error(ctx.number().getStart(), "around radius cannot be negative");
        }
        return new AroundFilter(filterSource(ctx.bindingRef()), radius);
    }

    // ========================================
    // HELPERS
    // ========================================

    private static String bindingName(OverpassQLParser.BindingRefContext ctx) {
        return ctx == null ? null : ctx.bindingName().getText();
    }

    private static String filterSource(OverpassQLParser.BindingRefContext ctx) {
        return ctx == null ? Statement.DEFAULT_SET : ctx.bindingName().getText();
    }

    private static String assignmentName(OverpassQLParser.AssignmentContext ctx) {
        return ctx == null ? null : ctx.bindingName().getText();
    }

    private static BigDecimal decimal(OverpassQLParser.NumberContext ctx) {
        return new BigDecimal(ctx.getText());
    }

    private static int parseInt(TerminalNode node) {
        try {
            return Integer.parseInt(node.getText());
        } catch (NumberFormatException e) {
            throw error(node.getSymbol(), "number out of range: " + node.getText());
        }
    }

    private static long parseLong(TerminalNode node) {
        try {
            return Long.parseLong(node.getText());
        } catch (NumberFormatException e) {
            throw error(node.getSymbol(), "id out of range: " + node.getText());
        }
    }

    /**
     * Strips the surrounding quotes and decodes escaped quote characters.
     * Any other backslash sequence is kept as written, so regex escapes such
     * as {@code \d} reach the backend untouched.
     */
    static String unquote(String quoted) {
        char quote = quoted.charAt(0);
        String body = quoted.substring(1, quoted.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(i + 1);
                if (next != quote) {
                    sb.append(c);
                }
                sb.append(next);
                i++;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static OverpassParseException error(Token token, String message) {
        return new OverpassParseException(message, token.getLine(), token.getCharPositionInLine(),
                token.getStartIndex(), List.of());
    }
}
