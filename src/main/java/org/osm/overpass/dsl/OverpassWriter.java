package org.osm.overpass.dsl;

import java.util.stream.Collectors;

/**
 * Writes an AST back to canonical Overpass QL text.
 * Parsing the written text yields an AST equal to the one written.
 */
public final class OverpassWriter {

    private OverpassWriter() {
        // Static utility class
    }

    public static String write(OverpassRequest request) {
        StringBuilder sb = new StringBuilder();
        if (request.hasMetadata()) {
            if (request.outputFormat() != null) {
                sb.append("[out:").append(request.outputFormat()).append(']');
            }
            if (request.timeoutSeconds() != null) {
                sb.append("[timeout:").append(request.timeoutSeconds()).append(']');
            }
            sb.append(";\n");
        }
        for (Statement statement : request.statements()) {
            sb.append(write(statement)).append(";\n");
        }
        return sb.toString();
    }

    /**
     * Writes one statement without its terminating semicolon.
     */
    public static String write(Statement statement) {
        if (statement instanceof EntityQuery query) {
            return writeEntityQuery(query);
        }
        if (statement instanceof Traverse traverse) {
            return source(traverse.source()) + traverse.direction().symbol()
                    + assignment(traverse.assignment());
        }
        if (statement instanceof UnionQuery union) {
            return union.members().stream()
                    .map(member -> write(member) + ";")
                    .collect(Collectors.joining(" ", "(", ")"))
                    + assignment(union.assignment());
        }
        if (statement instanceof Emit emit) {
            StringBuilder sb = new StringBuilder();
            if (emit.source() != null) {
                sb.append(source(emit.source())).append(' ');
            }
            sb.append("out");
            if (emit.geometry() != Emit.GeometryMode.NONE) {
                sb.append(' ').append(emit.geometry().keyword());
            }
            if (emit.detail() != Emit.DetailLevel.BODY) {
                sb.append(' ').append(emit.detail().keyword());
            }
            return sb.toString();
        }
        throw new IllegalArgumentException("Unknown statement type: " + statement.getClass().getSimpleName());
    }

    private static String writeEntityQuery(EntityQuery query) {
        StringBuilder sb = new StringBuilder(query.kind().keyword());
        sb.append(source(query.source()));
        for (Selector selector : query.selectors()) {
            sb.append(write(selector));
        }
        for (Filter filter : query.filters()) {
            sb.append(write(filter));
        }
        sb.append(assignment(query.assignment()));
        return sb.toString();
    }

    public static String write(Selector selector) {
        StringBuilder sb = new StringBuilder("[");
        if (selector.negated()) {
            sb.append('!');
        }
        sb.append(quote(selector.key()));
        if (!selector.isPresenceTest()) {
            sb.append(selector.operator().symbol());
            TagValue value = selector.value();
            sb.append(value.numeric() ? value.text() : quote(value.text()));
            if (selector.caseInsensitive()) {
                sb.append(",i");
            }
        }
        return sb.append(']').toString();
    }

    public static String write(Filter filter) {
        if (filter instanceof BoundingBoxFilter bbox) {
            return "(" + bbox.south().toPlainString() + "," + bbox.west().toPlainString() + ","
                    + bbox.north().toPlainString() + "," + bbox.east().toPlainString() + ")";
        }
        if (filter instanceof PolygonFilter poly) {
            return poly.points().stream()
                    .map(Coordinate::toString)
                    .collect(Collectors.joining(" ", "(poly:\"", "\")"));
        }
        if (filter instanceof IdFilter idFilter) {
            if (idFilter.ids().size() == 1) {
                return "(" + idFilter.ids().get(0) + ")";
            }
            return idFilter.ids().stream()
                    .map(String::valueOf)
                    .collect(Collectors.joining(",", "(id:", ")"));
        }
        if (filter instanceof AreaFilter area) {
            return "(area" + filterSource(area.binding()) + ")";
        }
        if (filter instanceof AroundFilter around) {
            return "(around" + filterSource(around.binding()) + ":" + around.radius().toPlainString() + ")";
        }
        throw new IllegalArgumentException("Unknown filter type: " + filter.getClass().getSimpleName());
    }

    private static String source(String name) {
        return name == null ? "" : "." + name;
    }

    private static String filterSource(String name) {
        return Statement.DEFAULT_SET.equals(name) ? "" : "." + name;
    }

    private static String assignment(String name) {
        return name == null ? "" : "->." + name;
    }

    /**
     * Quotes with double quotes, or single quotes when the text holds a
     * backslash-double-quote pair. Only the chosen quote character is escaped;
     * other backslash pairs are written as-is, matching how the parser reads them.
     */
    static String quote(String text) {
        char quote = text.contains("\\\"") ? '\'' : '"';
        StringBuilder sb = new StringBuilder().append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                sb.append(c).append(text.charAt(++i));
            } else if (c == quote) {
                sb.append('\\').append(c);
            } else {
                sb.append(c);
            }
        }
        return sb.append(quote).toString();
    }
}
