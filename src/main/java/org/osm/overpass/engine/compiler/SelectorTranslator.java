package org.osm.overpass.engine.compiler;

import org.osm.overpass.dsl.Selector;
import org.osm.overpass.engine.transpiler.SqlDialect;

import java.util.Objects;

/**
 * Lowers tag selectors to predicates on the tags column.
 *
 * <pre>
 * [k]       exists(k)
 * [!k]      NOT exists(k)
 * [k=v]     (exists(k) AND get(k) = 'v')
 * [k!=v]    (NOT exists(k) OR get(k) != 'v')
 * [k~v]     (exists(k) AND get(k) matches 'v')
 * [k!~v]    (NOT exists(k) OR get(k) does not match 'v')
 * [!k=v]    NOT (exists(k) AND get(k) = 'v'), and likewise for the other operators
 * </pre>
 *
 * Values are compared as text in their lexical form, numeric or not.
 */
final class SelectorTranslator {

    private final SqlDialect dialect;

    SelectorTranslator(SqlDialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "Dialect cannot be null");
    }

    String translate(String table, Selector selector) {
        String exists = dialect.tagExists(table, selector.key());
        if (selector.isPresenceTest()) {
            return selector.negated() ? "NOT " + exists : exists;
        }

        String value = dialect.tagValue(table, selector.key());
        String text = selector.value().text();
        Selector.Operator operator = selector.operator();
        String comparison = switch (operator) {
            case EQUALS -> value + " = " + dialect.quoteStringLiteral(text);
            case NOT_EQUALS -> value + " != " + dialect.quoteStringLiteral(text);
            case MATCHES -> dialect.regexMatch(value, text, selector.caseInsensitive(), false);
            case NOT_MATCHES -> dialect.regexMatch(value, text, selector.caseInsensitive(), true);
        };
        String predicate = operator.isInverted()
                ? "(NOT " + exists + " OR " + comparison + ")"
                : "(" + exists + " AND " + comparison + ")";
        return selector.negated() ? "NOT " + predicate : predicate;
    }
}
