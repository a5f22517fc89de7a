package org.osm.overpass.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * A tag selector: {@code [k]}, {@code [!k]}, {@code [k=v]}, {@code [k!=v]},
 * {@code [k~re]}, {@code [k!~re]} or {@code [k~re,i]}, each optionally negated
 * as a whole with a leading {@code !}.
 *
 * @param key             The tag key
 * @param negated         True for a leading {@code !}: {@code [!k]}, {@code [!k=v]}, ...
 * @param operator        The comparison, or null for a presence test
 * @param value           The compared value, null exactly when operator is null
 * @param caseInsensitive True for the {@code ,i} flag on regex operators
 */
public record Selector(
        String key,
        boolean negated,
        Operator operator,
        TagValue value,
        boolean caseInsensitive) {

    public Selector {
        Objects.requireNonNull(key, "Tag key cannot be null");
        if ((operator == null) != (value == null)) {
            throw new IllegalArgumentException("Operator and value must be given together for key " + key);
        }
        if (caseInsensitive && (operator == null || !operator.isRegex())) {
            throw new IllegalArgumentException("Case-insensitive flag needs a regex operator for key " + key);
        }
    }

    public static Selector exists(String key) {
        return new Selector(key, false, null, null, false);
    }

    public static Selector notExists(String key) {
        return new Selector(key, true, null, null, false);
    }

    public static Selector compare(String key, Operator operator, TagValue value) {
        return new Selector(key, false, operator, value, false);
    }

    public boolean isPresenceTest() {
        return operator == null;
    }

    /**
     * Evaluates the selector against the tags of one entity, with the same
     * truth table as the SQL it compiles to.
     *
     * @param tags The entity's tags
     * @return Empty when the selector rejects the tags; otherwise this
     *         selector's key when the entity has it, nothing when the
     *         selector matched a missing key or is negated
     */
    public Optional<List<String>> matches(Map<String, String> tags) {
        Objects.requireNonNull(tags, "Tags cannot be null");
        String actual = tags.get(key);
        boolean matched;
        if (isPresenceTest()) {
            matched = actual != null;
        } else if (actual == null) {
            matched = operator.isInverted();
        } else {
            boolean hit = switch (operator) {
                case EQUALS, NOT_EQUALS -> actual.equals(value.text());
                case MATCHES, NOT_MATCHES -> pattern().matcher(actual).find();
            };
            matched = hit != operator.isInverted();
        }
        if (matched == negated) {
            return Optional.empty();
        }
        return Optional.of(actual != null && !negated ? List.of(key) : List.of());
    }

    /**
     * Evaluates a selector list: every selector must match.
     *
     * @return Empty when one selector rejects the tags; otherwise the matched
     *         keys, sorted and without duplicates
     */
    public static Optional<List<String>> matchesAll(List<Selector> selectors, Map<String, String> tags) {
        TreeSet<String> keys = new TreeSet<>();
        for (Selector selector : selectors) {
            Optional<List<String>> matched = selector.matches(tags);
            if (matched.isEmpty()) {
                return Optional.empty();
            }
            keys.addAll(matched.get());
        }
        return Optional.of(new ArrayList<>(keys));
    }

    private Pattern pattern() {
        return caseInsensitive
                ? Pattern.compile(value.text(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                : Pattern.compile(value.text());
    }

    public enum Operator {
        EQUALS("=", false, false),
        NOT_EQUALS("!=", false, true),
        MATCHES("~", true, false),
        NOT_MATCHES("!~", true, true);

        private final String symbol;
        private final boolean regex;
        private final boolean inverted;

        Operator(String symbol, boolean regex, boolean inverted) {
            this.symbol = symbol;
            this.regex = regex;
            this.inverted = inverted;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isRegex() {
            return regex;
        }

        /**
         * Inverted operators also match entities that lack the key.
         */
        public boolean isInverted() {
            return inverted;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator operator : values()) {
                if (operator.symbol.equals(symbol)) {
                    return operator;
                }
            }
            throw new IllegalArgumentException("Unknown selector operator: " + symbol);
        }
    }
}
