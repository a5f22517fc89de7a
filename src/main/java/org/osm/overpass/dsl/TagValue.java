package org.osm.overpass.dsl;

import java.util.Objects;

/**
 * A selector value as written in the query.
 * Numeric values keep their lexical form; {@code 1.50} is not {@code 1.5}.
 *
 * @param text    The unquoted, unescaped value
 * @param numeric True when the value was an unquoted integer or decimal
 */
public record TagValue(String text, boolean numeric) {

    public TagValue {
        Objects.requireNonNull(text, "Tag value cannot be null");
    }

    public static TagValue string(String text) {
        return new TagValue(text, false);
    }

    public static TagValue number(String text) {
        return new TagValue(text, true);
    }
}
