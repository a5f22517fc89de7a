package org.osm.overpass.dsl;

import java.util.List;
import java.util.Objects;

/**
 * A parsed Overpass request: the optional header settings followed by the
 * statements in textual order.
 *
 * <pre>
 * [out:json][timeout:25];
 * area(3600166718)->.a;
 * nwr.a["tourism"="information"];
 * out center meta;
 * </pre>
 *
 * @param outputFormat   The {@code [out:...]} format tag, or null when absent
 * @param timeoutSeconds The {@code [timeout:...]} value, or null when absent
 * @param statements     The statements, never empty
 */
public record OverpassRequest(
        String outputFormat,
        Integer timeoutSeconds,
        List<Statement> statements) {

    public OverpassRequest {
        Objects.requireNonNull(statements, "Statements cannot be null");
        if (statements.isEmpty()) {
            throw new IllegalArgumentException("A request needs at least one statement");
        }
        statements = List.copyOf(statements);
    }

    public boolean hasMetadata() {
        return outputFormat != null || timeoutSeconds != null;
    }

    /**
     * @return The out statements of the request, in output order
     */
    public List<Emit> emits() {
        return statements.stream()
                .filter(Emit.class::isInstance)
                .map(Emit.class::cast)
                .toList();
    }
}
