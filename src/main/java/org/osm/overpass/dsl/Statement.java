package org.osm.overpass.dsl;

/**
 * Sealed interface for the statements of an Overpass request.
 *
 * Type hierarchy:
 * Statement
 * ├── EntityQuery (node/way/rel/area/nwr with selectors and filters)
 * ├── Traverse (&gt;, &gt;&gt;, &lt;, &lt;&lt;)
 * ├── UnionQuery ( ... ; ... ; )
 * └── Emit (out)
 */
public sealed interface Statement permits EntityQuery, Traverse, UnionQuery, Emit {

    /**
     * Name of the default set, written {@code ._} in a query.
     */
    String DEFAULT_SET = "_";

    /**
     * @return The {@code ->.name} target, or null when the statement writes
     *         the default set
     */
    String assignment();

    default boolean isAssigned() {
        return assignment() != null && !DEFAULT_SET.equals(assignment());
    }
}
