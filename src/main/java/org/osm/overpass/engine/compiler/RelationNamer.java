package org.osm.overpass.engine.compiler;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Hands out SQL relation names that are unique within one compilation.
 * SQL folds unquoted identifiers to one case, so names differing only in
 * case count as taken.
 */
final class RelationNamer {

    private final Set<String> used = new HashSet<>();
    private int anonymous = 0;

    /**
     * @return {@code _name}, suffixed when already taken
     */
    String forSet(String setName) {
        return fresh("_" + setName);
    }

    /**
     * @return A name for an unassigned statement result: {@code __1}, {@code __2}, ...
     */
    String anonymous() {
        return fresh("__" + ++anonymous);
    }

    String fresh(String base) {
        String candidate = base;
        int suffix = 2;
        while (!used.add(candidate.toLowerCase(Locale.ROOT))) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }
}
