package org.osm.overpass.engine.compiler;

/**
 * Settings of a compilation that do not come from the query.
 *
 * @param srid                  SRID of the geometry columns of the backend views
 * @param defaultTimeoutSeconds Timeout when the request sets none
 * @param maxTimeoutSeconds     Upper bound for any requested timeout
 */
public record CompilerOptions(int srid, int defaultTimeoutSeconds, int maxTimeoutSeconds) {

    public static final int WGS84 = 4326;
    public static final int DEFAULT_TIMEOUT_SECONDS = 180;
    public static final int MAX_TIMEOUT_SECONDS = 500;

    public CompilerOptions {
        if (srid <= 0) {
            throw new IllegalArgumentException("SRID must be positive: " + srid);
        }
        if (defaultTimeoutSeconds <= 0 || maxTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Timeouts must be positive");
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(WGS84, DEFAULT_TIMEOUT_SECONDS, MAX_TIMEOUT_SECONDS);
    }

    /**
     * A requested timeout of 0 counts as 1 second: backends read 0 as no
     * timeout at all, which would escape the maximum.
     *
     * @param requested The {@code [timeout:N]} value, or null
     * @return The timeout to apply, between 1 second and the maximum
     */
    public int effectiveTimeout(Integer requested) {
        int timeout = requested == null ? defaultTimeoutSeconds : requested;
        return Math.max(1, Math.min(timeout, maxTimeoutSeconds));
    }
}
