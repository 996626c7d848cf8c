package io.surfworks.equigraph.config;

import java.util.List;

/**
 * Settings for the optimization driver.
 *
 * @param defaultInclude pass tags used when a caller gives no query
 * @param maxRewriteIterations sweep limit for rewrite passes built from this config
 * @param checkIntegrity whether to verify the graph's client index after every pass
 */
public record EquigraphConfig(
        List<String> defaultInclude,
        int maxRewriteIterations,
        boolean checkIntegrity
) {

    public static final List<String> DEFAULT_INCLUDE = List.of("canonicalize");
    public static final int DEFAULT_MAX_REWRITE_ITERATIONS = 32;

    public EquigraphConfig {
        defaultInclude = List.copyOf(defaultInclude);
        if (defaultInclude.isEmpty()) {
            throw new IllegalArgumentException("defaultInclude cannot be empty");
        }
        if (maxRewriteIterations < 1) {
            throw new IllegalArgumentException(
                    "maxRewriteIterations must be positive: " + maxRewriteIterations);
        }
    }

    /**
     * Returns the built-in defaults.
     */
    public static EquigraphConfig defaults() {
        return new EquigraphConfig(DEFAULT_INCLUDE, DEFAULT_MAX_REWRITE_ITERATIONS, false);
    }

    public EquigraphConfig withDefaultInclude(List<String> include) {
        return new EquigraphConfig(include, maxRewriteIterations, checkIntegrity);
    }

    public EquigraphConfig withMaxRewriteIterations(int iterations) {
        return new EquigraphConfig(defaultInclude, iterations, checkIntegrity);
    }

    public EquigraphConfig withCheckIntegrity(boolean check) {
        return new EquigraphConfig(defaultInclude, maxRewriteIterations, check);
    }
}
