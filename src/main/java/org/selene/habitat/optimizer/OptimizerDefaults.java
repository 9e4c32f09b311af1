package org.selene.habitat.optimizer;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

/**
 * Optimizer defaults resolved from system properties.
 *
 * <p>Absent, blank or unparsable values fall back to the built-in defaults.</p>
 */
@Slf4j
@UtilityClass
public final class OptimizerDefaults {
    public static final int DEFAULT_ITERATIONS = 3000;
    public static final long DEFAULT_SEED = 42L;

    static final String PROP_ITERATIONS = "selene.optimizer.iterations";
    static final String PROP_SEED = "selene.optimizer.seed";

    public static int iterations() {
        String raw = System.getProperty(PROP_ITERATIONS);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_ITERATIONS;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            if (parsed < 0) {
                log.warn("Ignoring negative {}={}; using {}", PROP_ITERATIONS, parsed, DEFAULT_ITERATIONS);
                return DEFAULT_ITERATIONS;
            }
            return parsed;
        } catch (NumberFormatException ex) {
            log.warn("Ignoring unparsable {}='{}'; using {}", PROP_ITERATIONS, raw, DEFAULT_ITERATIONS);
            return DEFAULT_ITERATIONS;
        }
    }

    public static long seed() {
        String raw = System.getProperty(PROP_SEED);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_SEED;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException ex) {
            log.warn("Ignoring unparsable {}='{}'; using {}", PROP_SEED, raw, DEFAULT_SEED);
            return DEFAULT_SEED;
        }
    }
}
