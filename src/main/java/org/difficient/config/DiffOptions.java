package org.difficient.config;

import com.typesafe.config.Config;

/**
 * Tuning options for differs and the patch engine.
 * <p>
 * Read from the {@code difficient} block of the configuration:
 * <pre>
 * difficient {
 *   sequence.max-lcs-cells = 16777216
 *   patch.fail-fast = false
 * }
 * </pre>
 *
 * @param maxLcsCells upper bound on cells of the LCS table built by a sequence differ;
 *                    larger inputs are diffed as a full replacement
 * @param failFast stop a patch at the first error instead of collecting all errors
 */
public record DiffOptions(long maxLcsCells, boolean failFast) {

    /** Configuration path of {@link #maxLcsCells}. */
    public static final String MAX_LCS_CELLS_PATH = "difficient.sequence.max-lcs-cells";

    /** Configuration path of {@link #failFast}. */
    public static final String FAIL_FAST_PATH = "difficient.patch.fail-fast";

    private static volatile DiffOptions defaults;

    /**
     * Creates options.
     *
     * @param maxLcsCells LCS table bound (must be between 1 and {@link Integer#MAX_VALUE})
     * @param failFast fail-fast patching
     * @throws IllegalArgumentException if maxLcsCells is out of range
     */
    public DiffOptions {
        if (maxLcsCells < 1) {
            throw new IllegalArgumentException("maxLcsCells must be >= 1, got: " + maxLcsCells);
        }
        if (maxLcsCells > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(
                    "maxLcsCells must be <= " + Integer.MAX_VALUE + ", got: " + maxLcsCells);
        }
    }

    /**
     * Reads options from a resolved configuration.
     *
     * @param config configuration containing the {@code difficient} block
     * @return the options
     * @throws com.typesafe.config.ConfigException if a path is missing or has the wrong type
     * @throws IllegalArgumentException if a value is out of range
     */
    public static DiffOptions fromConfig(Config config) {
        return new DiffOptions(
                config.getLong(MAX_LCS_CELLS_PATH),
                config.getBoolean(FAIL_FAST_PATH));
    }

    /**
     * Returns the options of the default configuration, loaded once.
     *
     * @return the default options
     * @see ConfigLoader#loadDefaults()
     */
    public static DiffOptions defaults() {
        DiffOptions result = defaults;
        if (result == null) {
            synchronized (DiffOptions.class) {
                result = defaults;
                if (result == null) {
                    result = fromConfig(ConfigLoader.loadDefaults());
                    defaults = result;
                }
            }
        }
        return result;
    }

    /**
     * Returns a copy with a different LCS table bound.
     *
     * @param cells the new bound
     * @return new options
     */
    public DiffOptions withMaxLcsCells(long cells) {
        return new DiffOptions(cells, failFast);
    }

    /**
     * Returns a copy with a different fail-fast setting.
     *
     * @param enabled the new setting
     * @return new options
     */
    public DiffOptions withFailFast(boolean enabled) {
        return new DiffOptions(maxLcsCells, enabled);
    }
}
