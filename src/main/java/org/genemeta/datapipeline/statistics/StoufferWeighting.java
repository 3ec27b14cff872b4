package org.genemeta.datapipeline.statistics;

import java.util.Locale;

/**
 * Weighting scheme of Stouffer's method.
 */
public enum StoufferWeighting {

    /** {@code w_i = sqrt(n_i)}; falls back to equal weights if any sample size is unknown. */
    SQRT_N("sqrt_n"),

    /** {@code w_i = 1}. */
    EQUAL("equal");

    private final String configName;

    StoufferWeighting(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Parses the configuration value ({@code sqrt_n} or {@code equal}).
     *
     * @throws IllegalArgumentException for any other value.
     */
    public static StoufferWeighting fromConfigName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (StoufferWeighting weighting : values()) {
            if (weighting.configName.equals(normalized)) {
                return weighting;
            }
        }
        throw new IllegalArgumentException("Unknown stouffer weighting '" + value + "', expected 'sqrt_n' or 'equal'");
    }
}
