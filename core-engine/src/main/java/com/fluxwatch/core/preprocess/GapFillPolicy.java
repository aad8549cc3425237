package com.fluxwatch.core.preprocess;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How short gaps in the sampling grid are filled.
 *
 * @since 1.0.0
 */
public enum GapFillPolicy {

    /** Gaps are left unfilled. */
    NONE("none"),

    /** Repeat the last accepted value. */
    FORWARD_FILL("forward_fill"),

    /** Linear interpolation between the samples around the gap. */
    INTERPOLATE("interpolate");

    private final String configName;

    GapFillPolicy(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolve a constant from its configuration name (case-insensitive).
     *
     * @param name configuration value
     * @return the matching constant
     * @throws IllegalArgumentException if the name is unknown
     */
    public static GapFillPolicy fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (GapFillPolicy value : values()) {
                if (value.configName.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown GapFillPolicy value: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(GapFillPolicy::getConfigName).collect(Collectors.joining(", ")));
    }
}
