package com.fluxwatch.core.preprocess;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Value transform applied after cleaning.
 *
 * <p>
 * {@code fluctuation} turns a level signal into a non-negative local
 * fluctuation score, which keeps level shifts and periodic patterns from
 * dominating the tail fit. {@code periodic_fluctuation} additionally
 * discounts fluctuation that recurs at the same phase of earlier periods.
 * </p>
 *
 * @since 1.0.0
 */
public enum TransformType {

    /** Pass values through. */
    NONE("none"),

    /** Fixed-window moving average. */
    MOVING_AVERAGE("moving_average"),

    /** First difference, the first value maps to 0. */
    DIFFERENCE("difference"),

    /** Smoothed EWMA prediction-error fluctuation. */
    FLUCTUATION("fluctuation"),

    /** Fluctuation compared with the same phase of earlier periods. */
    PERIODIC_FLUCTUATION("periodic_fluctuation");

    private final String configName;

    TransformType(String configName) {
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
    public static TransformType fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (TransformType value : values()) {
                if (value.configName.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown TransformType value: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(TransformType::getConfigName).collect(Collectors.joining(", ")));
    }
}
