package com.fluxwatch.core.preprocess;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How two consecutive observations sharing a timestamp are resolved.
 *
 * @since 1.0.0
 */
public enum DuplicatePolicy {

    /** Fail with a MalformedInputException. */
    REJECT("reject"),

    /** Keep the later observation, discard the earlier one. */
    TAKE_LAST("take_last");

    private final String configName;

    DuplicatePolicy(String configName) {
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
    public static DuplicatePolicy fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (DuplicatePolicy value : values()) {
                if (value.configName.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown DuplicatePolicy value: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(DuplicatePolicy::getConfigName).collect(Collectors.joining(", ")));
    }
}
