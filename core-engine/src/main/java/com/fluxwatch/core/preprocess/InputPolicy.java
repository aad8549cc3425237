package com.fluxwatch.core.preprocess;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * What to do with a record that breaks a validity rule: a non-finite value,
 * or a timestamp lower than its predecessor's.
 *
 * @since 1.0.0
 */
public enum InputPolicy {

    /** Fail with a MalformedInputException. */
    REJECT("reject"),

    /** Drop the record, log it and count it. */
    SKIP("skip");

    private final String configName;

    InputPolicy(String configName) {
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
    public static InputPolicy fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (InputPolicy value : values()) {
                if (value.configName.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown InputPolicy value: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(InputPolicy::getConfigName).collect(Collectors.joining(", ")));
    }
}
