package com.fluxwatch.core.detection;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Which bound raises an alarm. Exactly one rule applies for the lifetime of a
 * detector.
 *
 * @since 1.0.0
 */
public enum DecisionRule {

    /** Alarm when the value exceeds the long-term extreme threshold (classic SPOT). */
    THRESHOLD("threshold"),

    /** Alarm when the value exceeds the drift-adjusted anomaly threshold. */
    ANOMALY_THRESHOLD("anomaly_threshold");

    private final String configName;

    DecisionRule(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Resolve a rule from its configuration name (case-insensitive).
     *
     * @param name configuration value, e.g. {@code anomaly_threshold}
     * @return the matching rule
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DecisionRule fromConfig(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (DecisionRule rule : values()) {
                if (rule.configName.equals(normalized)) {
                    return rule;
                }
            }
        }
        throw new IllegalArgumentException("Unknown decision rule: '" + name + "'. Supported: "
                + Arrays.stream(values()).map(DecisionRule::getConfigName).collect(Collectors.joining(", ")));
    }
}
