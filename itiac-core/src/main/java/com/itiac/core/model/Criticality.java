package com.itiac.core.model;

import java.util.Locale;

/**
 * Business criticality shared by components, dependencies and workflows.
 *
 * <p>Declared from least to most severe so that {@link #compareTo} orders by severity.
 */
public enum Criticality {
    LOW("low", 3),
    MEDIUM("medium", 2),
    HIGH("high", 1),
    CRITICAL("critical", 0);

    private final String value;
    private final int severityRank;

    Criticality(String value, int severityRank) {
        this.value = value;
        this.severityRank = severityRank;
    }

    /**
     * Returns the external (lowercase) name.
     *
     * @return value as stored by the product
     */
    public String value() {
        return value;
    }

    /**
     * Rank used when ordering most-severe first: critical = 0, low = 3.
     *
     * @return severity rank
     */
    public int severityRank() {
        return severityRank;
    }

    /**
     * Parses an external value such as {@code "critical"} (case-insensitive).
     *
     * @param value external value
     * @return matching criticality
     * @throws IllegalArgumentException if the value is unknown
     */
    public static Criticality fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Criticality criticality : values()) {
                if (criticality.value.equals(normalized)) {
                    return criticality;
                }
            }
        }
        throw new IllegalArgumentException("Unknown criticality: " + value);
    }
}
