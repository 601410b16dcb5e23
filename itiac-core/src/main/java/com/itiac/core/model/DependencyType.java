package com.itiac.core.model;

import java.util.Locale;

/**
 * Kinds of dependency edges. The kind does not change propagation; every edge propagates.
 */
public enum DependencyType {
    REQUIRES("requires"),
    USES("uses"),
    FEEDS("feeds"),
    MONITORS("monitors");

    private final String value;

    DependencyType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses an external value such as {@code "requires"} (case-insensitive).
     *
     * @param value external value
     * @return matching dependency type
     * @throws IllegalArgumentException if the value is unknown
     */
    public static DependencyType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DependencyType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown dependency type: " + value);
    }
}
