package com.itiac.core.model;

import java.util.Locale;

/**
 * Operational status of a component. Only {@link #OFFLINE} components act as outage roots.
 */
public enum ComponentStatus {
    ONLINE("online"),
    OFFLINE("offline"),
    WARNING("warning"),
    MAINTENANCE("maintenance");

    private final String value;

    ComponentStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses an external value such as {@code "offline"} (case-insensitive).
     *
     * @param value external value
     * @return matching status
     * @throws IllegalArgumentException if the value is unknown
     */
    public static ComponentStatus fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ComponentStatus status : values()) {
                if (status.value.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown component status: " + value);
    }
}
