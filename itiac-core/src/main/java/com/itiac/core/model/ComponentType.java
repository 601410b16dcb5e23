package com.itiac.core.model;

import java.util.Locale;

/**
 * Types of infrastructure components.
 */
public enum ComponentType {
    /** Physical or virtual host */
    SERVER("server"),

    /** Database instance */
    DATABASE("database"),

    /** Exposed API */
    API("api"),

    /** Load balancer */
    LOAD_BALANCER("load-balancer"),

    /** Network segment or link */
    NETWORK("network"),

    /** Business application */
    APPLICATION("application"),

    /** Internal or external service */
    SERVICE("service"),

    STORAGE("storage"),
    ENDPOINT("endpoint"),
    VIRTUAL_MACHINE("virtual-machine"),
    FIREWALL("firewall"),
    ROUTER("router"),
    SWITCH("switch"),
    CLOUD_INSTANCE("cloud-instance"),
    LICENSE("license"),
    BACKUP("backup"),
    DOMAIN("domain"),
    CERTIFICATE("certificate"),
    USER_ACCOUNT("user-account"),

    /** Application module; older data spells it {@code modul} */
    MODULE("module");

    private final String value;

    ComponentType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Parses an external value such as {@code "load-balancer"} (case-insensitive).
     * Underscores are accepted in place of hyphens.
     *
     * @param value external value
     * @return matching type
     * @throws IllegalArgumentException if the value is unknown
     */
    public static ComponentType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
            if ("modul".equals(normalized)) {
                return MODULE;
            }
            for (ComponentType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown component type: " + value);
    }
}
