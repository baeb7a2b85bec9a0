package com.crossbot.config;

/**
 * Backend for scenario definitions (CROSSBOT_STORE).
 */
public enum StoreType {
    MEMORY,
    REDIS;

    public static StoreType fromValue(String value, StoreType defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        for (StoreType t : values()) {
            if (t.name().equalsIgnoreCase(value.trim())) return t;
        }
        return defaultValue;
    }
}
