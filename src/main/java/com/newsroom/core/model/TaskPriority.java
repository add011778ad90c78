package com.newsroom.core.model;

/**
 * Task priority levels, ordered from lowest to highest.
 */
public enum TaskPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL;

    public static TaskPriority fromString(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
