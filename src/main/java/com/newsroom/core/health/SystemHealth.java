package com.newsroom.core.health;

/**
 * Overall health classification, ordered from best to worst.
 */
public enum SystemHealth {
    HEALTHY,
    WARNING,
    CRITICAL,
    DOWN;

    /** New work is admitted only while the system is HEALTHY or WARNING. */
    public boolean isAdmitting() {
        return this == HEALTHY || this == WARNING;
    }
}
