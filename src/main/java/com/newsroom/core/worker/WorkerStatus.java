package com.newsroom.core.worker;

/**
 * Operational status of an external worker.
 */
public enum WorkerStatus {
    ONLINE,
    OFFLINE,
    BUSY,
    ERROR,
    MAINTENANCE
}
