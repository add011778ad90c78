package com.newsroom.core.scheduler;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates unique, monotonically numbered task ids in the format PREFIX-NNNNNN.
 */
public class TaskIdGenerator {

    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public TaskIdGenerator() {
        this("TASK");
    }

    public TaskIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    public String nextId() {
        return String.format("%s-%06d", prefix, counter.incrementAndGet());
    }
}
