package com.newsroom.core.cost;

import java.time.Instant;

/**
 * One recorded spend.
 *
 * @param timestamp when the spend happened
 * @param operation what was paid for, usually the task type
 * @param amount    cost in USD
 */
public record CostEntry(Instant timestamp, String operation, double amount) {}
