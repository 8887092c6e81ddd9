package com.cohortengine.config;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff for event-store queries.
 */
public record QueryRetrySettings(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff
) {

    public QueryRetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
    }

    public Duration backoffFor(int attempt) {
        long millis = initialBackoff.toMillis() << Math.min(attempt - 1, 20);
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }
}
