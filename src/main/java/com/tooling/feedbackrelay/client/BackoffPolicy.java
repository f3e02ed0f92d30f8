package com.tooling.feedbackrelay.client;

import lombok.Value;

import java.time.Duration;
import java.util.Optional;

/**
 * Exponential reconnect delays: base, 2x base, 4x base ... capped at max.
 */
@Value
public class BackoffPolicy {
    Duration baseDelay;
    Duration maxDelay;
    int maxAttempts;

    /**
     * @param attempt 1-based attempt number
     * @return empty once attempts are exhausted
     */
    public Optional<Duration> delayFor(int attempt) {
        if (attempt < 1 || attempt > maxAttempts) {
            return Optional.empty();
        }
        // shift is capped so large attempt numbers cannot overflow
        long multiplier = 1L << Math.min(attempt - 1, 30);
        long millis = baseDelay.toMillis() * multiplier;
        if (millis < 0 || millis > maxDelay.toMillis()) {
            millis = maxDelay.toMillis();
        }
        return Optional.of(Duration.ofMillis(millis));
    }
}
