package com.tooling.feedbackrelay.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffPolicyTest {

    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 5);

    @Test
    void delayFor_doublesPerAttempt() {
        assertEquals(Optional.of(Duration.ofSeconds(1)), policy.delayFor(1));
        assertEquals(Optional.of(Duration.ofSeconds(2)), policy.delayFor(2));
        assertEquals(Optional.of(Duration.ofSeconds(4)), policy.delayFor(3));
        assertEquals(Optional.of(Duration.ofSeconds(16)), policy.delayFor(5));
    }

    @Test
    void delayFor_isEmpty_onceAttemptsAreExhausted() {
        assertTrue(policy.delayFor(6).isEmpty());
        assertTrue(policy.delayFor(0).isEmpty());
    }

    @Test
    void delayFor_capsAtMaxDelay() {
        BackoffPolicy generous = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 100);

        assertEquals(Optional.of(Duration.ofSeconds(30)), generous.delayFor(6));
        assertEquals(Optional.of(Duration.ofSeconds(30)), generous.delayFor(64));
    }
}
