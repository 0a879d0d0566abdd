package com.soletracker.scraper;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class RetryPolicyTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));

    @Test
    public void testRetryAfterSeconds() {
        assertEquals(Optional.of(Duration.ofSeconds(120)), RetryPolicy.parseRetryAfter(" 120 ", clock));
    }

    @Test
    public void testRetryAfterHttpDate() {
        assertEquals(Optional.of(Duration.ofSeconds(30)),
            RetryPolicy.parseRetryAfter("Sat, 01 Mar 2025 10:00:30 GMT", clock));
        assertEquals(Optional.of(Duration.ZERO),
            RetryPolicy.parseRetryAfter("Sat, 01 Mar 2025 09:00:00 GMT", clock));
    }

    @Test
    public void testRetryAfterGarbage() {
        assertTrue(RetryPolicy.parseRetryAfter("soon", clock).isEmpty());
        assertTrue(RetryPolicy.parseRetryAfter("-5", clock).isEmpty());
        assertTrue(RetryPolicy.parseRetryAfter(null, clock).isEmpty());
    }

    @Test
    public void testDefaults() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertEquals(3, policy.maxAttempts());
        assertEquals(Duration.ofSeconds(2), policy.backoffAfter(1));
        assertEquals(Duration.ofSeconds(4), policy.backoffAfter(2));
        assertTrue(policy.isRetryable(503));
        assertFalse(policy.isRetryable(302));
    }
}
