package com.soletracker.scraper;

import java.time.Duration;

/**
 * Blocking wait used for pacing, backoff and rate-limit waits; swapped for a recording fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> {
        if (duration != null && !duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis());
        }
    };
}
