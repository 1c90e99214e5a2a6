package com.tnpds.scraper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asked by the batch runner before each shop. Once it says stop, the shop in flight has
 * already finished and the rest are recorded as not attempted.
 */
@FunctionalInterface
public interface StopSignal {

    boolean shouldStop();

    default StopSignal or(StopSignal other) {
        return () -> shouldStop() || other.shouldStop();
    }

    static StopSignal never() {
        return () -> false;
    }

    /**
     * Stops once {@code budget} has elapsed from now; a zero or negative budget means no limit.
     */
    static StopSignal deadline(Clock clock, Duration budget) {
        if (budget == null || budget.isZero() || budget.isNegative()) {
            return never();
        }
        Instant deadline = clock.instant().plus(budget);
        return () -> !clock.instant().isBefore(deadline);
    }

    /**
     * Stops once the flag is raised, e.g. from a shutdown hook.
     */
    static StopSignal flag(AtomicBoolean raised) {
        return raised::get;
    }
}
