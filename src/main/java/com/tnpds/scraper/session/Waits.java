package com.tnpds.scraper.session;

import com.tnpds.scraper.ElementNotFoundException;
import com.tnpds.scraper.WaitTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;
import java.util.function.Supplier;

/**
 * Predicate polling shared by session implementations. The poll interval starts at the
 * given value and doubles up to {@link #MAX_POLL_MS}; the probe always runs at least once,
 * so a zero timeout still sees an already-ready page.
 */
public final class Waits {
    private static final Logger logger = LoggerFactory.getLogger(Waits.class);
    static final long MAX_POLL_MS = 2000;

    private Waits() {}

    public static <T> T poll(String condition, Supplier<T> probe, Duration timeout, Duration initialPoll, LongConsumer pause) {
        long deadline = System.nanoTime() + timeout.toNanos();
        long poll = Math.max(1, initialPoll.toMillis());
        ElementNotFoundException lastMiss = null;
        while (true) {
            try {
                T value = probe.get();
                if (value != null && !Boolean.FALSE.equals(value)) {
                    return value;
                }
            } catch (ElementNotFoundException e) {
                lastMiss = e;
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                logger.debug("Gave up waiting for {} after {}ms", condition, timeout.toMillis());
                throw new WaitTimeoutException(condition, timeout, lastMiss);
            }
            pause.accept(Math.min(poll, remainingMs));
            poll = Math.min(MAX_POLL_MS, poll * 2);
        }
    }

    /**
     * Thread-sleeping pause for sessions without their own timer.
     */
    public static LongConsumer sleeping(String condition) {
        return ms -> {
            try {
                Thread.sleep(ms);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WaitTimeoutException(condition + " (interrupted)", Duration.ofMillis(ms), e);
            }
        };
    }
}
