package com.tnpds.scraper;

import org.junit.jupiter.api.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class StopSignalTest {

    /** Clock that only moves when told to. */
    private static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2026-10-19T08:00:00Z");

        void advance(Duration by) {
            now = now.plus(by);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    @Test
    void testDeadlineFiresOnceBudgetIsUsed() {
        ManualClock clock = new ManualClock();
        StopSignal stop = StopSignal.deadline(clock, Duration.ofMinutes(30));

        assertFalse(stop.shouldStop());
        clock.advance(Duration.ofMinutes(29));
        assertFalse(stop.shouldStop());
        clock.advance(Duration.ofMinutes(1));
        assertTrue(stop.shouldStop());
    }

    @Test
    void testZeroBudgetMeansNoLimit() {
        ManualClock clock = new ManualClock();
        StopSignal stop = StopSignal.deadline(clock, Duration.ZERO);
        clock.advance(Duration.ofDays(3));
        assertFalse(stop.shouldStop());
    }

    @Test
    void testFlagCombinedWithDeadline() {
        AtomicBoolean raised = new AtomicBoolean();
        StopSignal stop = StopSignal.flag(raised).or(StopSignal.deadline(new ManualClock(), Duration.ofMinutes(5)));

        assertFalse(stop.shouldStop());
        raised.set(true);
        assertTrue(stop.shouldStop());
    }
}
