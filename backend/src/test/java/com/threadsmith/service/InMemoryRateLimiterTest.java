package com.threadsmith.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryRateLimiterTest {

    private static final Duration MINUTE = Duration.ofMinutes(1);

    @Test
    void rejectsCallsOverLimitWithinWindow() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(fixedAt("2024-05-01T10:00:05Z"));

        for (int i = 0; i < 5; i++) {
            assertTrue(limiter.tryAcquire("scrape:1", 5, MINUTE));
        }
        assertFalse(limiter.tryAcquire("scrape:1", 5, MINUTE));
    }

    @Test
    void keysAreCountedIndependently() {
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(fixedAt("2024-05-01T10:00:05Z"));

        assertTrue(limiter.tryAcquire("scrape:1", 1, MINUTE));
        assertFalse(limiter.tryAcquire("scrape:1", 1, MINUTE));
        assertTrue(limiter.tryAcquire("scrape:2", 1, MINUTE));
    }

    @Test
    void nextWindowStartsFresh() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:59Z"));
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(clock);

        assertTrue(limiter.tryAcquire("send:global", 1, MINUTE));
        assertFalse(limiter.tryAcquire("send:global", 1, MINUTE));

        clock.instant = Instant.parse("2024-05-01T10:01:00Z");
        assertTrue(limiter.tryAcquire("send:global", 1, MINUTE));
    }

    @Test
    void purgeDropsOnlyEndedWindowsAcrossWindowLengths() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:05Z"));
        InMemoryRateLimiter limiter = new InMemoryRateLimiter(clock, 1);

        assertTrue(limiter.tryAcquire("scrape:1", 1, MINUTE));
        assertTrue(limiter.tryAcquire("send:global", 30, Duration.ofSeconds(1)));

        clock.instant = Instant.parse("2024-05-01T10:00:06Z");
        assertTrue(limiter.tryAcquire("send:global", 30, Duration.ofSeconds(1)));

        assertEquals(2, limiter.trackedKeys());
        assertFalse(limiter.tryAcquire("scrape:1", 1, MINUTE));
    }

    private static Clock fixedAt(String instant) {
        return Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
    }

    private static final class MutableClock extends Clock {
        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
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
            return instant;
        }
    }
}
