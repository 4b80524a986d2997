package com.threadsmith.service;

import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local fixed-window limiter. Used directly in {@code memory} mode and as the
 * fallback while Redis is unreachable.
 */
@Service
public class InMemoryRateLimiter implements RateLimiter {

    private static final int PURGE_THRESHOLD = 10_000;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int purgeThreshold;

    public InMemoryRateLimiter() {
        this(Clock.systemUTC(), PURGE_THRESHOLD);
    }

    InMemoryRateLimiter(Clock clock) {
        this(clock, PURGE_THRESHOLD);
    }

    InMemoryRateLimiter(Clock clock, int purgeThreshold) {
        this.clock = clock;
        this.purgeThreshold = purgeThreshold;
    }

    @Override
    public boolean tryAcquire(String key, int limit, Duration window) {
        long now = clock.millis();
        long windowMillis = window.toMillis();
        long windowEnd = (now / windowMillis + 1) * windowMillis;
        if (windows.size() > purgeThreshold) {
            windows.values().removeIf(existing -> existing.endMillis() <= now);
        }
        Window current = windows.compute(key, (ignored, existing) ->
                existing == null || existing.endMillis() != windowEnd
                        ? new Window(windowEnd, 1)
                        : new Window(windowEnd, existing.count() + 1));
        return current.count() <= limit;
    }

    int trackedKeys() {
        return windows.size();
    }

    private record Window(long endMillis, int count) {}
}
