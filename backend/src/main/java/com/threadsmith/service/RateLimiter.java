package com.threadsmith.service;

import java.time.Duration;

/**
 * Fixed-window counter. No queueing: a call over the limit is simply refused.
 */
public interface RateLimiter {

    /**
     * Counts one hit against {@code key} in the current window.
     *
     * @return {@code true} while the window's count stays within {@code limit}
     */
    boolean tryAcquire(String key, int limit, Duration window);
}
