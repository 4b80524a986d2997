package com.threadsmith.service;

import com.threadsmith.config.ThreadsmithRuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Shared fixed-window limiter. The increment and the window expiry are applied in one
 * Lua call; a key left without a TTL gets one on its next hit.
 */
@Service
@Primary
@ConditionalOnProperty(
        prefix = "threadsmith.rate-limit",
        name = "mode",
        havingValue = "redis",
        matchIfMissing = true
)
public class RedisRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RedisRateLimiter.class);
    private static final Duration REDIS_FAILURE_BACKOFF = Duration.ofSeconds(5);

    static final RedisScript<Long> INCREMENT_SCRIPT = new DefaultRedisScript<>("""
            local current = redis.call('INCR', KEYS[1])
            if redis.call('PTTL', KEYS[1]) < 0 then
              redis.call('PEXPIRE', KEYS[1], ARGV[1])
            end
            return current
            """, Long.class);

    private final StringRedisTemplate stringRedisTemplate;
    private final ThreadsmithRuntimeProperties runtimeProperties;
    private final InMemoryRateLimiter fallbackLimiter;
    private final Clock clock;

    private volatile boolean fallbackMode;
    private volatile long redisRetryNotBeforeNanos;

    @Autowired
    public RedisRateLimiter(
            StringRedisTemplate stringRedisTemplate,
            ThreadsmithRuntimeProperties runtimeProperties,
            InMemoryRateLimiter fallbackLimiter
    ) {
        this(stringRedisTemplate, runtimeProperties, fallbackLimiter, Clock.systemUTC());
    }

    RedisRateLimiter(
            StringRedisTemplate stringRedisTemplate,
            ThreadsmithRuntimeProperties runtimeProperties,
            InMemoryRateLimiter fallbackLimiter,
            Clock clock
    ) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.runtimeProperties = runtimeProperties;
        this.fallbackLimiter = fallbackLimiter;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String key, int limit, Duration window) {
        if (!shouldAttemptRedis()) {
            return fallbackLimiter.tryAcquire(key, limit, window);
        }
        long windowMillis = window.toMillis();
        String redisKey = runtimeProperties.getRateLimit().getRedisKeyPrefix()
                + key + ":" + (clock.millis() / windowMillis);
        try {
            Long count = stringRedisTemplate.execute(
                    INCREMENT_SCRIPT,
                    List.of(redisKey),
                    String.valueOf(windowMillis)
            );
            if (count != null) {
                markRedisHealthy();
                return count <= limit;
            }
            log.warn("Redis rate-limit script returned null, counting in memory");
            markRedisFailure(null);
        } catch (RuntimeException ex) {
            markRedisFailure(ex);
        }
        return fallbackLimiter.tryAcquire(key, limit, window);
    }

    boolean isFallbackMode() {
        return fallbackMode;
    }

    private boolean shouldAttemptRedis() {
        return !fallbackMode || System.nanoTime() - redisRetryNotBeforeNanos >= 0;
    }

    private void markRedisFailure(RuntimeException ex) {
        redisRetryNotBeforeNanos = System.nanoTime() + REDIS_FAILURE_BACKOFF.toNanos();
        if (!fallbackMode) {
            fallbackMode = true;
            if (ex == null) {
                log.warn("Redis rate limiter is unavailable; switching to in-memory fallback mode");
            } else {
                log.warn(
                        "Redis rate limiter is unavailable ({}); switching to in-memory fallback mode",
                        resolveSafeMessage(ex)
                );
            }
        }
    }

    private void markRedisHealthy() {
        if (fallbackMode) {
            log.info("Redis rate limiter connection restored; leaving in-memory fallback mode");
        }
        fallbackMode = false;
        redisRetryNotBeforeNanos = 0L;
    }

    private static String resolveSafeMessage(RuntimeException ex) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
