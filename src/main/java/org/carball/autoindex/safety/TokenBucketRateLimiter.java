package org.carball.autoindex.safety;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token buckets, one global and one per tenant. A build needs a token from
 * both; the two are checked and taken under one lock, so a tenant token is
 * never spent when the global bucket is empty. Buckets start full and refill
 * continuously, {@code tokensPerWindow} per window, up to {@code capacity}.
 * Over any window no more than capacity + tokensPerWindow tokens are granted.
 */
public class TokenBucketRateLimiter {

    static final String GLOBAL = "*";

    private final double capacity;
    private final double tokensPerMilli;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Bucket> buckets = new HashMap<>();

    public TokenBucketRateLimiter(int capacity, int tokensPerWindow, Duration window, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.capacity = capacity;
        this.tokensPerMilli = Math.max(0, tokensPerWindow) / (double) window.toMillis();
        this.clock = clock;
    }

    public boolean tryAcquire(String tenantId) {
        lock.lock();
        try {
            long now = clock.millis();
            Bucket global = refilled(GLOBAL, now);
            Bucket tenant = refilled(tenantId, now);
            if (global.tokens < 1.0 || tenant.tokens < 1.0) {
                return false;
            }
            global.tokens -= 1.0;
            tenant.tokens -= 1.0;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fraction of the global bucket in use: 0.0 when full, 1.0 when empty.
     */
    public double saturation() {
        lock.lock();
        try {
            return 1.0 - refilled(GLOBAL, clock.millis()).tokens / capacity;
        } finally {
            lock.unlock();
        }
    }

    public double availableTokens(String tenantId) {
        lock.lock();
        try {
            long now = clock.millis();
            return Math.min(refilled(GLOBAL, now).tokens, refilled(tenantId, now).tokens);
        } finally {
            lock.unlock();
        }
    }

    private Bucket refilled(String key, long now) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> new Bucket(capacity, now));
        if (now > bucket.lastRefillMillis) {
            bucket.tokens = Math.min(capacity, bucket.tokens + (now - bucket.lastRefillMillis) * tokensPerMilli);
            bucket.lastRefillMillis = now;
        }
        return bucket;
    }

    private static final class Bucket {
        private double tokens;
        private long lastRefillMillis;

        Bucket(double tokens, long lastRefillMillis) {
            this.tokens = tokens;
            this.lastRefillMillis = lastRefillMillis;
        }
    }
}
