package com.pluginmarket.pipeline.ingress;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Fixed-window request counter keyed by client IP.
 *
 * Each key is updated inside {@link ConcurrentMap#compute}, so concurrent
 * requests from one IP are serialized and never undercount. The sweep removes
 * a bucket only if it is still expired while holding that same per-key lock,
 * so it cannot drop a window that a concurrent request just reset.
 */
@Slf4j
public class RateLimiter {

    @Getter
    private final String name;
    @Getter
    private final int maxRequests;
    @Getter
    private final Duration window;
    private final Clock clock;

    private final ConcurrentMap<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();

    public RateLimiter(String name, int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
        this.name = name;
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    public RateLimitDecision tryAcquire(String key) {
        Instant now = clock.instant();
        RateLimitDecision[] decision = new RateLimitDecision[1];

        buckets.compute(key, (k, bucket) -> {
            if (bucket == null || bucket.isExpired(now)) {
                decision[0] = allow(1);
                return new RateLimitBucket(1, now.plus(window));
            }
            if (bucket.getRequestCount() >= maxRequests) {
                decision[0] = new RateLimitDecision(false, maxRequests, 0, window.toSeconds());
                return bucket;
            }
            bucket.increment();
            decision[0] = allow(bucket.getRequestCount());
            return bucket;
        });

        return decision[0];
    }

    /**
     * Drops buckets whose window has passed.
     *
     * @return number of buckets removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        for (String key : buckets.keySet()) {
            boolean[] expired = new boolean[1];
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (bucket.isExpired(now)) {
                    expired[0] = true;
                    return null;
                }
                return bucket;
            });
            if (expired[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Rate limiter '{}' swept {} expired buckets, {} remain", name, removed, buckets.size());
        }
        return removed;
    }

    public int trackedKeys() {
        return buckets.size();
    }

    private RateLimitDecision allow(int count) {
        return new RateLimitDecision(true, maxRequests, maxRequests - count, window.toSeconds());
    }
}
