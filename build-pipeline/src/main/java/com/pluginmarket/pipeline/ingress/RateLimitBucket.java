package com.pluginmarket.pipeline.ingress;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * Request counter for one client IP inside one fixed window.
 * Only mutated from inside {@link RateLimiter}'s per-key compute.
 */
@Getter
@AllArgsConstructor
class RateLimitBucket {

    private int requestCount;
    private final Instant windowResetAt;

    boolean isExpired(Instant now) {
        return now.isAfter(windowResetAt);
    }

    void increment() {
        requestCount++;
    }
}
