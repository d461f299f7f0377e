package com.pluginmarket.pipeline.ingress;

public record RateLimitDecision(boolean allowed, int limit, int remaining, long retryAfterSeconds) {
}
