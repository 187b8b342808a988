package dev.providers.engine;

/**
 * Snapshot of a {@link RateLimitWindow}. A limit of zero means unlimited.
 */
public record RateLimitStatus(
    int requestsUsed,
    int requestsLimit,
    long tokensUsed,
    long tokensLimit,
    long resetsInMs
) {}
