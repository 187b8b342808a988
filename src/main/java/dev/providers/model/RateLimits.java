package dev.providers.model;

/**
 * Per-minute limits for a provider. Zero means no limit on that dimension.
 */
public record RateLimits(int requestsPerMinute, long tokensPerMinute) {

    public static RateLimits unlimited() {
        return new RateLimits(0, 0);
    }
}
