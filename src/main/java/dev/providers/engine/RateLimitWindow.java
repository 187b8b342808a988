package dev.providers.engine;

import dev.providers.error.RateLimitExceededException;
import dev.providers.model.RateLimits;

import java.time.Clock;

/**
 * Request and token counters for the current one-minute window of a single provider.
 * All reads and writes go through this object's monitor, so a stale window is reset
 * exactly once and a reservation is checked and recorded atomically.
 */
public final class RateLimitWindow {

    public static final long WINDOW_MS = 60_000;

    private final RateLimits limits;
    private final Clock clock;
    private int requestsThisWindow;
    private long tokensThisWindow;
    private long windowStartedAt;

    public RateLimitWindow(RateLimits limits) {
        this(limits, Clock.systemUTC());
    }

    public RateLimitWindow(RateLimits limits, Clock clock) {
        this.limits = limits == null ? RateLimits.unlimited() : limits;
        this.clock = clock;
        this.windowStartedAt = clock.millis();
    }

    public RateLimits limits() { return limits; }

    public synchronized int requestsThisWindow() {
        resetIfStale();
        return requestsThisWindow;
    }

    public synchronized long tokensThisWindow() {
        resetIfStale();
        return tokensThisWindow;
    }

    public synchronized long windowStartedAt() {
        return windowStartedAt;
    }

    /**
     * Start a new window if the current one is at least {@link #WINDOW_MS} old.
     *
     * @return true if the counters were reset by this call
     */
    public synchronized boolean resetIfStale() {
        long now = clock.millis();
        if (now - windowStartedAt < WINDOW_MS) {
            return false;
        }
        requestsThisWindow = 0;
        tokensThisWindow = 0;
        windowStartedAt = now;
        return true;
    }

    /** Whether one more request of {@code estimatedTokens} fits, without recording it. */
    public synchronized boolean withinLimits(long estimatedTokens) {
        resetIfStale();
        return fits(estimatedTokens);
    }

    /**
     * Record one request of {@code estimatedTokens}, or refuse it if it would exceed
     * either per-minute limit.
     *
     * @throws RateLimitExceededException if the window has no room
     */
    public synchronized void acquire(long estimatedTokens) {
        resetIfStale();
        if (!fits(estimatedTokens)) {
            throw new RateLimitExceededException(
                "Rate limit exceeded: %d/%d requests, %d/%d tokens this minute (requested %d tokens)"
                    .formatted(requestsThisWindow, limits.requestsPerMinute(),
                        tokensThisWindow, limits.tokensPerMinute(), estimatedTokens));
        }
        requestsThisWindow++;
        tokensThisWindow += Math.max(0, estimatedTokens);
    }

    public synchronized RateLimitStatus status() {
        resetIfStale();
        long resetsIn = Math.max(0, WINDOW_MS - (clock.millis() - windowStartedAt));
        return new RateLimitStatus(requestsThisWindow, limits.requestsPerMinute(),
            tokensThisWindow, limits.tokensPerMinute(), resetsIn);
    }

    private boolean fits(long estimatedTokens) {
        if (limits.requestsPerMinute() > 0 && requestsThisWindow + 1 > limits.requestsPerMinute()) {
            return false;
        }
        return limits.tokensPerMinute() <= 0
            || tokensThisWindow + Math.max(0, estimatedTokens) <= limits.tokensPerMinute();
    }
}
