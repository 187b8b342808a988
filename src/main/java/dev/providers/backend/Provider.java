package dev.providers.backend;

import dev.providers.engine.CostCalculator;
import dev.providers.engine.RateLimitStatus;
import dev.providers.engine.RateLimitWindow;
import dev.providers.model.ProviderDescriptor;
import dev.providers.model.ProviderResult;
import dev.providers.model.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A validated descriptor bound to its backend. Owns the rate-limit window shared
 * by every call made through this instance.
 */
public final class Provider {

    private static final Logger log = LoggerFactory.getLogger(Provider.class);

    private final ProviderDescriptor descriptor;
    private final ProviderBackend backend;
    private final RateLimitWindow window;

    Provider(ProviderDescriptor descriptor, ProviderBackend backend, RateLimitWindow window) {
        this.descriptor = descriptor;
        this.backend = backend;
        this.window = window;
    }

    public ProviderResult run(String prompt) {
        return run(prompt, RunOptions.defaults());
    }

    /**
     * Reserve room in this provider's per-minute window, then execute on the bound backend.
     *
     * @throws dev.providers.error.RateLimitExceededException if the window is full
     */
    public ProviderResult run(String prompt, RunOptions options) {
        Objects.requireNonNull(prompt, "prompt");
        window.acquire(CostCalculator.estimateTokens(prompt));
        log.debug("Running {} request on {}", descriptor.kind(), descriptor.name());
        return backend.run(prompt, options == null ? RunOptions.defaults() : options);
    }

    public String name() { return descriptor.name(); }
    public String kind() { return descriptor.kind(); }
    public ProviderDescriptor descriptor() { return descriptor; }
    public ProviderBackend backend() { return backend; }
    public RateLimitWindow rateLimitWindow() { return window; }

    public RateLimitStatus rateLimitStatus() {
        return window.status();
    }

    public boolean supports(String capability) {
        return descriptor.capabilities().contains(capability);
    }

    @Override
    public String toString() {
        return "Provider[" + descriptor.name() + " (" + descriptor.kind() + ")]";
    }
}
