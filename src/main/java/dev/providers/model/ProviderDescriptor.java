package dev.providers.model;

import java.util.Locale;
import java.util.Set;

/**
 * Immutable configuration for one executable provider.
 */
public record ProviderDescriptor(
    String name,
    Backend backend,
    Pricing pricing,        // nullable: remote APIs fall back to the built-in tables
    RateLimits rateLimits,  // nullable: unlimited
    Set<String> capabilities,
    String apiKey           // nullable: looked up from the environment
) {
    public ProviderDescriptor {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public static ProviderDescriptor of(String name, Backend backend) {
        return new ProviderDescriptor(name, backend, null, null, Set.of(), null);
    }

    public String kind() {
        return backend == null ? null : backend.kind();
    }

    /**
     * Environment variable consulted when no API key is configured,
     * e.g. "deep-seek" becomes {@code DEEP_SEEK_API_KEY}.
     */
    public String apiKeyEnvVar() {
        return name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_") + "_API_KEY";
    }

    public ProviderDescriptor withPricing(Pricing value) {
        return new ProviderDescriptor(name, backend, value, rateLimits, capabilities, apiKey);
    }

    public ProviderDescriptor withRateLimits(RateLimits value) {
        return new ProviderDescriptor(name, backend, pricing, value, capabilities, apiKey);
    }

    public ProviderDescriptor withCapabilities(Set<String> value) {
        return new ProviderDescriptor(name, backend, pricing, rateLimits, value, apiKey);
    }

    public ProviderDescriptor withApiKey(String value) {
        return new ProviderDescriptor(name, backend, pricing, rateLimits, capabilities, value);
    }
}
