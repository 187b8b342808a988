package dev.providers.backend;

import dev.providers.error.ConfigValidationException;
import dev.providers.model.ProviderDescriptor;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Named, bound providers loaded from configuration.
 */
public final class ProviderRegistry {

    private final Map<String, Provider> providers;

    private ProviderRegistry(Map<String, Provider> providers) {
        this.providers = providers;
    }

    public static ProviderRegistry of(Collection<ProviderDescriptor> descriptors, ProviderFactory factory) {
        var bound = new LinkedHashMap<String, Provider>();
        for (ProviderDescriptor descriptor : descriptors) {
            Provider provider = factory.create(descriptor);
            if (bound.putIfAbsent(provider.name(), provider) != null) {
                throw new ConfigValidationException("Duplicate provider name: " + provider.name());
            }
        }
        return new ProviderRegistry(bound);
    }

    public Optional<Provider> find(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    /**
     * @throws ConfigValidationException if no provider has that name
     */
    public Provider require(String name) {
        Provider provider = providers.get(name);
        if (provider == null) {
            throw new ConfigValidationException("Unknown provider '%s'. Available: %s"
                .formatted(name, providers.keySet()));
        }
        return provider;
    }

    /** Providers declaring {@code capability}, in configuration order. */
    public List<Provider> forCapability(String capability) {
        return providers.values().stream()
            .filter(p -> p.supports(capability))
            .toList();
    }

    public Collection<Provider> all() {
        return providers.values();
    }

    public int size() {
        return providers.size();
    }
}
