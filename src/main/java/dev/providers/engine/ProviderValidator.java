package dev.providers.engine;

import dev.providers.error.ConfigValidationException;
import dev.providers.model.Backend;
import dev.providers.model.Pricing;
import dev.providers.model.ProviderDescriptor;
import dev.providers.model.RateLimits;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates provider descriptors before a backend is bound to them.
 */
public final class ProviderValidator {

    private ProviderValidator() {}

    /**
     * Validate a descriptor. Returns an empty list if valid,
     * or a list of error messages if invalid.
     */
    public static List<String> validate(ProviderDescriptor descriptor) {
        var errors = new ArrayList<String>();
        if (descriptor == null) {
            errors.add("Provider descriptor is missing");
            return errors;
        }

        String name = descriptor.name();
        if (name == null || name.isBlank()) {
            errors.add("Provider name is required");
            name = "<unnamed>";
        }

        Backend backend = descriptor.backend();
        if (backend == null) {
            errors.add("Provider '%s' has no kind; expected one of local, remoteApi, devserver".formatted(name));
        } else if (backend instanceof Backend.Local local) {
            if (local.command() == null || local.command().isBlank()) {
                errors.add("Provider '%s': local providers require a command".formatted(name));
            }
        } else if (backend instanceof Backend.RemoteApi api) {
            checkUrl(errors, name, "baseUrl", api.baseUrl());
            if (api.maxRetries() < 1) {
                errors.add("Provider '%s': maxRetries must be at least 1, got %d".formatted(name, api.maxRetries()));
            }
            if (api.retryDelayMs() < 0) {
                errors.add("Provider '%s': retryDelayMs must not be negative".formatted(name));
            }
        } else if (backend instanceof Backend.Devserver devserver) {
            checkUrl(errors, name, "devserverUrl", devserver.url());
            if (devserver.pollIntervalMs() <= 0) {
                errors.add("Provider '%s': pollIntervalMs must be positive".formatted(name));
            }
            if (devserver.maxPollTimeMs() <= 0) {
                errors.add("Provider '%s': maxPollTimeMs must be positive".formatted(name));
            }
        }

        Pricing pricing = descriptor.pricing();
        if (pricing != null) {
            if (pricing.input() < 0 || pricing.output() < 0) {
                errors.add("Provider '%s': pricing must not be negative".formatted(name));
            }
            if (pricing.unit() == null) {
                errors.add("Provider '%s': pricing has no unit".formatted(name));
            }
        }

        RateLimits limits = descriptor.rateLimits();
        if (limits != null && (limits.requestsPerMinute() < 0 || limits.tokensPerMinute() < 0)) {
            errors.add("Provider '%s': rate limits must not be negative".formatted(name));
        }

        return errors;
    }

    /**
     * Validate and fail fast.
     *
     * @throws ConfigValidationException listing every problem found
     */
    public static ProviderDescriptor requireValid(ProviderDescriptor descriptor) {
        List<String> errors = validate(descriptor);
        if (!errors.isEmpty()) {
            throw new ConfigValidationException(errors);
        }
        return descriptor;
    }

    private static void checkUrl(List<String> errors, String name, String field, String value) {
        if (value == null || value.isBlank()) {
            errors.add("Provider '%s': %s is required".formatted(name, field));
            return;
        }
        try {
            URI uri = new URI(value);
            String scheme = uri.getScheme();
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme) || uri.getHost() == null) {
                errors.add("Provider '%s': %s must be an absolute http(s) URL, got '%s'".formatted(name, field, value));
            }
        } catch (URISyntaxException e) {
            errors.add("Provider '%s': %s is not a valid URL: %s".formatted(name, field, e.getMessage()));
        }
    }
}
