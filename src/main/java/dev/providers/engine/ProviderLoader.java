package dev.providers.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.providers.error.ConfigValidationException;
import dev.providers.model.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads provider descriptors from a JSON config file.
 * Accepts either {@code {"providers": [...]}} or a bare array.
 */
public final class ProviderLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProviderLoader() {}

    /**
     * Load every provider from a JSON file, keyed by name in file order.
     */
    public static Map<String, ProviderDescriptor> loadFromFile(Path path) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (JsonProcessingException e) {
            throw new ConfigValidationException("Malformed JSON in " + path + ": " + e.getOriginalMessage(), e);
        }
        return parseProviders(root);
    }

    /**
     * Load every provider from a JSON string.
     */
    public static Map<String, ProviderDescriptor> loadFromString(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigValidationException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        return parseProviders(root);
    }

    /**
     * Parse one descriptor. Structural problems (unknown kind, wrong field types)
     * are reported here; semantic checks are left to {@link ProviderValidator}.
     */
    public static ProviderDescriptor parseProvider(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ConfigValidationException("Provider entry must be a JSON object, got: " + node);
        }
        String name = text(node, "name");
        String kind = text(node, "kind");
        if (kind == null) {
            kind = text(node, "type");
        }

        Backend backend = parseBackend(name, kind, node);
        Pricing pricing = parsePricing(name, node.get("pricing"));
        RateLimits rateLimits = parseRateLimits(node.get("rateLimits"));

        Set<String> capabilities = new LinkedHashSet<>();
        JsonNode caps = node.get("capabilities");
        if (caps != null && caps.isArray()) {
            caps.forEach(c -> capabilities.add(c.asText()));
        }

        return new ProviderDescriptor(name, backend, pricing, rateLimits, capabilities, text(node, "apiKey"));
    }

    private static Map<String, ProviderDescriptor> parseProviders(JsonNode root) {
        JsonNode list = root != null && root.isObject() ? root.get("providers") : root;
        if (list == null || !list.isArray()) {
            throw new ConfigValidationException("Expected a \"providers\" array");
        }

        var providers = new LinkedHashMap<String, ProviderDescriptor>();
        var errors = new ArrayList<String>();
        for (JsonNode entry : list) {
            ProviderDescriptor descriptor;
            try {
                descriptor = parseProvider(entry);
            } catch (ConfigValidationException e) {
                errors.addAll(e.errors());
                continue;
            }
            errors.addAll(ProviderValidator.validate(descriptor));
            if (descriptor.name() != null && providers.putIfAbsent(descriptor.name(), descriptor) != null) {
                errors.add("Duplicate provider name: " + descriptor.name());
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigValidationException(errors);
        }
        return providers;
    }

    private static Backend parseBackend(String name, String kind, JsonNode node) {
        if (kind == null) {
            return null;
        }
        return switch (kind) {
            case "local", "cli" -> {
                List<String> args = new ArrayList<>();
                JsonNode argsNode = node.has("args") ? node.get("args") : node.get("headlessArgs");
                if (argsNode != null && argsNode.isArray()) {
                    argsNode.forEach(a -> args.add(a.asText()));
                }
                yield new Backend.Local(text(node, "command"), args, text(node, "sandboxFlag"));
            }
            case "remoteApi", "api" -> new Backend.RemoteApi(
                text(node, "baseUrl"),
                text(node, "model"),
                node.path("maxRetries").asInt(Backend.RemoteApi.DEFAULT_MAX_RETRIES),
                node.path("retryDelayMs").asLong(Backend.RemoteApi.DEFAULT_RETRY_DELAY_MS));
            case "devserver" -> new Backend.Devserver(
                text(node, "devserverUrl"),
                text(node, "remoteProvider"),
                node.path("pollIntervalMs").asLong(Backend.Devserver.DEFAULT_POLL_INTERVAL_MS),
                node.path("maxPollTimeMs").asLong(Backend.Devserver.DEFAULT_MAX_POLL_TIME_MS));
            default -> throw new ConfigValidationException(
                "Provider '%s': unknown kind '%s'; expected one of local, remoteApi, devserver"
                    .formatted(name, kind));
        };
    }

    private static Pricing parsePricing(String name, JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        // {"inputPerMillion": 10, "outputPerMillion": 40}
        if (node.has("inputPerMillion") || node.has("outputPerMillion")) {
            return Pricing.perMillion(node.path("inputPerMillion").asDouble(), node.path("outputPerMillion").asDouble());
        }
        PricingUnit unit = PricingUnit.PER_THOUSAND;
        if (node.has("unit")) {
            try {
                unit = PricingUnit.parse(node.get("unit").asText());
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException("Provider '%s': %s".formatted(name, e.getMessage()));
            }
        }
        return new Pricing(node.path("input").asDouble(), node.path("output").asDouble(), unit);
    }

    private static RateLimits parseRateLimits(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        return new RateLimits(node.path("requestsPerMinute").asInt(0), node.path("tokensPerMinute").asLong(0));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
