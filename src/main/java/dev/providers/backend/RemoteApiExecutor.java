package dev.providers.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.providers.engine.CostCalculator;
import dev.providers.engine.OutputNormalizer;
import dev.providers.engine.PricingTables;
import dev.providers.error.HttpStatusException;
import dev.providers.error.ProviderException;
import dev.providers.error.RateLimitExceededException;
import dev.providers.model.Backend;
import dev.providers.model.Pricing;
import dev.providers.model.ProviderDescriptor;
import dev.providers.model.ProviderResult;
import dev.providers.model.RunOptions;
import dev.providers.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * Calls an OpenAI-compatible chat-completion endpoint, retrying on rate limiting
 * and transport failures. Failures that survive every attempt come back as a
 * result with {@code exitCode = 1}; only cancellation escapes as an exception.
 */
public final class RemoteApiExecutor implements ProviderBackend {

    private static final Logger log = LoggerFactory.getLogger(RemoteApiExecutor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String COMPLETIONS_PATH = "/v1/chat/completions";
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 120_000;

    private final ProviderDescriptor descriptor;
    private final Backend.RemoteApi config;
    private final HttpClient http;
    private final String apiKey;

    public RemoteApiExecutor(ProviderDescriptor descriptor, Backend.RemoteApi config, HttpClient http,
                             Function<String, String> env) {
        this.descriptor = descriptor;
        this.config = config;
        this.http = http;
        this.apiKey = descriptor.apiKey() != null ? descriptor.apiKey() : env.apply(descriptor.apiKeyEnvVar());
        if (apiKey == null) {
            log.warn("No API key for provider '{}'; set {} or configure apiKey",
                descriptor.name(), descriptor.apiKeyEnvVar());
        }
    }

    @Override
    public String getName() {
        return descriptor.name();
    }

    @Override
    public ProviderResult run(String prompt, RunOptions options) {
        HttpRequest request = buildRequest(prompt, options);
        int maxRetries = config.maxRetries();
        ProviderException lastError = null;

        for (int attempt = 0; attempt < maxRetries; attempt++) {
            boolean attemptsLeft = attempt + 1 < maxRetries;
            log.debug("POST {} (attempt {}/{})", request.uri(), attempt + 1, maxRetries);

            HttpResponse<String> response;
            try {
                response = http.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                lastError = new ProviderException("Request to %s failed: %s".formatted(request.uri(), describe(e)), e);
                log.warn("{} (attempt {}/{})", lastError.getMessage(), attempt + 1, maxRetries);
                if (attemptsLeft) {
                    Pauses.sleep(config.retryDelayMs(), "waiting to retry " + request.uri());
                }
                continue;
            } catch (InterruptedException e) {
                throw Pauses.cancelled("calling " + request.uri(), e);
            }

            int status = response.statusCode();
            if (status == 429) {
                long delay = retryAfterMillis(response).orElse(config.retryDelayMs() * (attempt + 1));
                lastError = new RateLimitExceededException("Rate limited by %s (HTTP 429)".formatted(descriptor.name()));
                log.warn("{} rate limited (attempt {}/{}), backing off {} ms",
                    descriptor.name(), attempt + 1, maxRetries, delay);
                if (attemptsLeft) {
                    Pauses.sleep(delay, "backing off after HTTP 429");
                }
                continue;
            }
            if (status < 200 || status >= 300) {
                lastError = new HttpStatusException(status, errorMessage(status, response.body()));
                log.warn("{} returned HTTP {}: {} (attempt {}/{})",
                    descriptor.name(), status, lastError.getMessage(), attempt + 1, maxRetries);
                continue;
            }

            try {
                return parseResponse(MAPPER.readTree(response.body()));
            } catch (JsonProcessingException e) {
                lastError = new ProviderException("Malformed response from %s: %s"
                    .formatted(descriptor.name(), e.getOriginalMessage()), e);
                log.warn("{} (attempt {}/{})", lastError.getMessage(), attempt + 1, maxRetries);
                if (attemptsLeft) {
                    Pauses.sleep(config.retryDelayMs(), "waiting to retry " + request.uri());
                }
            }
        }

        String message = lastError == null ? "No attempts made" : lastError.getMessage();
        log.warn("Giving up on {} after {} attempts: {}", descriptor.name(), maxRetries, message);
        return ProviderResult.failure(1, message);
    }

    /**
     * Request body: model, one user message, and a {@code response_format} when a schema is given.
     */
    public ObjectNode buildRequestBody(String prompt, RunOptions options) {
        ObjectNode body = MAPPER.createObjectNode();
        if (config.model() != null) {
            body.put("model", config.model());
        }
        ObjectNode message = body.putArray("messages").addObject();
        message.put("role", "user");
        message.put("content", prompt);

        if (options.outputSchema() != null) {
            ObjectNode format = body.putObject("response_format");
            format.put("type", "json_schema");
            ObjectNode jsonSchema = format.putObject("json_schema");
            jsonSchema.put("name", "response");
            jsonSchema.set("schema", options.outputSchema());
        }
        return body;
    }

    /**
     * Turn a successful completion body into a result: content, parsed JSON, usage and cost.
     */
    public ProviderResult parseResponse(JsonNode root) {
        String raw = root.path("choices").path(0).path("message").path("content").asText("");

        TokenUsage usage = null;
        JsonNode usageNode = root.get("usage");
        if (usageNode != null && usageNode.isObject()) {
            usage = new TokenUsage(
                Math.max(0, usageNode.path("prompt_tokens").asLong(0)),
                Math.max(0, usageNode.path("completion_tokens").asLong(0)));
        }

        Double cost = CostCalculator.cost(usage, pricing());
        return ProviderResult.success(raw, OutputNormalizer.parse(raw)).withUsage(usage, cost);
    }

    /** Configured pricing, else the built-in table entry for the model. */
    public Pricing pricing() {
        return descriptor.pricing() != null ? descriptor.pricing() : PricingTables.forModel(config.model());
    }

    private HttpRequest buildRequest(String prompt, RunOptions options) {
        String json;
        try {
            json = MAPPER.writeValueAsString(buildRequestBody(prompt, options));
        } catch (JsonProcessingException e) {
            throw new ProviderException("Could not encode request for " + descriptor.name(), e);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(stripTrailingSlash(config.baseUrl()) + COMPLETIONS_PATH))
            .timeout(Duration.ofMillis(options.timeoutOr(DEFAULT_REQUEST_TIMEOUT_MS)))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(json));
        if (apiKey != null) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder.build();
    }

    /** {@code Retry-After} in seconds, when present and positive. HTTP-date values are ignored. */
    static OptionalLong retryAfterMillis(HttpResponse<?> response) {
        String value = response.headers().firstValue("Retry-After").orElse(null);
        if (value == null || value.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            return seconds > 0 ? OptionalLong.of(Math.round(seconds * 1000)) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            return OptionalLong.empty();
        }
    }

    private static String errorMessage(int status, String body) {
        if (body != null && !body.isBlank()) {
            try {
                JsonNode message = MAPPER.readTree(body).path("error").path("message");
                if (message.isTextual() && !message.asText().isBlank()) {
                    return message.asText();
                }
            } catch (JsonProcessingException e) {
                log.debug("Error body is not JSON: {}", e.getOriginalMessage());
            }
        }
        return "HTTP " + status;
    }

    private static String describe(IOException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
