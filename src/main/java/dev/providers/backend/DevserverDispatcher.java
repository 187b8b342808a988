package dev.providers.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.providers.engine.CostCalculator;
import dev.providers.error.DevserverPollException;
import dev.providers.error.DevserverPollTimeoutException;
import dev.providers.error.DevserverSubmitException;
import dev.providers.error.DevserverTaskFailedException;
import dev.providers.error.ProviderException;
import dev.providers.model.Backend;
import dev.providers.model.DevserverTask;
import dev.providers.model.ProviderDescriptor;
import dev.providers.model.ProviderResult;
import dev.providers.model.RunOptions;
import dev.providers.model.TaskStatus;
import dev.providers.model.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Hands a request to a devserver and polls until the task completes, fails,
 * or the client-side poll deadline passes.
 *
 * <p>Task states: {@code queued -> running -> completed | failed}, as reported by the
 * server. The client adds its own {@code timeout} from any non-terminal state.
 */
public final class DevserverDispatcher implements ProviderBackend {

    private static final Logger log = LoggerFactory.getLogger(DevserverDispatcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final ProviderDescriptor descriptor;
    private final Backend.Devserver config;
    private final HttpClient http;
    private final String apiKey;

    public DevserverDispatcher(ProviderDescriptor descriptor, Backend.Devserver config, HttpClient http,
                               Function<String, String> env) {
        this.descriptor = descriptor;
        this.config = config;
        this.http = http;
        this.apiKey = descriptor.apiKey() != null ? descriptor.apiKey() : env.apply(descriptor.apiKeyEnvVar());
    }

    @Override
    public String getName() {
        return descriptor.name();
    }

    @Override
    public ProviderResult run(String prompt, RunOptions options) {
        String taskId = submit(prompt, options);
        return await(taskId);
    }

    /**
     * {@code POST /api/run}. Any failure here is fatal: there is no task to poll.
     *
     * @return the server-assigned task id
     */
    public String submit(String prompt, RunOptions options) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("provider", config.remoteProvider() != null ? config.remoteProvider() : descriptor.name());
        body.put("prompt", prompt);
        body.set("opts", encodeOptions(options));

        HttpRequest request;
        try {
            request = requestTo("/api/run")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                .build();
        } catch (JsonProcessingException e) {
            throw new DevserverSubmitException("Could not encode devserver request", e);
        }

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DevserverSubmitException("Devserver submit to %s failed: %s"
                .formatted(request.uri(), e.getMessage()), e);
        } catch (InterruptedException e) {
            throw Pauses.cancelled("submitting to devserver", e);
        }

        if (!isSuccess(response.statusCode())) {
            throw new DevserverSubmitException("Devserver submit failed: HTTP %d %s"
                .formatted(response.statusCode(), response.body()));
        }

        JsonNode taskId = readJson(response.body(), DevserverSubmitException::new).get("taskId");
        if (taskId == null || taskId.isNull() || taskId.asText().isBlank()) {
            throw new DevserverSubmitException("Devserver response has no taskId: " + response.body());
        }
        log.info("Submitted {} request to devserver as task {}", descriptor.name(), taskId.asText());
        return taskId.asText();
    }

    /**
     * Poll until the task is terminal or {@code maxPollTimeMs} has elapsed.
     *
     * @throws DevserverTaskFailedException  if the server reports failure
     * @throws DevserverPollTimeoutException if the deadline passes first
     */
    public ProviderResult await(String taskId) {
        long started = System.nanoTime();
        int polls = 0;
        while (elapsedMillis(started) < config.maxPollTimeMs()) {
            DevserverTask task = poll(taskId);
            polls++;
            log.debug("Task {} is {} (poll {})", taskId, task.status(), polls);

            if (task.status() == TaskStatus.COMPLETED) {
                log.info("Task {} completed after {} polls", taskId, polls);
                return withCost(task.result());
            }
            if (task.status() == TaskStatus.FAILED) {
                String error = task.error() != null ? task.error() : "Devserver task failed";
                throw new DevserverTaskFailedException(taskId, error);
            }
            Pauses.sleep(config.pollIntervalMs(), "polling devserver task " + taskId);
        }
        log.warn("Task {} still not finished after {} ms ({} polls)", taskId, config.maxPollTimeMs(), polls);
        throw new DevserverPollTimeoutException(taskId, config.maxPollTimeMs());
    }

    /** {@code GET /api/task/{taskId}}. */
    public DevserverTask poll(String taskId) {
        HttpRequest request = requestTo("/api/task/" + URLEncoder.encode(taskId, StandardCharsets.UTF_8))
            .GET()
            .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DevserverPollException("Polling task %s failed: %s".formatted(taskId, e.getMessage()), e);
        } catch (InterruptedException e) {
            throw Pauses.cancelled("polling devserver task " + taskId, e);
        }
        if (!isSuccess(response.statusCode())) {
            throw new DevserverPollException("Polling task %s failed: HTTP %d %s"
                .formatted(taskId, response.statusCode(), response.body()));
        }

        JsonNode root = readJson(response.body(), DevserverPollException::new);
        TaskStatus status = TaskStatus.fromWire(root.path("status").asText(null));
        ProviderResult result = status == TaskStatus.COMPLETED ? toResult(root.get("result")) : null;
        String error = root.hasNonNull("error") ? root.get("error").asText() : null;
        return new DevserverTask(taskId, status, result, error);
    }

    /**
     * Read a server-side result into a {@link ProviderResult}, tolerating missing
     * fields and repairing combinations the local type does not allow.
     */
    static ProviderResult toResult(JsonNode node) {
        if (node == null || !node.isObject()) {
            return ProviderResult.success("", null);
        }
        String raw = node.path("raw").asText("");
        JsonNode parsed = node.hasNonNull("parsed") ? node.get("parsed") : null;
        int exitCode = node.path("exitCode").asInt(0);

        TokenUsage usage = null;
        JsonNode usageNode = node.get("tokenUsage");
        if (usageNode != null && usageNode.isObject()) {
            usage = new TokenUsage(
                Math.max(0, usageNode.path("input").asLong(0)),
                Math.max(0, usageNode.path("output").asLong(0)));
        }
        Double cost = node.path("cost").isNumber() && usage != null && node.get("cost").asDouble() >= 0
            ? node.get("cost").asDouble() : null;

        String stderr = node.hasNonNull("stderr") ? node.get("stderr").asText() : null;
        String error = node.hasNonNull("error") ? node.get("error").asText() : null;
        String warning = node.hasNonNull("warning") ? node.get("warning").asText() : null;
        if (exitCode == 0 && error != null) {
            warning = warning == null ? error : warning + "; " + error;
            error = null;
        }
        return new ProviderResult(raw, parsed, exitCode, usage, cost, stderr, error, warning);
    }

    private ProviderResult withCost(ProviderResult result) {
        if (result.cost() != null || result.tokenUsage() == null || descriptor.pricing() == null) {
            return result;
        }
        return result.withUsage(result.tokenUsage(), CostCalculator.cost(result.tokenUsage(), descriptor.pricing()));
    }

    private static ObjectNode encodeOptions(RunOptions options) {
        ObjectNode opts = MAPPER.createObjectNode();
        if (options.outputSchema() != null) {
            opts.set("outputSchema", options.outputSchema());
        }
        if (options.sandbox() != null) {
            opts.put("sandbox", options.sandbox());
        }
        if (options.cwd() != null) {
            opts.put("cwd", options.cwd().toString());
        }
        if (options.timeoutMs() != null) {
            opts.put("timeoutMs", options.timeoutMs());
        }
        return opts;
    }

    private HttpRequest.Builder requestTo(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(RemoteApiExecutor.stripTrailingSlash(config.url()) + path))
            .timeout(REQUEST_TIMEOUT);
        if (apiKey != null) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private static <E extends ProviderException> JsonNode readJson(
            String body, BiFunction<String, Throwable, E> failure) {
        try {
            JsonNode node = MAPPER.readTree(body);
            if (node == null || !node.isObject()) {
                throw failure.apply("Expected a JSON object from devserver, got: " + body, null);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw failure.apply("Malformed devserver response: " + e.getOriginalMessage(), e);
        }
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
