package dev.providers.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;

/**
 * Per-call options. Every field is optional.
 */
public record RunOptions(
    JsonNode outputSchema, // structured-output schema forwarded to the backend
    String sandbox,        // opaque, passed through to local tools
    Path cwd,
    Long timeoutMs         // null = backend default
) {
    public static RunOptions defaults() {
        return new RunOptions(null, null, null, null);
    }

    public RunOptions withOutputSchema(JsonNode schema) {
        return new RunOptions(schema, sandbox, cwd, timeoutMs);
    }

    public RunOptions withSandbox(String value) {
        return new RunOptions(outputSchema, value, cwd, timeoutMs);
    }

    public RunOptions withCwd(Path dir) {
        return new RunOptions(outputSchema, sandbox, dir, timeoutMs);
    }

    public RunOptions withTimeoutMs(long millis) {
        return new RunOptions(outputSchema, sandbox, cwd, millis);
    }

    public long timeoutOr(long defaultMillis) {
        return timeoutMs != null && timeoutMs > 0 ? timeoutMs : defaultMillis;
    }
}
