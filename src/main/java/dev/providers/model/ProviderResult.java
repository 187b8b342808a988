package dev.providers.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Normalized outcome of one provider run, whatever backend produced it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderResult(
    String raw,
    JsonNode parsed,      // nullable: no structured output found
    int exitCode,
    TokenUsage tokenUsage, // nullable
    Double cost,          // nullable: only set alongside tokenUsage
    String stderr,        // nullable: local backend only
    String error,         // nullable: never set when exitCode == 0
    String warning        // nullable
) {
    public ProviderResult {
        if (exitCode == 0 && error != null) {
            throw new IllegalArgumentException("A successful result cannot carry an error: " + error);
        }
        if (cost != null && tokenUsage == null) {
            throw new IllegalArgumentException("Cost requires token usage");
        }
        if (cost != null && cost < 0) {
            throw new IllegalArgumentException("Cost must be non-negative: " + cost);
        }
        raw = raw == null ? "" : raw;
    }

    public static ProviderResult success(String raw, JsonNode parsed) {
        return new ProviderResult(raw, parsed, 0, null, null, null, null, null);
    }

    public static ProviderResult failure(int exitCode, String error) {
        return new ProviderResult("", null, exitCode, null, null, null, error, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return exitCode == 0;
    }

    public ProviderResult withUsage(TokenUsage usage, Double cost) {
        return new ProviderResult(raw, parsed, exitCode, usage, cost, stderr, error, warning);
    }

    public ProviderResult withWarning(String warning) {
        return new ProviderResult(raw, parsed, exitCode, tokenUsage, cost, stderr, error, warning);
    }
}
