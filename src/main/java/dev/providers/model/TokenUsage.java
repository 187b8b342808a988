package dev.providers.model;

/**
 * Input (prompt) and output (completion) token counts for one request.
 */
public record TokenUsage(long input, long output) {

    public TokenUsage {
        if (input < 0 || output < 0) {
            throw new IllegalArgumentException("Token counts must be non-negative: " + input + "/" + output);
        }
    }

    /** Split an aggregate estimate evenly; an odd token goes to the output side. */
    public static TokenUsage splitEvenly(long total) {
        long input = total / 2;
        return new TokenUsage(input, total - input);
    }

    public long total() {
        return input + output;
    }
}
