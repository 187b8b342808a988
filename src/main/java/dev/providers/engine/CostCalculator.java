package dev.providers.engine;

import dev.providers.model.Pricing;
import dev.providers.model.TokenUsage;

/**
 * Converts token counts into money using a {@link Pricing} and its unit.
 */
public final class CostCalculator {

    private CostCalculator() {}

    /**
     * {@code (input * pricing.input + output * pricing.output) / unit}.
     *
     * @return the cost, or null when usage or pricing is unknown
     */
    public static Double cost(TokenUsage usage, Pricing pricing) {
        if (usage == null || pricing == null) {
            return null;
        }
        double total = usage.input() * pricing.input() + usage.output() * pricing.output();
        return total / pricing.unit().tokens();
    }

    /**
     * Cost of an aggregate token estimate with no input/output split,
     * assuming half of it is input and half output.
     */
    public static Double estimate(long totalTokens, Pricing pricing) {
        if (pricing == null) {
            return null;
        }
        return cost(TokenUsage.splitEvenly(totalTokens), pricing);
    }

    /** Rough token count for text: one token per four characters, rounded up. */
    public static long estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + 3) / 4;
    }
}
