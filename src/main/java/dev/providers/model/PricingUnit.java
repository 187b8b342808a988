package dev.providers.model;

/**
 * Token count a price is quoted against. Pricing tables differ, so the unit
 * travels with every {@link Pricing}.
 */
public enum PricingUnit {
    PER_THOUSAND(1_000),
    PER_MILLION(1_000_000);

    private final long tokens;

    PricingUnit(long tokens) {
        this.tokens = tokens;
    }

    public long tokens() {
        return tokens;
    }

    /**
     * Parse the config form: "1K", "1k", "1000" or "1M", "1m", "1000000".
     */
    public static PricingUnit parse(String value) {
        return switch (value.trim().toUpperCase()) {
            case "1K", "1000", "PER_THOUSAND" -> PER_THOUSAND;
            case "1M", "1000000", "PER_MILLION" -> PER_MILLION;
            default -> throw new IllegalArgumentException("Unknown pricing unit: " + value);
        };
    }
}
