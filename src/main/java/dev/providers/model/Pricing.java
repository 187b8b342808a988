package dev.providers.model;

/**
 * Input and output token prices, expressed per {@link PricingUnit}.
 */
public record Pricing(double input, double output, PricingUnit unit) {

    public static Pricing perThousand(double input, double output) {
        return new Pricing(input, output, PricingUnit.PER_THOUSAND);
    }

    public static Pricing perMillion(double input, double output) {
        return new Pricing(input, output, PricingUnit.PER_MILLION);
    }
}
