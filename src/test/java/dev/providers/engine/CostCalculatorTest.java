package dev.providers.engine;

import dev.providers.model.Pricing;
import dev.providers.model.TokenUsage;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CostCalculatorTest {

    @Test
    void perMillionPricing() {
        Double cost = CostCalculator.cost(new TokenUsage(500, 500), Pricing.perMillion(10, 40));

        assertThat(cost).isCloseTo(0.025, within(1e-9));
    }

    @Test
    void perThousandPricing() {
        Double cost = CostCalculator.cost(new TokenUsage(1000, 500), Pricing.perThousand(0.001, 0.002));

        // (1000 * 0.001 + 500 * 0.002) / 1000
        assertThat(cost).isCloseTo(0.002, within(1e-9));
    }

    @Test
    void sameCountsCostDifferentlyByUnit() {
        var usage = new TokenUsage(1000, 1000);

        Double perK = CostCalculator.cost(usage, Pricing.perThousand(1, 1));
        Double perM = CostCalculator.cost(usage, Pricing.perMillion(1, 1));

        assertThat(perK).isCloseTo(2.0, within(1e-9));
        assertThat(perM).isCloseTo(0.002, within(1e-9));
    }

    @Test
    void zeroTokensCostNothing() {
        assertThat(CostCalculator.cost(new TokenUsage(0, 0), Pricing.perThousand(0.001, 0.002))).isZero();
    }

    @Test
    void nullWhenPricingOrUsageMissing() {
        assertThat(CostCalculator.cost(new TokenUsage(1000, 500), null)).isNull();
        assertThat(CostCalculator.cost(null, Pricing.perMillion(10, 40))).isNull();
    }

    @Test
    void estimateSplitsTotalEvenly() {
        // 1000 tokens at o3 pricing: (500 * 10 + 500 * 40) / 1M
        assertThat(CostCalculator.estimate(1000, PricingTables.OPENAI_PRICING)).isCloseTo(0.025, within(1e-9));
        assertThat(CostCalculator.estimate(1000, Pricing.perMillion(5, 15))).isCloseTo(0.01, within(1e-9));
        assertThat(CostCalculator.estimate(1000, null)).isNull();
    }

    @Test
    void estimatesTokensFromLength() {
        assertThat(CostCalculator.estimateTokens("")).isZero();
        assertThat(CostCalculator.estimateTokens("abcd")).isEqualTo(1);
        assertThat(CostCalculator.estimateTokens("abcde")).isEqualTo(2);
    }
}
