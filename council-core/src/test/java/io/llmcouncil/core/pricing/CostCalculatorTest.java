package io.llmcouncil.core.pricing;

import static org.assertj.core.api.Assertions.assertThat;

import io.llmcouncil.core.usage.TokenUsage;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CostCalculatorTest {

    private final CostCalculator calculator = new CostCalculator();

    @Nested
    class Cost {

        @Test
        void shouldPricePerMillionTokens() {
            // openai/gpt-5.2 is priced at $10 prompt / $30 completion
            assertThat(calculator.cost("openai/gpt-5.2", 100_000, 100_000)).isEqualTo(4.0);
        }

        @Test
        void shouldUseFallbackPriceForUnknownModels() {
            assertThat(calculator.cost("acme/unknown", new TokenUsage(1_000_000, 1_000_000, 0)))
                    .isEqualTo(4.0);
        }

        @Test
        void shouldRoundToSixDecimals() {
            assertThat(calculator.cost("google/gemini-3-flash-preview", 7, 3)).isEqualTo(0.000003);
        }

        @Test
        void shouldUseCustomPriceTable() {
            PriceTable table = PriceTable.builder().price("local/model", 0.0, 0.0).build();

            assertThat(new CostCalculator(table).cost("local/model", 5_000, 5_000)).isZero();
        }
    }

    @Nested
    class Estimate {

        @Test
        void shouldEstimateEveryModel() {
            String prompt = "x".repeat(400);

            CostEstimate estimate =
                    calculator.estimate(List.of("openai/gpt-5.2", "x-ai/grok-4"), prompt, 1000);

            assertThat(estimate.promptTokens()).isEqualTo(100);
            assertThat(estimate.perModel()).containsOnlyKeys("openai/gpt-5.2", "x-ai/grok-4");
            assertThat(estimate.perModel().get("openai/gpt-5.2")).isEqualTo(0.031);
            assertThat(estimate.total()).isEqualTo(0.0465);
        }

        @Test
        void shouldApproximateFourCharactersPerToken() {
            assertThat(CostCalculator.estimateTokens("abcdefgh")).isEqualTo(2);
            assertThat(CostCalculator.estimateTokens(null)).isZero();
        }
    }

    @Test
    void shouldFormatCostByMagnitude() {
        assertThat(CostCalculator.formatCost(0)).isEqualTo("$0.00");
        assertThat(CostCalculator.formatCost(0.0012)).isEqualTo("$0.0012");
        assertThat(CostCalculator.formatCost(0.123)).isEqualTo("$0.123");
        assertThat(CostCalculator.formatCost(4.0)).isEqualTo("$4.00");
    }

    @Test
    void shouldCategorizeCost() {
        assertThat(CostCalculator.costCategory(0.05)).isEqualTo("low");
        assertThat(CostCalculator.costCategory(0.2)).isEqualTo("medium");
        assertThat(CostCalculator.costCategory(1.0)).isEqualTo("high");
        assertThat(CostCalculator.costCategory(3.0)).isEqualTo("very-high");
    }
}
