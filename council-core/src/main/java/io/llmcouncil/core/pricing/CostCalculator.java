package io.llmcouncil.core.pricing;

import io.llmcouncil.core.usage.TokenUsage;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/// Turns token counts into USD using a {@link PriceTable}.
///
/// `cost = prompt_tokens / 1e6 * prompt_price + completion_tokens / 1e6 * completion_price`,
/// rounded to 6 decimals per call.
///
/// @implNote Stateless and thread-safe.
public final class CostCalculator {

    public static final int DEFAULT_RESPONSE_TOKENS = 500;

    private static final double PER_MILLION = 1_000_000d;

    private final PriceTable priceTable;

    public CostCalculator(PriceTable priceTable) {
        this.priceTable = Objects.requireNonNull(priceTable, "priceTable must not be null");
    }

    public CostCalculator() {
        this(PriceTable.defaults());
    }

    /// Computes the cost of one call.
    ///
    /// @param modelId model that served the call, not null
    /// @param promptTokens prompt token count, non-negative
    /// @param completionTokens completion token count, non-negative
    /// @return cost in USD rounded to 6 decimals
    public double cost(String modelId, long promptTokens, long completionTokens) {
        ModelPrice price = priceTable.priceFor(modelId);
        double promptCost = (promptTokens / PER_MILLION) * price.prompt();
        double completionCost = (completionTokens / PER_MILLION) * price.completion();
        return round(promptCost + completionCost, 6);
    }

    public double cost(String modelId, TokenUsage usage) {
        return cost(modelId, usage.promptTokens(), usage.completionTokens());
    }

    /// Estimates what sending `promptText` to every model would cost.
    ///
    /// Prompt tokens are approximated as one token per four characters.
    ///
    /// @param modelIds models that would receive the prompt, not null
    /// @param promptText prompt to be sent, not null
    /// @param estimatedResponseTokens assumed completion length per model
    /// @return estimate with per-model breakdown, never null
    public CostEstimate estimate(
            List<String> modelIds, String promptText, long estimatedResponseTokens) {
        long promptTokens = estimateTokens(promptText);
        Map<String, Double> perModel = new LinkedHashMap<>();
        double total = 0.0;
        for (String modelId : modelIds) {
            double modelCost = cost(modelId, promptTokens, estimatedResponseTokens);
            perModel.put(modelId, modelCost);
            total += modelCost;
        }
        return new CostEstimate(round(total, 4), promptTokens, estimatedResponseTokens, perModel);
    }

    public CostEstimate estimate(List<String> modelIds, String promptText) {
        return estimate(modelIds, promptText, DEFAULT_RESPONSE_TOKENS);
    }

    /// Rough token count: ~4 characters per token for English text.
    public static long estimateTokens(String text) {
        return text == null ? 0 : text.length() / 4;
    }

    /// Formats a cost for display: `$0.00` for zero, then 4, 3 or 2 decimals by magnitude.
    public static String formatCost(double cost) {
        if (cost == 0) {
            return "$0.00";
        } else if (cost < 0.01) {
            return String.format(Locale.ROOT, "$%.4f", cost);
        } else if (cost < 1) {
            return String.format(Locale.ROOT, "$%.3f", cost);
        }
        return String.format(Locale.ROOT, "$%.2f", cost);
    }

    /// Buckets a cost into `low`, `medium`, `high` or `very-high`.
    public static String costCategory(double cost) {
        if (cost < 0.10) {
            return "low";
        } else if (cost < 0.50) {
            return "medium";
        } else if (cost < 2.00) {
            return "high";
        }
        return "very-high";
    }

    static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
