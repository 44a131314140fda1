package io.llmcouncil.core.pricing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Up-front cost estimate for sending one prompt to a set of models.
///
/// @param total estimated total in USD, rounded to 4 decimals
/// @param promptTokens estimated prompt tokens per model
/// @param estimatedResponseTokens assumed completion tokens per model
/// @param perModel estimated cost per model id, in roster order
public record CostEstimate(
        double total,
        long promptTokens,
        long estimatedResponseTokens,
        Map<String, Double> perModel) {

    public CostEstimate {
        perModel = Collections.unmodifiableMap(new LinkedHashMap<>(perModel));
    }
}
