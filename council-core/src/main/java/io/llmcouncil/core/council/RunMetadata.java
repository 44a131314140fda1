package io.llmcouncil.core.council;

import io.llmcouncil.core.usage.TokenUsage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Derived summary of one run.
///
/// @param labelToModel label to model id, in label order
/// @param aggregateRankings league table, best first
/// @param totalCost total cost in USD, rounded to 4 decimals
/// @param totalTokens summed token usage of every call in the run
public record RunMetadata(
        Map<String, String> labelToModel,
        List<AggregateEntry> aggregateRankings,
        double totalCost,
        TokenUsage totalTokens) {

    public static final RunMetadata EMPTY =
            new RunMetadata(Map.of(), List.of(), 0.0, TokenUsage.ZERO);

    public RunMetadata {
        labelToModel =
                labelToModel != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(labelToModel))
                        : Map.of();
        aggregateRankings = aggregateRankings != null ? List.copyOf(aggregateRankings) : List.of();
        totalTokens = totalTokens != null ? totalTokens : TokenUsage.ZERO;
    }
}
