package io.llmcouncil.core.council;

import java.util.Objects;

/// Row of the aggregate league table.
///
/// @param modelId ranked model, not null
/// @param averageRank mean position across verdicts, rounded to 2 decimals; lower is better
/// @param voteCount number of verdicts that placed the model
public record AggregateEntry(String modelId, double averageRank, int voteCount) {

    public AggregateEntry {
        Objects.requireNonNull(modelId, "modelId must not be null");
    }
}
