package io.llmcouncil.core.council;

import io.llmcouncil.core.usage.TokenUsage;
import java.util.List;
import java.util.Objects;

/// One model's Stage 2 evaluation of the anonymized answers.
///
/// @param modelId reviewing model, not null
/// @param rawText full verdict text, not null
/// @param thinkingText extracted thinking segment, empty if none
/// @param reasoningModel whether the reviewer is an extended-reasoning model
/// @param parsedOrder distinct labels of the round, best first; may be empty
/// @param usage token usage, not null
/// @param cost cost in USD
/// @param error error description, null on success
public record RankingVerdict(
        String modelId,
        String rawText,
        String thinkingText,
        boolean reasoningModel,
        List<String> parsedOrder,
        TokenUsage usage,
        double cost,
        String error) {

    public RankingVerdict {
        Objects.requireNonNull(modelId, "modelId must not be null");
        rawText = rawText != null ? rawText : "";
        thinkingText = thinkingText != null ? thinkingText : "";
        parsedOrder = parsedOrder != null ? List.copyOf(parsedOrder) : List.of();
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public boolean hasError() {
        return error != null;
    }
}
