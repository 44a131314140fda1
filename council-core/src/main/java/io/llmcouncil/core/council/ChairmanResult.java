package io.llmcouncil.core.council;

import io.llmcouncil.core.usage.TokenUsage;
import java.util.Objects;

/// Final synthesized answer of a run.
///
/// @param modelId chairman model, not null
/// @param answerText synthesized answer or failure text, not null
/// @param thinkingText extracted thinking segment, empty if none
/// @param reasoningModel whether the chairman is an extended-reasoning model
/// @param usage token usage, not null
/// @param cost cost in USD
/// @param error error description, null on success
public record ChairmanResult(
        String modelId,
        String answerText,
        String thinkingText,
        boolean reasoningModel,
        TokenUsage usage,
        double cost,
        String error) {

    public static final String SYNTHESIS_FAILED_TEXT = "Error: Unable to generate final synthesis.";

    public ChairmanResult {
        Objects.requireNonNull(modelId, "modelId must not be null");
        answerText = answerText != null ? answerText : "";
        thinkingText = thinkingText != null ? thinkingText : "";
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    /// Sentinel used when the chairman produced nothing usable; carries zero usage and cost.
    ///
    /// @param modelId chairman model, not null
    /// @param error failure description, not null
    public static ChairmanResult failure(String modelId, String error) {
        return new ChairmanResult(
                modelId, SYNTHESIS_FAILED_TEXT, "", false, TokenUsage.ZERO, 0.0, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
