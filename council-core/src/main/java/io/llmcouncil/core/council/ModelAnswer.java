package io.llmcouncil.core.council;

import io.llmcouncil.core.usage.TokenUsage;
import java.util.Objects;

/// One model's answer in Stage 1, possibly replaced by its Stage 2.5 revision.
///
/// Never edited in place: a rebuttal produces a new instance via {@link #revisedWith}.
///
/// @param modelId answering model, not null
/// @param answerText answer, or a human-readable error text when `error` is set, not null
/// @param thinkingText extracted thinking segment, empty if none
/// @param reasoningModel whether the model is an extended-reasoning model
/// @param usage token usage, not null
/// @param cost cost in USD
/// @param persona persona applied to the model, may be null
/// @param error error description, null on success
/// @param rebuttal whether this answer is a revision after peer critique
public record ModelAnswer(
        String modelId,
        String answerText,
        String thinkingText,
        boolean reasoningModel,
        TokenUsage usage,
        double cost,
        String persona,
        String error,
        boolean rebuttal) {

    public ModelAnswer {
        Objects.requireNonNull(modelId, "modelId must not be null");
        answerText = answerText != null ? answerText : "";
        thinkingText = thinkingText != null ? thinkingText : "";
        usage = usage != null ? usage : TokenUsage.ZERO;
    }

    public boolean hasError() {
        return error != null;
    }

    /// Merges a successful revision into this answer.
    ///
    /// The revised text and thinking replace the originals; usage and cost are summed;
    /// the reasoning flag and persona carry over.
    ///
    /// @param revisedText revised answer, not null
    /// @param revisedThinking thinking segment of the revision, may be empty
    /// @param revisionUsage usage of the rebuttal call, not null
    /// @param revisionCost cost of the rebuttal call
    /// @return new answer flagged as a rebuttal, never null
    public ModelAnswer revisedWith(
            String revisedText,
            String revisedThinking,
            TokenUsage revisionUsage,
            double revisionCost) {
        return new ModelAnswer(
                modelId,
                revisedText,
                revisedThinking,
                reasoningModel,
                usage.plus(revisionUsage),
                cost + revisionCost,
                persona,
                null,
                true);
    }
}
