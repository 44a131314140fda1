package io.llmcouncil.core.council;

import java.util.List;
import java.util.Objects;

/// Outcome of one council run: the tuple handed to persistence.
///
/// @param answers final answers, post-rebuttal, in roster order
/// @param verdicts Stage 2 verdicts in roster order
/// @param chairman synthesized result, not null
/// @param metadata run summary, not null
public record CouncilResult(
        List<ModelAnswer> answers,
        List<RankingVerdict> verdicts,
        ChairmanResult chairman,
        RunMetadata metadata) {

    public static final String TERMINAL_ERROR_MODEL = "error";
    public static final String TERMINAL_ERROR_TEXT =
            "All models failed to respond. Please try again.";

    public CouncilResult {
        answers = answers != null ? List.copyOf(answers) : List.of();
        verdicts = verdicts != null ? List.copyOf(verdicts) : List.of();
        Objects.requireNonNull(chairman, "chairman must not be null");
        metadata = metadata != null ? metadata : RunMetadata.EMPTY;
    }

    /// Result returned when Stage 1 produced no usable answers.
    public static CouncilResult terminalError() {
        return new CouncilResult(
                List.of(),
                List.of(),
                new ChairmanResult(
                        TERMINAL_ERROR_MODEL, TERMINAL_ERROR_TEXT, "", false, null, 0.0,
                        TERMINAL_ERROR_TEXT),
                RunMetadata.EMPTY);
    }

    public boolean isTerminalError() {
        return answers.isEmpty() && TERMINAL_ERROR_MODEL.equals(chairman.modelId());
    }
}
