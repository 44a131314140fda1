package io.llmcouncil.core.ranking;

import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.message.Message;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Asks a fast auxiliary model to pull the final ranking out of a verdict that the
/// regex chain could not fully parse.
///
/// The reply is scanned for the canonical labels; the labels it mentions are ordered by
/// their first position in the reply. Any gateway failure yields an empty list.
public class ModelAssistedRankingExtractor {

    private static final Logger logger =
            Logger.getLogger(ModelAssistedRankingExtractor.class.getName());

    private final ModelGateway gateway;
    private final String extractionModel;
    private final Duration timeout;

    /// @param gateway gateway used for the extraction call, not null
    /// @param extractionModel auxiliary model id, not null
    /// @param timeout extraction call timeout, not null
    public ModelAssistedRankingExtractor(
            ModelGateway gateway, String extractionModel, Duration timeout) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.extractionModel =
                Objects.requireNonNull(extractionModel, "extractionModel must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /// Extracts the ranking with the auxiliary model.
    ///
    /// @param verdict raw verdict text, not null
    /// @param labels canonical labels of the round, not null
    /// @return labels mentioned in the reply ordered by first occurrence, never null
    public List<String> extract(String verdict, List<String> labels) {
        String prompt = buildPrompt(verdict, labels);
        GatewayResult result =
                gateway.call(extractionModel, List.of(Message.user(prompt)), timeout);

        if (!(result instanceof GatewayResult.Success success)) {
            logger.warning(
                    "Ranking extraction via " + extractionModel + " returned no usable reply");
            return List.of();
        }

        String reply = success.answerText().trim();
        return labels.stream()
                .filter(reply::contains)
                .sorted(Comparator.comparingInt(reply::indexOf))
                .toList();
    }

    static String buildPrompt(String verdict, List<String> labels) {
        String labelList = String.join(", ", labels);
        return "You are a data extraction assistant. I have a text where an AI model evaluated"
                + " several responses (labeled "
                + labelList
                + ").\n"
                + "I need you to extract the final ranking the model decided on.\n\n"
                + "Evaluation Text:\n"
                + verdict
                + "\n\n"
                + "Task:\n"
                + "1. Identify the final ranking of the responses from best to worst.\n"
                + "2. Return ONLY the labels in order, separated by commas.\n"
                + "3. Use the exact labels provided: "
                + labelList
                + "\n\n"
                + "Example output: Response C, Response A, Response B\n\n"
                + "Final Ranking:";
    }
}
