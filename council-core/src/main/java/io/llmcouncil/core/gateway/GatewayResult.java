package io.llmcouncil.core.gateway;

import io.llmcouncil.core.usage.TokenUsage;
import java.util.Objects;

/// Normalized outcome of one {@link ModelGateway} call.
///
/// - {@link Success}: the model answered; reasoning tags are already split off
/// - {@link Failure}: transport error, timeout, provider error or unsupported model
/// - {@link NoResponse}: the backend produced no result at all
///
/// Callers branch with `instanceof`; there is no exception path.
public sealed interface GatewayResult
        permits GatewayResult.Success, GatewayResult.Failure, GatewayResult.NoResponse {

    /// Returns the model the call was addressed to.
    String modelId();

    /// @param modelId model that answered, not null
    /// @param answerText final answer without thinking tags, not null
    /// @param thinkingText extracted thinking segment, empty if none
    /// @param reasoningModel whether the model is an extended-reasoning model
    /// @param usage token usage, not null
    record Success(
            String modelId,
            String answerText,
            String thinkingText,
            boolean reasoningModel,
            TokenUsage usage)
            implements GatewayResult {

        public Success {
            Objects.requireNonNull(modelId, "modelId must not be null");
            answerText = answerText != null ? answerText : "";
            thinkingText = thinkingText != null ? thinkingText : "";
            usage = usage != null ? usage : TokenUsage.ZERO;
        }
    }

    /// @param modelId model the call was addressed to, not null
    /// @param error error description, not null
    /// @param answerText human-readable text shown in place of an answer, not null
    /// @param reasoningModel whether the model is an extended-reasoning model
    /// @param usage usage consumed before the failure, usually {@link TokenUsage#ZERO}
    record Failure(
            String modelId,
            String error,
            String answerText,
            boolean reasoningModel,
            TokenUsage usage)
            implements GatewayResult {

        public Failure {
            Objects.requireNonNull(modelId, "modelId must not be null");
            Objects.requireNonNull(error, "error must not be null");
            answerText = answerText != null ? answerText : "Error: " + error;
            usage = usage != null ? usage : TokenUsage.ZERO;
        }

        public static Failure of(String modelId, String error, boolean reasoningModel) {
            return new Failure(modelId, error, "Error: " + error, reasoningModel, TokenUsage.ZERO);
        }
    }

    /// @param modelId model the call was addressed to, not null
    record NoResponse(String modelId) implements GatewayResult {

        public NoResponse {
            Objects.requireNonNull(modelId, "modelId must not be null");
        }
    }
}
