package io.llmcouncil.core.gateway;

import io.llmcouncil.core.usage.TokenUsage;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/// Sealed hierarchy for the raw outcome of one {@link ModelClient} call.
///
/// - {@link Text}: the model answered
/// - {@link Error}: the call failed
///
/// Clients never throw; every failure mode is materialized as an {@link Error}.
///
/// @see ModelClient#chat
public sealed interface ModelReply permits ModelReply.Text, ModelReply.Error {

    /// Returns when this reply was created.
    Instant timestamp();

    /// Text output of a successful call.
    ///
    /// @param content raw model output including any reasoning tags, not null
    /// @param usage token usage reported by the provider, not null
    /// @param metadata additional metadata (finish reason, latency), not null
    /// @param timestamp when the reply was created, not null
    record Text(String content, TokenUsage usage, Map<String, Object> metadata, Instant timestamp)
            implements ModelReply {

        public Text {
            Objects.requireNonNull(content, "content must not be null");
            usage = usage != null ? usage : TokenUsage.ZERO;
            metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Text of(String content, TokenUsage usage) {
            return new Text(content, usage, Map.of(), Instant.now());
        }

        public static Text of(String content, TokenUsage usage, Map<String, Object> metadata) {
            return new Text(content, usage, metadata, Instant.now());
        }
    }

    /// The call failed.
    ///
    /// @param message error description, not null
    /// @param errorType classification of the error, not null
    /// @param cause the underlying exception, may be null
    /// @param timestamp when the error occurred, not null
    record Error(String message, ErrorType errorType, Throwable cause, Instant timestamp)
            implements ModelReply {

        public enum ErrorType {
            TIMEOUT,
            RATE_LIMITED,
            UNSUPPORTED_MODEL,
            UNKNOWN
        }

        public Error {
            Objects.requireNonNull(message, "message must not be null");
            errorType = errorType != null ? errorType : ErrorType.UNKNOWN;
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static Error from(Throwable cause) {
            return new Error(
                    cause.getMessage() != null
                            ? cause.getMessage()
                            : cause.getClass().getSimpleName(),
                    ErrorType.UNKNOWN,
                    cause,
                    Instant.now());
        }

        public static Error of(String message) {
            return new Error(message, ErrorType.UNKNOWN, null, Instant.now());
        }

        public static Error of(String message, ErrorType type) {
            return new Error(message, type, null, Instant.now());
        }
    }
}
