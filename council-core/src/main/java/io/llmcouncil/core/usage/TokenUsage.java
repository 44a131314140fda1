package io.llmcouncil.core.usage;

/// Token counts reported for a single model call, or a sum of several calls.
///
/// All counts are non-negative. Error paths use {@link #ZERO}.
///
/// @param promptTokens tokens consumed by the request
/// @param completionTokens tokens produced by the model
/// @param totalTokens total as reported by the provider (not recomputed)
public record TokenUsage(long promptTokens, long completionTokens, long totalTokens) {

    public static final TokenUsage ZERO = new TokenUsage(0, 0, 0);

    public TokenUsage {
        if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException(
                    "Token counts must be non-negative: "
                            + promptTokens
                            + "/"
                            + completionTokens
                            + "/"
                            + totalTokens);
        }
    }

    /// Creates a usage record from possibly-null provider counts; nulls count as zero.
    public static TokenUsage of(
            Integer promptTokens, Integer completionTokens, Integer totalTokens) {
        return new TokenUsage(
                promptTokens != null ? promptTokens : 0,
                completionTokens != null ? completionTokens : 0,
                totalTokens != null ? totalTokens : 0);
    }

    /// Returns the component-wise sum of this usage and `other`.
    ///
    /// @param other usage to add, not null
    /// @return new usage record, never null
    public TokenUsage plus(TokenUsage other) {
        return new TokenUsage(
                promptTokens + other.promptTokens,
                completionTokens + other.completionTokens,
                totalTokens + other.totalTokens);
    }
}
