package io.llmcouncil.core.ranking;

import java.util.List;
import java.util.Optional;

/// Ordered chain of {@link RankingStrategy}s applied to a verdict.
///
/// Bold markers (`**`) are removed first. The default chain is:
/// 1. {@link NumberedRankingStrategy}
/// 2. {@link InlineMentionStrategy}
/// 3. {@link LetterOnlyStrategy}
///
/// The first strategy returning a non-empty list wins.
///
/// @implNote Thread-safe. Strategies are stateless.
public final class RegexRankingParser {

    private final List<RankingStrategy> strategies;

    public RegexRankingParser() {
        this(
                List.of(
                        new NumberedRankingStrategy(),
                        new InlineMentionStrategy(),
                        new LetterOnlyStrategy()));
    }

    /// @param strategies strategies in priority order, not null
    public RegexRankingParser(List<RankingStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /// Parses a verdict into labels, best first.
    ///
    /// @param verdict raw verdict text, may be null
    /// @return ordered labels, empty when nothing was recognized, never null
    public List<String> parse(String verdict) {
        if (verdict == null || verdict.isEmpty()) {
            return List.of();
        }
        String normalized = verdict.replace("**", "");

        for (RankingStrategy strategy : strategies) {
            Optional<List<String>> parsed = strategy.parse(normalized);
            if (parsed.isPresent() && !parsed.get().isEmpty()) {
                return List.copyOf(parsed.get());
            }
        }
        return List.of();
    }
}
