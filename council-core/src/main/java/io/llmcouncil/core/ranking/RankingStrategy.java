package io.llmcouncil.core.ranking;

import java.util.List;
import java.util.Optional;

/// One layer of the verdict-parsing chain.
///
/// Strategies are pure: they read the verdict text and either recognize an ordered
/// list of labels or decline. {@link RegexRankingParser} tries them in order and keeps
/// the first non-empty result.
@FunctionalInterface
public interface RankingStrategy {

    /// Parses an ordered label list out of a verdict.
    ///
    /// @param verdict verdict text with bold markers already removed, not null
    /// @return labels best to worst, or empty when this strategy does not apply
    Optional<List<String>> parse(String verdict);
}
