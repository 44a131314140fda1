package io.llmcouncil.core.ranking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/// Turns a free-text verdict into an ordered label list restricted to the round's labels.
///
/// ### Procedure
/// 1. Run the {@link RegexRankingParser} chain
/// 2. Drop duplicates and labels outside the round
/// 3. When fewer labels than candidates were found and the fallback is allowed, ask the
///    {@link ModelAssistedRankingExtractor}; adopt its list if it has at least as many labels
///
/// @implNote Thread-safe when the assisted extractor is.
public class RankingExtractor {

    private static final Logger logger = Logger.getLogger(RankingExtractor.class.getName());

    private final RegexRankingParser regexParser;
    private final ModelAssistedRankingExtractor assistedExtractor;

    /// @param regexParser regex chain, not null
    /// @param assistedExtractor fallback extractor, may be null to disable the fallback
    public RankingExtractor(
            RegexRankingParser regexParser, ModelAssistedRankingExtractor assistedExtractor) {
        this.regexParser = regexParser;
        this.assistedExtractor = assistedExtractor;
    }

    /// Creates an extractor without model-assisted fallback.
    public static RankingExtractor regexOnly() {
        return new RankingExtractor(new RegexRankingParser(), null);
    }

    /// Extracts the ranking of one verdict.
    ///
    /// @param verdict raw verdict text, may be null
    /// @param labels labels of the round in assignment order, not null
    /// @param allowFallback whether the model-assisted fallback may run
    /// @return distinct labels from `labels`, best first, never null
    public List<String> extract(String verdict, List<String> labels, boolean allowFallback) {
        List<String> parsed = restrict(regexParser.parse(verdict), labels);

        if (allowFallback
                && assistedExtractor != null
                && verdict != null
                && !verdict.isBlank()
                && parsed.size() < labels.size()) {
            logger.info(
                    "Regex parse found "
                            + parsed.size()
                            + " of "
                            + labels.size()
                            + " labels, trying model-assisted extraction");
            List<String> assisted = restrict(assistedExtractor.extract(verdict, labels), labels);
            if (assisted.size() >= parsed.size()) {
                parsed = assisted;
            }
        }
        return parsed;
    }

    private static List<String> restrict(List<String> candidates, List<String> labels) {
        Set<String> allowed = Set.copyOf(labels);
        Set<String> result = new LinkedHashSet<>();
        for (String candidate : candidates) {
            if (allowed.contains(candidate)) {
                result.add(candidate);
            }
        }
        return List.copyOf(new ArrayList<>(result));
    }
}
