package io.llmcouncil.core.ranking;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Matches numbered lines such as `1. Response C` or `2) response a`.
///
/// Searches the section after the last `FINAL RANKING:` marker, or the whole verdict
/// when the marker is missing.
public final class NumberedRankingStrategy implements RankingStrategy {

    private static final Pattern NUMBERED =
            Pattern.compile("\\d+[.)]\\s*Response\\s+([A-Z])", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<List<String>> parse(String verdict) {
        String section = RankingSection.after(verdict).orElse(verdict);

        List<String> labels = new ArrayList<>();
        Matcher matcher = NUMBERED.matcher(section);
        while (matcher.find()) {
            labels.add(RankingSection.label(matcher.group(1)));
        }
        return labels.isEmpty() ? Optional.empty() : Optional.of(labels);
    }
}
