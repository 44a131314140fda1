package io.llmcouncil.core.ranking;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Reads bare capital letters from numbered lines inside the `FINAL RANKING:` section,
/// e.g. `1. C`, and expands them to `Response C`.
///
/// Declines when the verdict has no marker.
public final class LetterOnlyStrategy implements RankingStrategy {

    private static final Pattern NUMBERED_LETTER = Pattern.compile("\\d+[.)]\\s*([A-Z])(?!\\w)");

    @Override
    public Optional<List<String>> parse(String verdict) {
        Optional<String> section = RankingSection.after(verdict);
        if (section.isEmpty()) {
            return Optional.empty();
        }

        List<String> labels = new ArrayList<>();
        Matcher matcher = NUMBERED_LETTER.matcher(section.get());
        while (matcher.find()) {
            labels.add(RankingSection.label(matcher.group(1)));
        }
        return labels.isEmpty() ? Optional.empty() : Optional.of(labels);
    }
}
