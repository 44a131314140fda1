package io.llmcouncil.core.ranking;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Collects every `Response X` mention across the whole verdict, first-seen order.
public final class InlineMentionStrategy implements RankingStrategy {

    private static final Pattern MENTION =
            Pattern.compile("Response\\s+([A-Z])\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<List<String>> parse(String verdict) {
        Set<String> seen = new LinkedHashSet<>();
        Matcher matcher = MENTION.matcher(verdict);
        while (matcher.find()) {
            seen.add(RankingSection.label(matcher.group(1)));
        }
        return seen.isEmpty() ? Optional.empty() : Optional.of(new ArrayList<>(seen));
    }
}
