package io.llmcouncil.core.ranking;

import java.util.Locale;
import java.util.Optional;

/// Locates the `FINAL RANKING:` section of a verdict.
final class RankingSection {

    static final String MARKER = "FINAL RANKING:";

    private RankingSection() {}

    /// Returns the text after the last marker occurrence.
    ///
    /// @param verdict verdict text, not null
    /// @return trailing section, or empty when the marker is absent
    static Optional<String> after(String verdict) {
        int index = verdict.lastIndexOf(MARKER);
        if (index < 0) {
            return Optional.empty();
        }
        return Optional.of(verdict.substring(index + MARKER.length()));
    }

    /// Canonical label for a letter, e.g. `"Response C"`.
    static String label(String letter) {
        return "Response " + letter.toUpperCase(Locale.ROOT);
    }
}
