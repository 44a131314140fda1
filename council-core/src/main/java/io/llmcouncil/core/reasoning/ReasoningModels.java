package io.llmcouncil.core.reasoning;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Detection and output handling for extended-reasoning models (o1, o3, DeepSeek-R1, ...).
///
/// Reasoning models get a longer per-call timeout and their output may wrap the thinking
/// process in `<think>`, `<reasoning>` or `<thought>` tags, which is split off into a
/// separate segment.
public final class ReasoningModels {

    private static final Set<String> KNOWN_REASONING_MODELS =
            Set.of(
                    "openai/o1",
                    "openai/o1-preview",
                    "openai/o1-mini",
                    "openai/o3",
                    "openai/o3-mini",
                    "deepseek/deepseek-r1",
                    "deepseek/deepseek-reasoner",
                    "nex-agi/deepseek-v3.1-nex-n1:free");

    private static final List<String> REASONING_KEYWORDS =
            List.of("o1", "o3", "deepseek-r", "reasoner", "reasoning");

    private static final List<Pattern> THINKING_PATTERNS =
            List.of(
                    Pattern.compile("<think>(.*?)</think>(.*)", Pattern.DOTALL),
                    Pattern.compile("<reasoning>(.*?)</reasoning>(.*)", Pattern.DOTALL),
                    Pattern.compile("<thought>(.*?)</thought>(.*)", Pattern.DOTALL));

    private ReasoningModels() {}

    /// Returns `true` for known reasoning models and ids containing a reasoning keyword.
    ///
    /// @param modelId model identifier, not null
    public static boolean isReasoningModel(String modelId) {
        if (KNOWN_REASONING_MODELS.contains(modelId)) {
            return true;
        }
        String lower = modelId.toLowerCase(Locale.ROOT);
        return REASONING_KEYWORDS.stream().anyMatch(lower::contains);
    }

    /// Splits a raw reply into thinking and answer.
    ///
    /// The first matching tag style wins. Without tags the whole content is the answer.
    ///
    /// @param content raw model output, may be null
    /// @return split result, never null
    public static ReasoningSplit split(String content) {
        if (content == null || content.isEmpty()) {
            return new ReasoningSplit("", "");
        }
        for (Pattern pattern : THINKING_PATTERNS) {
            Matcher matcher = pattern.matcher(content);
            if (matcher.find()) {
                return new ReasoningSplit(matcher.group(1).strip(), matcher.group(2).strip());
            }
        }
        return new ReasoningSplit("", content);
    }
}
