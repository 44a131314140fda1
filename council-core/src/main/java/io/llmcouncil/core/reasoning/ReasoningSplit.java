package io.llmcouncil.core.reasoning;

/// A model reply separated into its thinking segment and its final answer.
///
/// @param thinking extracted reasoning text, empty when none was found
/// @param answer the answer with reasoning tags removed
public record ReasoningSplit(String thinking, String answer) {

    public ReasoningSplit {
        thinking = thinking != null ? thinking : "";
        answer = answer != null ? answer : "";
    }

    public boolean hasThinking() {
        return !thinking.isEmpty();
    }
}
