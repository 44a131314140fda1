package io.llmcouncil.core.pricing;

/// Price of a model in USD per million tokens.
///
/// @param prompt price per million prompt (input) tokens, non-negative
/// @param completion price per million completion (output) tokens, non-negative
public record ModelPrice(double prompt, double completion) {

    public ModelPrice {
        if (prompt < 0 || completion < 0) {
            throw new IllegalArgumentException("Prices must be non-negative");
        }
    }
}
