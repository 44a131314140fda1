package io.llmcouncil.core.pricing;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Static per-model price lookup with a fallback tier for unknown model ids.
///
/// ### Default Prices (USD per 1M tokens, prompt / completion)
/// - `openai/gpt-5.2`: 10.00 / 30.00
/// - `anthropic/claude-sonnet-4.5`: 3.00 / 15.00
/// - `anthropic/claude-opus-4.5`: 15.00 / 75.00
/// - `google/gemini-3-pro-preview`: 3.50 / 10.50
/// - `google/gemini-3-flash-preview`: 0.15 / 0.60
/// - `x-ai/grok-4.1-fast`: 0.50 / 1.50
/// - `x-ai/grok-4`: 5.00 / 15.00
/// - `deepseek/deepseek-r1`: 0.55 / 2.19
/// - `nex-agi/deepseek-v3.1-nex-n1:free`: free
/// - anything else: 1.00 / 3.00
///
/// @implNote Immutable and thread-safe once built.
public final class PriceTable {

    public static final ModelPrice DEFAULT_PRICE = new ModelPrice(1.00, 3.00);

    private static final PriceTable DEFAULTS =
            builder()
                    .price("openai/gpt-5.2", 10.00, 30.00)
                    .price("anthropic/claude-sonnet-4.5", 3.00, 15.00)
                    .price("anthropic/claude-opus-4.5", 15.00, 75.00)
                    .price("google/gemini-3-pro-preview", 3.50, 10.50)
                    .price("google/gemini-3-flash-preview", 0.15, 0.60)
                    .price("x-ai/grok-4.1-fast", 0.50, 1.50)
                    .price("x-ai/grok-4", 5.00, 15.00)
                    .price("deepseek/deepseek-r1", 0.55, 2.19)
                    .price("nex-agi/deepseek-v3.1-nex-n1:free", 0.00, 0.00)
                    .build();

    private final Map<String, ModelPrice> prices;
    private final ModelPrice fallback;

    private PriceTable(Map<String, ModelPrice> prices, ModelPrice fallback) {
        this.prices = Map.copyOf(prices);
        this.fallback = fallback;
    }

    /// Returns the built-in price table.
    public static PriceTable defaults() {
        return DEFAULTS;
    }

    /// Looks up the price for a model, falling back to the default tier.
    ///
    /// @param modelId model identifier, not null
    /// @return price for the model, never null
    public ModelPrice priceFor(String modelId) {
        return prices.getOrDefault(modelId, fallback);
    }

    /// Returns `true` if the model has an explicit entry (not the fallback tier).
    public boolean isKnown(String modelId) {
        return prices.containsKey(modelId);
    }

    /// Returns a builder pre-populated with this table's entries, for overriding prices.
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.prices.putAll(prices);
        builder.fallback = fallback;
        return builder;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, ModelPrice> prices = new LinkedHashMap<>();
        private ModelPrice fallback = DEFAULT_PRICE;

        private Builder() {}

        public Builder price(String modelId, double prompt, double completion) {
            Objects.requireNonNull(modelId, "modelId must not be null");
            prices.put(modelId, new ModelPrice(prompt, completion));
            return this;
        }

        public Builder fallback(ModelPrice fallback) {
            this.fallback = Objects.requireNonNull(fallback, "fallback must not be null");
            return this;
        }

        public PriceTable build() {
            return new PriceTable(prices, fallback);
        }
    }
}
