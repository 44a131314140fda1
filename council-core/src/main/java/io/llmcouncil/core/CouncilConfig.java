package io.llmcouncil.core;

import io.llmcouncil.core.reasoning.ReasoningModels;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Immutable configuration for council runs.
///
/// One instance is threaded explicitly into every run, so concurrent runs with different
/// rosters never share mutable state.
///
/// ### Default Values
/// - `councilModels`: GPT-5.2, Claude Sonnet 4.5, Gemini 3 Pro, Grok 4 (OpenRouter ids)
/// - `chairmanModel`: `google/gemini-3-pro-preview`
/// - `auxiliaryModel`: `google/gemini-2.5-flash` (ranking extraction, titles)
/// - `standardTimeout`: 120 s, `reasoningTimeout`: 300 s
/// - `extractionTimeout`: 20 s, `titleTimeout`: 30 s
/// - `dispatchGrace`: 10 s added on top of the gateway timeout as a safety ceiling
/// - `poolSize`: 16 stage workers shared by concurrent runs; calls beyond it queue, and
///   a queued call does not start its timeout until a worker picks it up
///
/// ### Property Keys
/// {@link #fromProperties(Map)} reads `council.models` (comma separated), `council.chairman`,
/// `council.auxiliary-model`, `council.timeout.standard-seconds`,
/// `council.timeout.reasoning-seconds` and `council.pool-size`.
///
/// @see CouncilFactory
public final class CouncilConfig {

    public static final List<String> DEFAULT_COUNCIL_MODELS =
            List.of(
                    "openai/gpt-5.2",
                    "anthropic/claude-sonnet-4.5",
                    "google/gemini-3-pro-preview",
                    "x-ai/grok-4");
    public static final String DEFAULT_CHAIRMAN_MODEL = "google/gemini-3-pro-preview";
    public static final String DEFAULT_AUXILIARY_MODEL = "google/gemini-2.5-flash";

    /// Labels run from `Response A` to `Response Z`.
    public static final int MAX_COUNCIL_SIZE = 26;

    private final List<String> councilModels;
    private final String chairmanModel;
    private final String auxiliaryModel;
    private final Duration standardTimeout;
    private final Duration reasoningTimeout;
    private final Duration extractionTimeout;
    private final Duration titleTimeout;
    private final Duration dispatchGrace;
    private final int poolSize;

    private CouncilConfig(Builder builder) {
        this.councilModels = distinct(builder.councilModels);
        this.chairmanModel = requireText(builder.chairmanModel, "chairmanModel");
        this.auxiliaryModel = requireText(builder.auxiliaryModel, "auxiliaryModel");
        this.standardTimeout = requirePositive(builder.standardTimeout, "standardTimeout");
        this.reasoningTimeout = requirePositive(builder.reasoningTimeout, "reasoningTimeout");
        this.extractionTimeout = requirePositive(builder.extractionTimeout, "extractionTimeout");
        this.titleTimeout = requirePositive(builder.titleTimeout, "titleTimeout");
        this.dispatchGrace =
                Objects.requireNonNull(builder.dispatchGrace, "dispatchGrace must not be null");
        if (builder.poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive: " + builder.poolSize);
        }
        this.poolSize = builder.poolSize;
    }

    /// Creates a configuration with default values.
    public static CouncilConfig defaults() {
        return builder().build();
    }

    /// Reads a configuration from `council.*` keys; missing keys keep their defaults.
    ///
    /// @param properties configuration values, not null
    /// @return the configuration, never null
    /// @throws IllegalArgumentException if a numeric value cannot be parsed
    public static CouncilConfig fromProperties(Map<String, String> properties) {
        Builder builder = builder();

        String models = properties.get("council.models");
        if (models != null && !models.isBlank()) {
            builder.councilModels(
                    Arrays.stream(models.split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .toList());
        }
        String chairman = properties.get("council.chairman");
        if (chairman != null && !chairman.isBlank()) {
            builder.chairmanModel(chairman.trim());
        }
        String auxiliary = properties.get("council.auxiliary-model");
        if (auxiliary != null && !auxiliary.isBlank()) {
            builder.auxiliaryModel(auxiliary.trim());
        }
        Long standard = parseLong(properties, "council.timeout.standard-seconds");
        if (standard != null) {
            builder.standardTimeout(Duration.ofSeconds(standard));
        }
        Long reasoning = parseLong(properties, "council.timeout.reasoning-seconds");
        if (reasoning != null) {
            builder.reasoningTimeout(Duration.ofSeconds(reasoning));
        }
        Long poolSize = parseLong(properties, "council.pool-size");
        if (poolSize != null) {
            builder.poolSize(poolSize.intValue());
        }
        return builder.build();
    }

    public List<String> getCouncilModels() {
        return councilModels;
    }

    public String getChairmanModel() {
        return chairmanModel;
    }

    public String getAuxiliaryModel() {
        return auxiliaryModel;
    }

    public Duration getStandardTimeout() {
        return standardTimeout;
    }

    public Duration getReasoningTimeout() {
        return reasoningTimeout;
    }

    public Duration getExtractionTimeout() {
        return extractionTimeout;
    }

    public Duration getTitleTimeout() {
        return titleTimeout;
    }

    public Duration getDispatchGrace() {
        return dispatchGrace;
    }

    public int getPoolSize() {
        return poolSize;
    }

    /// Returns the gateway timeout for a model: reasoning models get the longer one.
    ///
    /// @param modelId model identifier, not null
    /// @return timeout, never null
    public Duration timeoutFor(String modelId) {
        return ReasoningModels.isReasoningModel(modelId) ? reasoningTimeout : standardTimeout;
    }

    /// Returns a builder pre-filled with this configuration.
    public Builder toBuilder() {
        return builder()
                .councilModels(councilModels)
                .chairmanModel(chairmanModel)
                .auxiliaryModel(auxiliaryModel)
                .standardTimeout(standardTimeout)
                .reasoningTimeout(reasoningTimeout)
                .extractionTimeout(extractionTimeout)
                .titleTimeout(titleTimeout)
                .dispatchGrace(dispatchGrace)
                .poolSize(poolSize);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CouncilConfig{councilModels="
                + councilModels
                + ", chairmanModel="
                + chairmanModel
                + ", auxiliaryModel="
                + auxiliaryModel
                + ", standardTimeout="
                + standardTimeout
                + ", reasoningTimeout="
                + reasoningTimeout
                + ", poolSize="
                + poolSize
                + "}";
    }

    /// Removes duplicate ids while keeping first occurrences, then validates the roster size.
    static List<String> distinct(List<String> models) {
        Objects.requireNonNull(models, "councilModels must not be null");
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(models));
        if (unique.isEmpty()) {
            throw new IllegalArgumentException("At least one council model is required");
        }
        if (unique.size() > MAX_COUNCIL_SIZE) {
            throw new IllegalArgumentException(
                    "At most " + MAX_COUNCIL_SIZE + " council models are supported");
        }
        for (String model : unique) {
            requireText(model, "council model id");
        }
        return List.copyOf(unique);
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return value;
    }

    private static Long parseLong(Map<String, String> properties, String key) {
        String value = properties.get(key);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    /// Builder for {@link CouncilConfig}.
    ///
    /// @implNote Not thread-safe.
    public static final class Builder {
        private List<String> councilModels = DEFAULT_COUNCIL_MODELS;
        private String chairmanModel = DEFAULT_CHAIRMAN_MODEL;
        private String auxiliaryModel = DEFAULT_AUXILIARY_MODEL;
        private Duration standardTimeout = Duration.ofSeconds(120);
        private Duration reasoningTimeout = Duration.ofSeconds(300);
        private Duration extractionTimeout = Duration.ofSeconds(20);
        private Duration titleTimeout = Duration.ofSeconds(30);
        private Duration dispatchGrace = Duration.ofSeconds(10);
        private int poolSize = 16;

        private Builder() {}

        public Builder councilModels(List<String> councilModels) {
            this.councilModels = councilModels;
            return this;
        }

        public Builder chairmanModel(String chairmanModel) {
            this.chairmanModel = chairmanModel;
            return this;
        }

        public Builder auxiliaryModel(String auxiliaryModel) {
            this.auxiliaryModel = auxiliaryModel;
            return this;
        }

        public Builder standardTimeout(Duration standardTimeout) {
            this.standardTimeout = standardTimeout;
            return this;
        }

        public Builder reasoningTimeout(Duration reasoningTimeout) {
            this.reasoningTimeout = reasoningTimeout;
            return this;
        }

        public Builder extractionTimeout(Duration extractionTimeout) {
            this.extractionTimeout = extractionTimeout;
            return this;
        }

        public Builder titleTimeout(Duration titleTimeout) {
            this.titleTimeout = titleTimeout;
            return this;
        }

        /// Sets the slack added on top of gateway timeouts before a stage gives up on a task.
        public Builder dispatchGrace(Duration dispatchGrace) {
            this.dispatchGrace = dispatchGrace;
            return this;
        }

        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        public CouncilConfig build() {
            return new CouncilConfig(this);
        }
    }
}
