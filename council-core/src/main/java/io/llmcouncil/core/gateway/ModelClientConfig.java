package io.llmcouncil.core.gateway;

import java.time.Duration;
import java.util.Objects;

/// Immutable configuration for creating a {@link ModelClient}.
///
/// ### Required Fields
/// - `modelId` - backend model identifier (e.g., `"anthropic/claude-sonnet-4.5"`)
///
/// ### Optional Parameters
/// - `temperature` - sampling temperature (provider default when null)
/// - `maxTokens` - maximum response tokens (provider default when null)
/// - `timeout` - request timeout (provider default when null)
///
/// Two configurations are equal when all fields are equal, so a configuration can key a
/// client cache.
public final class ModelClientConfig {

    private final String modelId;
    private final Double temperature;
    private final Integer maxTokens;
    private final Duration timeout;

    private ModelClientConfig(Builder builder) {
        this.modelId = Objects.requireNonNull(builder.modelId, "Model ID required");
        this.temperature = builder.temperature;
        this.maxTokens = builder.maxTokens;
        this.timeout = builder.timeout;
    }

    public String getModelId() {
        return modelId;
    }

    /// @return sampling temperature, may be null
    public Double getTemperature() {
        return temperature;
    }

    /// @return max tokens limit, may be null
    public Integer getMaxTokens() {
        return maxTokens;
    }

    /// @return request timeout, may be null
    public Duration getTimeout() {
        return timeout;
    }

    public static ModelClientConfig of(String modelId, Duration timeout) {
        return builder().modelId(modelId).timeout(timeout).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link ModelClientConfig}.
    ///
    /// @implNote Not thread-safe.
    public static final class Builder {
        private String modelId;
        private Double temperature;
        private Integer maxTokens;
        private Duration timeout;

        private Builder() {}

        public Builder modelId(String modelId) {
            this.modelId = modelId;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /// @throws NullPointerException if modelId is null
        public ModelClientConfig build() {
            return new ModelClientConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelClientConfig that)) return false;
        return modelId.equals(that.modelId)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(maxTokens, that.maxTokens)
                && Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modelId, temperature, maxTokens, timeout);
    }

    @Override
    public String toString() {
        return "ModelClientConfig{modelId='" + modelId + "', timeout=" + timeout + "}";
    }
}
