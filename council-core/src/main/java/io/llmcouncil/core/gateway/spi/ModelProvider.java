package io.llmcouncil.core.gateway.spi;

import io.llmcouncil.core.gateway.ModelClient;
import io.llmcouncil.core.gateway.ModelClientConfig;
import java.util.Map;

/// Provider interface for pluggable model backends.
///
/// Implementations are registered in
/// `META-INF/services/io.llmcouncil.core.gateway.spi.ModelProvider` for discovery by
/// {@link io.llmcouncil.core.CouncilFactory}, or passed to it explicitly.
///
/// ### Priority System
/// When multiple providers support the same model, the one with the highest
/// {@link #getPriority()} value is selected. The stub provider uses a high priority to
/// intercept every model when stub mode is enabled.
///
/// @implNote Implementations should be stateless and thread-safe.
///
/// @see io.llmcouncil.core.gateway.stub.StubModelProvider for a testing implementation
public interface ModelProvider {

    /// Returns the provider's display name for logging and diagnostics.
    ///
    /// @return provider name (e.g., "langchain4j", "stub"), never null
    String getName();

    /// Checks if this provider can create clients for the specified model.
    ///
    /// @param modelId model identifier, not null
    /// @return `true` if this provider can serve the model
    boolean supportsModel(String modelId);

    /// Creates a client for the specified configuration.
    ///
    /// @param config client configuration, not null
    /// @param credentials API keys and settings, not null
    /// @return configured client, never null
    /// @throws IllegalStateException if required credentials are missing
    /// @throws IllegalArgumentException if the configuration is invalid for this provider
    ModelClient createClient(ModelClientConfig config, Map<String, String> credentials);

    /// Returns this provider's priority for model selection; higher wins.
    ///
    /// @return priority value (default: 0)
    default int getPriority() {
        return 0;
    }
}
