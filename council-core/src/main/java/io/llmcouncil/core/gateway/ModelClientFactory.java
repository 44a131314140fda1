package io.llmcouncil.core.gateway;

import io.llmcouncil.core.exception.ModelProviderNotFoundException;
import io.llmcouncil.core.gateway.spi.ModelProvider;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Creates {@link ModelClient}s using explicitly supplied {@link ModelProvider}s.
///
/// For each request the highest-priority provider that supports the model is used.
///
/// @implNote Thread-safe after construction. Provider list and credentials are
/// immutable once the factory is created.
public class ModelClientFactory {

    private static final Logger logger = Logger.getLogger(ModelClientFactory.class.getName());

    private final List<ModelProvider> providers;
    private final Map<String, String> credentials;

    /// @param credentials API keys and settings passed to providers, not null
    /// @param providers available providers, not null (may be empty)
    public ModelClientFactory(Map<String, String> credentials, List<ModelProvider> providers) {
        this.credentials = Map.copyOf(new HashMap<>(credentials));
        this.providers = List.copyOf(providers);

        logger.info(
                "Loaded "
                        + this.providers.size()
                        + " model providers: "
                        + this.providers.stream().map(ModelProvider::getName).toList());
    }

    /// Creates a client for the configured model.
    ///
    /// @param config client configuration, not null
    /// @return the created client, never null
    /// @throws ModelProviderNotFoundException if no provider supports the model
    public ModelClient createClient(ModelClientConfig config) {
        String modelId = config.getModelId();

        ModelProvider provider =
                providers.stream()
                        .filter(p -> p.supportsModel(modelId))
                        .max(Comparator.comparingInt(ModelProvider::getPriority))
                        .orElseThrow(() -> new ModelProviderNotFoundException(modelId));

        logger.fine("Using provider '" + provider.getName() + "' for model: " + modelId);
        return provider.createClient(config, credentials);
    }

    /// Returns the names of the available providers.
    public List<String> getProviderNames() {
        return providers.stream().map(ModelProvider::getName).toList();
    }
}
