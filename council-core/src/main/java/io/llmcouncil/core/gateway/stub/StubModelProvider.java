package io.llmcouncil.core.gateway.stub;

import io.llmcouncil.core.gateway.ModelClient;
import io.llmcouncil.core.gateway.ModelClientConfig;
import io.llmcouncil.core.gateway.spi.ModelProvider;
import java.util.Map;
import java.util.logging.Logger;

/// Model provider that returns stub replies for testing without external API calls.
///
/// When enabled, intercepts ALL model requests with the highest priority (1000).
///
/// ### Enabling Stub Mode
/// - Constructor flag: `new StubModelProvider(true)`
/// - System property: `-Dcouncil.stub.enabled=true`
/// - Environment variable: `COUNCIL_STUB_ENABLED=true`
///
/// @implNote Thread-safe. Creates a new {@link StubModelClient} per request.
public class StubModelProvider implements ModelProvider {

    private static final Logger logger = Logger.getLogger(StubModelProvider.class.getName());

    public static final String ENABLED_KEY = "COUNCIL_STUB_ENABLED";
    public static final String ENABLED_PROPERTY = "council.stub.enabled";

    private final boolean forceEnabled;

    /// Creates a provider enabled by system property or environment variable.
    public StubModelProvider() {
        this(false);
    }

    /// @param forceEnabled when true the provider is enabled regardless of global settings
    public StubModelProvider(boolean forceEnabled) {
        this.forceEnabled = forceEnabled;
    }

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supportsModel(String modelId) {
        return isEnabled();
    }

    @Override
    public ModelClient createClient(ModelClientConfig config, Map<String, String> credentials) {
        if (!isEnabled()) {
            throw new IllegalStateException("Stub provider called but not enabled");
        }
        logger.info("[STUB] Creating stub client for model: " + config.getModelId());
        return new StubModelClient(config);
    }

    /// @return 1000 when enabled, -1 otherwise
    @Override
    public int getPriority() {
        return isEnabled() ? 1000 : -1;
    }

    /// Checks whether stub mode is on.
    public boolean isEnabled() {
        return forceEnabled || isEnabledGlobally();
    }

    /// Checks the system property and the environment variable.
    public static boolean isEnabledGlobally() {
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }
}
