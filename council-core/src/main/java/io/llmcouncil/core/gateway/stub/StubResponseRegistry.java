package io.llmcouncil.core.gateway.stub;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Singleton registry for configurable stub responses.
///
/// ### Response Resolution Order
/// 1. Programmatically registered responses for the active scenario
/// 2. Classpath resource `/stubs/{scenario}/{modelId}.txt`
/// 3. Classpath resource `/stubs/default/{modelId}.txt`
/// 4. Returns null (triggers generated output in {@link StubModelClient})
///
/// The active scenario comes from the `council.stub.scenario` system property and
/// defaults to `"default"`. Model ids containing `/` map to resource subdirectories.
///
/// @implNote Thread-safe singleton. Resource lookups are cached.
public class StubResponseRegistry {

    private static final Logger logger = Logger.getLogger(StubResponseRegistry.class.getName());
    private static final String STUB_RESOURCE_BASE = "/stubs/";
    private static final String DEFAULT_SCENARIO = "default";
    private static final String SCENARIO_PROPERTY = "council.stub.scenario";

    private static final StubResponseRegistry INSTANCE = new StubResponseRegistry();

    private final Map<String, Map<String, String>> registeredResponses = new ConcurrentHashMap<>();
    private final Map<String, String> resourceCache = new ConcurrentHashMap<>();

    private StubResponseRegistry() {}

    public static StubResponseRegistry getInstance() {
        return INSTANCE;
    }

    /// Registers a response for one model in a scenario, replacing any previous one.
    ///
    /// @param scenario scenario name, not null
    /// @param modelId model the response is returned for, not null
    /// @param response response text, not null
    public void registerResponse(String scenario, String modelId, String response) {
        registeredResponses
                .computeIfAbsent(scenario, key -> new ConcurrentHashMap<>())
                .put(modelId, response);
        logger.fine("Registered stub response for scenario=" + scenario + ", model=" + modelId);
    }

    /// Registers a response for one model in the default scenario.
    public void registerResponse(String modelId, String response) {
        registerResponse(DEFAULT_SCENARIO, modelId, response);
    }

    /// Clears registered responses and the resource cache.
    public void clearResponses() {
        registeredResponses.clear();
        resourceCache.clear();
    }

    /// Resolves the configured response for a model.
    ///
    /// @param modelId model identifier, not null
    /// @return configured response, or null when nothing is configured
    public String getResponse(String modelId) {
        String scenario = currentScenario();

        Map<String, String> scenarioResponses = registeredResponses.get(scenario);
        if (scenarioResponses != null && scenarioResponses.containsKey(modelId)) {
            logger.info("[STUB] Using registered response for model: " + modelId);
            return scenarioResponses.get(modelId);
        }

        String response = loadResourceResponse(scenario, modelId);
        if (response == null && !DEFAULT_SCENARIO.equals(scenario)) {
            response = loadResourceResponse(DEFAULT_SCENARIO, modelId);
        }
        if (response != null) {
            logger.info("[STUB] Loaded resource response for model: " + modelId);
        }
        return response;
    }

    private String currentScenario() {
        String scenario = System.getProperty(SCENARIO_PROPERTY);
        return scenario != null && !scenario.isBlank() ? scenario : DEFAULT_SCENARIO;
    }

    private String loadResourceResponse(String scenario, String modelId) {
        String cacheKey = scenario + "/" + modelId;
        String cached =
                resourceCache.computeIfAbsent(
                        cacheKey,
                        key -> {
                            String content = loadResource(STUB_RESOURCE_BASE + key + ".txt");
                            return content != null ? content : "";
                        });
        return cached.isEmpty() ? null : cached;
    }

    private String loadResource(String path) {
        try (InputStream is = getClass().getResourceAsStream(path)) {
            if (is == null) {
                return null;
            }
            try (BufferedReader reader =
                    new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.joining("\n"));
            }
        } catch (IOException e) {
            logger.warning("Failed to load stub resource: " + path + " - " + e.getMessage());
            return null;
        }
    }
}
