package io.llmcouncil.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.llmcouncil.core.gateway.ModelClient;
import io.llmcouncil.core.gateway.ModelClientConfig;
import io.llmcouncil.core.gateway.spi.ModelProvider;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link ModelProvider}.
///
/// Routes model ids to a backend:
/// - `provider/model` ids (e.g. `anthropic/claude-sonnet-4.5`) go to OpenRouter's
///   OpenAI-compatible endpoint with `OPENROUTER_API_KEY`
/// - bare `gpt*`, `o1*` and `o3*` ids go to OpenAI
/// - bare `deepseek*` ids go to the DeepSeek OpenAI-compatible endpoint
/// - bare `claude*` ids go to Anthropic
///
/// @implNote Stateless and thread-safe. Each call to {@link #createClient} creates a new
/// model instance.
///
/// @see LangChain4jModelClient for the client implementation
public class LangChain4jModelProvider implements ModelProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jModelProvider.class.getName());

    static final String OPENROUTER_BASE_URL = "https://openrouter.ai/api/v1";
    static final String DEEPSEEK_BASE_URL = "https://api.deepseek.com";

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    @Override
    public String getName() {
        return "langchain4j";
    }

    @Override
    public boolean supportsModel(String modelId) {
        if (modelId == null || modelId.isBlank()) return false;
        return isRoutedModel(modelId)
                || modelId.startsWith("claude")
                || isOpenAiModel(modelId)
                || modelId.startsWith("deepseek");
    }

    @Override
    public ModelClient createClient(ModelClientConfig config, Map<String, String> credentials) {
        logger.info("Creating LangChain4j client for model: " + config.getModelId());
        return new LangChain4jModelClient(config, createModel(config, credentials));
    }

    @Override
    public int getPriority() {
        return 100;
    }

    /// Creates the {@link ChatModel} for the model id.
    ///
    /// @throws IllegalArgumentException if the model id is not supported
    /// @throws IllegalStateException if the required API key is missing
    ChatModel createModel(ModelClientConfig config, Map<String, String> credentials) {
        String modelId = config.getModelId();

        if (isRoutedModel(modelId)) {
            String apiKey =
                    requireApiKey(credentials, "OPENROUTER_API_KEY", "openrouter_api_key");
            return createOpenAiCompatibleModel(config, apiKey, OPENROUTER_BASE_URL);
        } else if (modelId.startsWith("claude")) {
            return createAnthropicModel(config, credentials);
        } else if (isOpenAiModel(modelId)) {
            String apiKey = requireApiKey(credentials, "OPENAI_API_KEY", "openai_api_key");
            return createOpenAiCompatibleModel(config, apiKey, null);
        } else if (modelId.startsWith("deepseek")) {
            String apiKey = requireApiKey(credentials, "DEEPSEEK_API_KEY", "deepseek_api_key");
            return createOpenAiCompatibleModel(config, apiKey, DEEPSEEK_BASE_URL);
        }

        throw new IllegalArgumentException("Unsupported model: " + modelId);
    }

    private ChatModel createAnthropicModel(
            ModelClientConfig config, Map<String, String> credentials) {
        String apiKey = requireApiKey(credentials, "ANTHROPIC_API_KEY", "anthropic_api_key");

        var builder =
                AnthropicChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModelId())
                        .timeout(timeout(config));

        if (config.getTemperature() != null) builder.temperature(config.getTemperature());
        if (config.getMaxTokens() != null) builder.maxTokens(config.getMaxTokens());

        return builder.build();
    }

    /// Creates an OpenAI-compatible model, used for OpenRouter, OpenAI and DeepSeek.
    ///
    /// @param baseUrl custom API endpoint, may be null (uses OpenAI default)
    private ChatModel createOpenAiCompatibleModel(
            ModelClientConfig config, String apiKey, String baseUrl) {
        var builder =
                OpenAiChatModel.builder()
                        .apiKey(apiKey)
                        .modelName(config.getModelId())
                        .timeout(timeout(config));

        if (baseUrl != null) builder.baseUrl(baseUrl);
        if (config.getTemperature() != null) builder.temperature(config.getTemperature());
        if (config.getMaxTokens() != null) builder.maxTokens(config.getMaxTokens());

        return builder.build();
    }

    static boolean isRoutedModel(String modelId) {
        int slash = modelId.indexOf('/');
        return slash > 0 && slash < modelId.length() - 1;
    }

    private static boolean isOpenAiModel(String modelId) {
        return modelId.startsWith("gpt") || modelId.startsWith("o1") || modelId.startsWith("o3");
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @throws IllegalStateException if no key name resolves to a value
    private String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }

    private Duration timeout(ModelClientConfig config) {
        return config.getTimeout() != null ? config.getTimeout() : DEFAULT_TIMEOUT;
    }
}
