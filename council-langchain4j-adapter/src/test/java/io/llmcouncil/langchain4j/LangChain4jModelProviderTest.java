package io.llmcouncil.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.llmcouncil.core.gateway.ModelClient;
import io.llmcouncil.core.gateway.ModelClientConfig;
import io.llmcouncil.core.gateway.spi.ModelProvider;
import java.time.Duration;
import java.util.Map;
import java.util.ServiceLoader;
import org.junit.jupiter.api.Test;

class LangChain4jModelProviderTest {

    private final LangChain4jModelProvider provider = new LangChain4jModelProvider();

    @Test
    void shouldSupportRoutedAndDirectModelIds() {
        assertThat(provider.supportsModel("anthropic/claude-sonnet-4.5")).isTrue();
        assertThat(provider.supportsModel("claude-sonnet-4-5")).isTrue();
        assertThat(provider.supportsModel("gpt-4o")).isTrue();
        assertThat(provider.supportsModel("o3-mini")).isTrue();
        assertThat(provider.supportsModel("deepseek-reasoner")).isTrue();
        assertThat(provider.supportsModel("llama3")).isFalse();
        assertThat(provider.supportsModel("trailing/")).isFalse();
        assertThat(provider.supportsModel(" ")).isFalse();
    }

    @Test
    void shouldRouteProviderPrefixedIdsThroughOpenRouter() {
        ModelClientConfig config =
                ModelClientConfig.of("anthropic/claude-sonnet-4.5", Duration.ofSeconds(60));

        assertThat(provider.createModel(config, Map.of("OPENROUTER_API_KEY", "or-key")))
                .isInstanceOf(OpenAiChatModel.class);
    }

    @Test
    void shouldUseAnthropicForBareClaudeIds() {
        ModelClientConfig config =
                ModelClientConfig.of("claude-sonnet-4-5", Duration.ofSeconds(60));

        assertThat(provider.createModel(config, Map.of("ANTHROPIC_API_KEY", "ant-key")))
                .isInstanceOf(AnthropicChatModel.class);
    }

    @Test
    void shouldFailWithoutRequiredApiKey() {
        ModelClientConfig config = ModelClientConfig.of("x-ai/grok-4", Duration.ofSeconds(60));

        assertThatThrownBy(() -> provider.createClient(config, Map.of("OPENAI_API_KEY", "k")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("OPENROUTER_API_KEY");
    }

    @Test
    void shouldCreateClientBoundToConfig() {
        ModelClientConfig config = ModelClientConfig.of("gpt-4o", Duration.ofSeconds(60));

        ModelClient client = provider.createClient(config, Map.of("OPENAI_API_KEY", "k"));

        assertThat(client).isInstanceOf(LangChain4jModelClient.class);
        assertThat(client.getConfig()).isSameAs(config);
    }

    @Test
    void shouldBeDiscoverableAsServiceProvider() {
        assertThat(ServiceLoader.load(ModelProvider.class))
                .anyMatch(p -> p instanceof LangChain4jModelProvider);
        assertThat(provider.getPriority()).isEqualTo(100);
    }
}
