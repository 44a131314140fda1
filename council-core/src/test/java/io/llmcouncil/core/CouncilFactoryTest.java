package io.llmcouncil.core;

import static org.assertj.core.api.Assertions.assertThat;

import io.llmcouncil.core.conversation.ConversationRepository;
import io.llmcouncil.core.conversation.InMemoryConversationRepository;
import io.llmcouncil.core.gateway.ModelGateway;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CouncilFactoryTest {

    @Mock private ModelGateway gateway;

    @Test
    void shouldLoadPrefixedAndPatternCredentialsFromProperties() {
        // GIVEN
        Properties properties = new Properties();
        properties.setProperty("council.credentials.OPENROUTER_API_KEY", "or-key");
        properties.setProperty("ANTHROPIC_API_KEY", "ant-key");
        properties.setProperty("council.stub.enabled", "true");
        properties.setProperty("council.models", "a/one");
        properties.setProperty("EMPTY_TOKEN", "");

        // WHEN
        Map<String, String> credentials = CouncilFactory.loadCredentialsFromProperties(properties);

        // THEN
        assertThat(credentials)
                .containsOnly(
                        Map.entry("OPENROUTER_API_KEY", "or-key"),
                        Map.entry("ANTHROPIC_API_KEY", "ant-key"),
                        Map.entry("council.stub.enabled", "true"));
    }

    @Test
    void shouldDetectStubSwitchFromEitherKey() {
        assertThat(CouncilFactory.isStubEnabled(Map.of("COUNCIL_STUB_ENABLED", "TRUE"))).isTrue();
        assertThat(CouncilFactory.isStubEnabled(Map.of("council.stub.enabled", "true"))).isTrue();
        assertThat(CouncilFactory.isStubEnabled(Map.of("council.stub.enabled", "no"))).isFalse();
        assertThat(CouncilFactory.isStubEnabled(Map.of())).isFalse();
    }

    @Test
    void shouldWireEnvironmentAroundProvidedGatewayAndRepository() {
        // GIVEN
        ConversationRepository repository = new InMemoryConversationRepository();
        CouncilConfig config = CouncilConfig.builder().poolSize(2).build();

        // WHEN
        try (CouncilEnvironment environment =
                CouncilFactory.builder()
                        .config(config)
                        .gateway(gateway)
                        .conversationRepository(repository)
                        .build()) {

            // THEN
            assertThat(environment.getGateway()).isSameAs(gateway);
            assertThat(environment.getConversationRepository()).isSameAs(repository);
            assertThat(environment.getConfig()).isSameAs(config);
            assertThat(environment.getOrchestrator()).isNotNull();
            assertThat(environment.getConversationService()).isNotNull();
            assertThat(environment.getCostCalculator()).isNotNull();
        }
    }
}
