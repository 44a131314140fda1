package io.llmcouncil.core.gateway.stub;

import static org.assertj.core.api.Assertions.assertThat;

import io.llmcouncil.core.gateway.ModelClientConfig;
import io.llmcouncil.core.gateway.ModelReply;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.ranking.RegexRankingParser;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class StubModelClientTest {

    private final StubModelClient client =
            new StubModelClient(ModelClientConfig.of("stub/model", Duration.ofSeconds(5)));

    @AfterEach
    void tearDown() {
        StubResponseRegistry.getInstance().clearResponses();
    }

    @Test
    void shouldReturnRegisteredResponse() {
        StubResponseRegistry.getInstance().registerResponse("stub/model", "Registered answer");

        ModelReply.Text reply = (ModelReply.Text) client.chat(List.of(Message.user("Hi")));

        assertThat(reply.content()).isEqualTo("Registered answer");
        assertThat(reply.metadata()).containsEntry("stub", true);
    }

    @Test
    void shouldProduceParseableRankingForRankingPrompt() {
        // GIVEN
        String prompt =
                """
                Here are the responses:

                Response A:
                first

                Response B:
                second

                End your answer with FINAL RANKING:""";

        // WHEN
        ModelReply.Text reply = (ModelReply.Text) client.chat(List.of(Message.user(prompt)));

        // THEN
        assertThat(new RegexRankingParser().parse(reply.content()))
                .containsExactly("Response A", "Response B");
    }

    @Test
    void shouldProducePersonaForEveryListedModel() {
        String prompt = "Members:\n- a/one\n- b/two\n\nRespond ONLY with a JSON object.";

        ModelReply.Text reply = (ModelReply.Text) client.chat(List.of(Message.user(prompt)));

        assertThat(reply.content())
                .startsWith("{")
                .contains("\"a/one\": \"You are a stub specialist for a/one.\"")
                .contains("\"b/two\"");
    }

    @Test
    void shouldFallBackToGenericAnswerWithEstimatedUsage() {
        ModelReply.Text reply =
                (ModelReply.Text)
                        client.chat(
                                List.of(Message.system("Be brief."), Message.user("What is CAP?")));

        assertThat(reply.content())
                .startsWith("[STUB RESPONSE from stub/model]")
                .contains("What is CAP?");
        assertThat(reply.usage().promptTokens()).isPositive();
        assertThat(reply.usage().totalTokens())
                .isEqualTo(reply.usage().promptTokens() + reply.usage().completionTokens());
    }

    @Test
    void shouldBeEnabledWithTopPriorityWhenForced() {
        StubModelProvider provider = new StubModelProvider(true);

        assertThat(provider.getName()).isEqualTo("stub");
        assertThat(provider.getPriority()).isEqualTo(1000);
        assertThat(provider.supportsModel("anything/at-all")).isTrue();
        ModelClientConfig config = ModelClientConfig.of("x/y", Duration.ofSeconds(1));
        assertThat(provider.createClient(config, Map.of())).isInstanceOf(StubModelClient.class);
    }
}
