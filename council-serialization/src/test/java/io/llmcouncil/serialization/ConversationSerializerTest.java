package io.llmcouncil.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmcouncil.core.conversation.Conversation;
import io.llmcouncil.core.conversation.ConversationMessage;
import io.llmcouncil.core.persona.CouncilMode;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConversationSerializerTest {

    @Nested
    class Shape {

        @Test
        void shouldWriteSnakeCaseFieldsAndRoleDiscriminator() throws Exception {
            // GIVEN
            Conversation conversation = ConversationFixtures.answeredConversation();

            // WHEN
            String json = ConversationSerializer.toJson(conversation);
            JsonNode root = new ObjectMapper().readTree(json);

            // THEN
            assertThat(root.get("id").asText()).isEqualTo("conv-1");
            assertThat(root.get("created_at").asText()).isEqualTo("2025-01-15T10:30:00Z");
            assertThat(root.get("settings").get("mode").asText()).isEqualTo("specialist");
            assertThat(root.get("settings").has("chairman_model")).isFalse();

            JsonNode user = root.get("messages").get(0);
            assertThat(user.get("role").asText()).isEqualTo("user");
            assertThat(user.get("content").asText()).isEqualTo("What is CAP?");

            JsonNode council = root.get("messages").get(1);
            assertThat(council.get("role").asText()).isEqualTo("assistant");
            assertThat(council.get("stage1").get(1).get("thinking_text").asText())
                    .isEqualTo("Recall Brewer's conjecture.");
            assertThat(council.get("stage2").get(0).get("parsed_order")).hasSize(2);
            assertThat(council.get("stage3").get("model_id").asText())
                    .isEqualTo("google/gemini-3-pro-preview");
            assertThat(
                            council.get("metadata")
                                    .get("label_to_model")
                                    .get("Response A")
                                    .asText())
                    .isEqualTo("openai/gpt-5.2");
        }
    }

    @Nested
    class RoundTrip {

        @Test
        void shouldRestoreEqualConversation() {
            Conversation original = ConversationFixtures.answeredConversation();

            Conversation restored =
                    ConversationSerializer.fromJson(ConversationSerializer.toJson(original));

            assertThat(restored).isEqualTo(original);
        }

        @Test
        void shouldReadMinimalStoredConversation() {
            // GIVEN
            String json =
                    """
                    {
                      "id": "old-1",
                      "created_at": "2024-11-02T08:00:00Z",
                      "title": "Legacy",
                      "messages": [
                        {"role": "user", "content": "hi"},
                        {"role": "assistant",
                         "stage3": {"model_id": "x/chair", "answer_text": "hello"}}
                      ],
                      "unknown_field": true
                    }
                    """;

            // WHEN
            Conversation conversation = ConversationSerializer.fromJson(json);

            // THEN
            assertThat(conversation.settings().mode()).isEqualTo(CouncilMode.STANDARD);
            assertThat(conversation.messages()).hasSize(2);
            ConversationMessage.CouncilTurn turn =
                    (ConversationMessage.CouncilTurn) conversation.messages().get(1);
            assertThat(turn.stage1()).isEmpty();
            assertThat(turn.stage3().answerText()).isEqualTo("hello");
        }

        @Test
        void shouldRejectCouncilTurnWithoutChairman() {
            String json =
                    """
                    {"id": "bad", "messages": [{"role": "assistant", "stage1": []}]}
                    """;

            assertThatThrownBy(() -> ConversationSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("stage3");
        }

        @Test
        void shouldRejectUnknownRole() {
            String json =
                    """
                    {"id": "bad", "messages": [{"role": "system", "content": "x"}]}
                    """;

            assertThatThrownBy(() -> ConversationSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("system");
        }
    }
}
