package io.llmcouncil.core.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmcouncil.core.council.CouncilResult;
import io.llmcouncil.core.exception.ConversationNotFoundException;
import io.llmcouncil.core.message.Message;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryConversationRepositoryTest {

    private InMemoryConversationRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryConversationRepository();
    }

    @Test
    void shouldCreateEmptyUntitledConversation() {
        Conversation created = repository.create("c1", ConversationSettings.defaults());

        assertThat(created.title()).isEqualTo(Conversation.UNTITLED);
        assertThat(created.messages()).isEmpty();
        assertThat(repository.find("c1")).contains(created);
    }

    @Test
    void shouldRejectDuplicateIds() {
        repository.create("c1", ConversationSettings.defaults());

        assertThatThrownBy(() -> repository.create("c1", ConversationSettings.defaults()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldAppendTurnsInOrderAndExposeHistory() {
        // GIVEN
        repository.create("c1", ConversationSettings.defaults());

        // WHEN
        repository.appendUserMessage("c1", "Hello?");
        repository.appendAssistantMessage("c1", CouncilResult.terminalError());
        Conversation updated = repository.updateTitle("c1", "Greetings");

        // THEN
        assertThat(updated.title()).isEqualTo("Greetings");
        assertThat(updated.messages())
                .hasSize(2)
                .first()
                .isInstanceOf(ConversationMessage.UserTurn.class);
        assertThat(updated.history())
                .containsExactly(
                        Message.user("Hello?"),
                        Message.assistant(CouncilResult.TERMINAL_ERROR_TEXT));
        assertThat(repository.list())
                .singleElement()
                .satisfies(s -> assertThat(s.messageCount()).isEqualTo(2));
    }

    @Test
    void shouldThrowWhenUpdatingUnknownConversation() {
        assertThatThrownBy(() -> repository.appendUserMessage("missing", "hi"))
                .isInstanceOf(ConversationNotFoundException.class);
    }

    @Test
    void shouldDeleteConversation() {
        repository.create("c1", ConversationSettings.defaults());

        assertThat(repository.delete("c1")).isTrue();
        assertThat(repository.delete("c1")).isFalse();
        assertThat(repository.find("c1")).isEmpty();
    }
}
