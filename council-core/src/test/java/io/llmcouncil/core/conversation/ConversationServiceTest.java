package io.llmcouncil.core.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.CouncilEnvironment;
import io.llmcouncil.core.CouncilFactory;
import io.llmcouncil.core.council.AggregateEntry;
import io.llmcouncil.core.council.CouncilResult;
import io.llmcouncil.core.event.CouncilEvent;
import io.llmcouncil.core.exception.ConversationNotFoundException;
import io.llmcouncil.core.gateway.stub.StubResponseRegistry;
import io.llmcouncil.core.pricing.CostEstimate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/// Runs whole conversations against the stub provider.
class ConversationServiceTest {

    private static final CouncilConfig CONFIG =
            CouncilConfig.builder()
                    .councilModels(List.of("a/one", "b/two", "c/three"))
                    .chairmanModel("c/chair")
                    .auxiliaryModel("a/aux")
                    .poolSize(4)
                    .build();

    private CouncilEnvironment environment;
    private ConversationService service;

    @BeforeEach
    void setUp() {
        StubResponseRegistry.getInstance().clearResponses();
        environment = CouncilFactory.builder().config(CONFIG).stubMode(true).build();
        service = environment.getConversationService();
    }

    @AfterEach
    void tearDown() {
        environment.close();
        StubResponseRegistry.getInstance().clearResponses();
    }

    @Test
    void shouldRunCouncilAndNameConversationOnFirstMessage() {
        // GIVEN
        Conversation conversation = service.createConversation(ConversationSettings.defaults());
        List<CouncilEvent> events = new CopyOnWriteArrayList<>();

        // WHEN
        CouncilResult result =
                service.sendMessage(conversation.id(), "What is CAP?", events::add);

        // THEN
        assertThat(result.isTerminalError()).isFalse();
        assertThat(result.answers())
                .extracting(a -> a.modelId())
                .containsExactly("a/one", "b/two", "c/three");
        assertThat(result.chairman().modelId()).isEqualTo("c/chair");
        assertThat(result.metadata().aggregateRankings())
                .extracting(AggregateEntry::modelId)
                .containsExactly("a/one", "b/two", "c/three");
        assertThat(result.metadata().totalTokens().totalTokens()).isPositive();

        assertThat(events)
                .extracting(CouncilEvent::type)
                .containsSubsequence(
                        "stage1_start",
                        "stage1_complete",
                        "stage2_start",
                        "stage2_complete",
                        "stage3_start",
                        "stage3_complete",
                        "title_complete",
                        "complete")
                .last()
                .isEqualTo("complete");

        Conversation stored = service.getConversation(conversation.id());
        assertThat(stored.title()).isEqualTo("Stub Council Conversation");
        assertThat(stored.messages())
                .hasSize(2)
                .last()
                .isInstanceOf(ConversationMessage.CouncilTurn.class);
    }

    @Test
    void shouldKeepTitleOnFollowUpMessages() {
        // GIVEN
        Conversation conversation = service.createConversation(ConversationSettings.defaults());
        service.sendMessage(conversation.id(), "First question");
        List<CouncilEvent> events = new CopyOnWriteArrayList<>();

        // WHEN
        service.sendMessage(conversation.id(), "Follow-up", events::add);

        // THEN
        assertThat(events).extracting(CouncilEvent::type).doesNotContain("title_complete");
        assertThat(service.getConversation(conversation.id()).messages()).hasSize(4);
        assertThat(service.listConversations())
                .singleElement()
                .satisfies(s -> assertThat(s.messageCount()).isEqualTo(4));
    }

    @Test
    void shouldUseChairmanReplyConfiguredInRegistry() {
        StubResponseRegistry.getInstance().registerResponse("c/chair", "Final: it depends.");
        Conversation conversation = service.createConversation(ConversationSettings.defaults());

        CouncilResult result = service.sendMessage(conversation.id(), "Which database?");

        assertThat(result.chairman().answerText()).isEqualTo("Final: it depends.");
    }

    @Test
    void shouldRejectBlankMessage() {
        Conversation conversation = service.createConversation(ConversationSettings.defaults());

        assertThatThrownBy(() -> service.sendMessage(conversation.id(), "  "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(service.getConversation(conversation.id()).messages()).isEmpty();
    }

    @Test
    void shouldThrowForUnknownConversation() {
        assertThatThrownBy(() -> service.sendMessage("missing", "hello"))
                .isInstanceOf(ConversationNotFoundException.class);
        assertThatThrownBy(() -> service.getConversation("missing"))
                .isInstanceOf(ConversationNotFoundException.class);
    }

    @Test
    void shouldEstimateCostForRosterAndChairman() {
        CostEstimate estimate = service.estimateCost(null, "x".repeat(400));

        assertThat(estimate.promptTokens()).isEqualTo(100);
        assertThat(estimate.perModel()).containsOnlyKeys("a/one", "b/two", "c/three", "c/chair");
        assertThat(estimate.total()).isPositive();
    }

    @Test
    void shouldDeleteConversation() {
        Conversation conversation = service.createConversation(ConversationSettings.defaults());

        assertThat(service.deleteConversation(conversation.id())).isTrue();
        assertThat(service.listConversations()).isEmpty();
    }
}
