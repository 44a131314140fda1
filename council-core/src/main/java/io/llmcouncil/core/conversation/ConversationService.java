package io.llmcouncil.core.conversation;

import io.llmcouncil.core.council.CouncilOrchestrator;
import io.llmcouncil.core.council.CouncilResult;
import io.llmcouncil.core.council.RunConfiguration;
import io.llmcouncil.core.event.CouncilEvent;
import io.llmcouncil.core.event.CouncilEventListener;
import io.llmcouncil.core.exception.ConversationNotFoundException;
import io.llmcouncil.core.pricing.CostCalculator;
import io.llmcouncil.core.pricing.CostEstimate;
import io.llmcouncil.core.title.TitleGenerator;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/// Conversation-level entry point: stores turns, names conversations and runs the council.
///
/// ### `sendMessage` sequence
/// 1. Verify the conversation exists and append the user message
/// 2. For the first message, start title generation in the background
/// 3. Resolve roster, chairman and personas for the conversation
/// 4. Run the council over the conversation history
/// 5. Await the title, store it and emit `title_complete`
/// 6. Store the council turn and emit `complete`, or `error` for a terminal failure
///
/// @implNote Thread-safe if the repository is. The title executor is owned by the caller.
public class ConversationService {

    private static final Logger logger = Logger.getLogger(ConversationService.class.getName());

    private final ConversationRepository repository;
    private final CouncilOrchestrator orchestrator;
    private final CouncilConfigResolver configResolver;
    private final TitleGenerator titleGenerator;
    private final CostCalculator costCalculator;
    private final ExecutorService titleExecutor;
    private final Duration titleWait;

    /// @param repository conversation storage, not null
    /// @param orchestrator council pipeline, not null
    /// @param configResolver per-conversation configuration, not null
    /// @param titleGenerator title generator, not null
    /// @param costCalculator price lookups for estimates, not null
    /// @param titleExecutor worker for background title generation, not null
    /// @param titleWait how long to wait for the title after the run, not null
    public ConversationService(
            ConversationRepository repository,
            CouncilOrchestrator orchestrator,
            CouncilConfigResolver configResolver,
            TitleGenerator titleGenerator,
            CostCalculator costCalculator,
            ExecutorService titleExecutor,
            Duration titleWait) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator must not be null");
        this.configResolver =
                Objects.requireNonNull(configResolver, "configResolver must not be null");
        this.titleGenerator =
                Objects.requireNonNull(titleGenerator, "titleGenerator must not be null");
        this.costCalculator =
                Objects.requireNonNull(costCalculator, "costCalculator must not be null");
        this.titleExecutor =
                Objects.requireNonNull(titleExecutor, "titleExecutor must not be null");
        this.titleWait = Objects.requireNonNull(titleWait, "titleWait must not be null");
    }

    /// Creates an empty conversation with a random id.
    ///
    /// @param settings per-conversation overrides, not null
    /// @return the new conversation, never null
    public Conversation createConversation(ConversationSettings settings) {
        Conversation conversation = repository.create(UUID.randomUUID().toString(), settings);
        logger.info("Created conversation " + conversation.id());
        return conversation;
    }

    public List<ConversationSummary> listConversations() {
        return repository.list();
    }

    /// @throws ConversationNotFoundException if the id is unknown
    public Conversation getConversation(String id) {
        return repository.find(id).orElseThrow(() -> new ConversationNotFoundException(id));
    }

    /// @return `true` if the conversation existed
    public boolean deleteConversation(String id) {
        return repository.delete(id);
    }

    /// Sends a user message and runs the council on it.
    ///
    /// @param conversationId target conversation, not null
    /// @param content user message, not blank
    /// @param listener receives progress events, not null
    /// @return the council result that was stored, never null
    /// @throws ConversationNotFoundException if the conversation does not exist
    /// @throws IllegalArgumentException if content is blank
    public CouncilResult sendMessage(
            String conversationId, String content, CouncilEventListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Message content must not be blank");
        }

        Conversation conversation = getConversation(conversationId);
        boolean firstMessage = conversation.messages().isEmpty();
        conversation = repository.appendUserMessage(conversationId, content);

        Future<String> titleTask =
                firstMessage ? titleExecutor.submit(() -> titleGenerator.generate(content)) : null;

        CouncilResult result;
        try {
            RunConfiguration run = configResolver.resolve(conversation, content);
            result = orchestrator.run(conversation.history(), run, listener);
        } catch (RuntimeException e) {
            logger.severe("Council run failed for " + conversationId + ": " + e.getMessage());
            if (titleTask != null) {
                titleTask.cancel(true);
            }
            emit(
                    listener,
                    new CouncilEvent.RunFailed(String.valueOf(e.getMessage()), Instant.now()));
            throw e;
        }

        if (titleTask != null) {
            String title = awaitTitle(titleTask);
            repository.updateTitle(conversationId, title);
            emit(listener, new CouncilEvent.TitleCompleted(title, Instant.now()));
        }

        repository.appendAssistantMessage(conversationId, result);

        if (result.isTerminalError()) {
            emit(
                    listener,
                    new CouncilEvent.RunFailed(result.chairman().answerText(), Instant.now()));
        } else {
            emit(listener, new CouncilEvent.RunCompleted(result.metadata(), Instant.now()));
        }
        return result;
    }

    /// Sends a user message without progress events.
    public CouncilResult sendMessage(String conversationId, String content) {
        return sendMessage(conversationId, content, CouncilEventListener.NONE);
    }

    /// Estimates the cost of sending `content`, before any call is made.
    ///
    /// Every council member plus the chairman is priced for the prompt and a default
    /// response length.
    ///
    /// @param conversationId conversation whose roster applies, may be null for defaults
    /// @param content prompt text, not null
    /// @return estimate, never null
    /// @throws ConversationNotFoundException if a non-null id is unknown
    public CostEstimate estimateCost(String conversationId, String content) {
        Conversation conversation = conversationId != null ? getConversation(conversationId) : null;
        return costCalculator.estimate(configResolver.participants(conversation), content);
    }

    private String awaitTitle(Future<String> titleTask) {
        try {
            return titleTask.get(titleWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            titleTask.cancel(true);
            logger.warning("Title generation timed out, using default title");
        } catch (ExecutionException e) {
            logger.warning("Title generation failed: " + e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            titleTask.cancel(true);
            logger.warning("Interrupted while waiting for title");
        }
        return TitleGenerator.DEFAULT_TITLE;
    }

    private static void emit(CouncilEventListener listener, CouncilEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            logger.warning("Event listener failed on " + event.type() + ": " + e.getMessage());
        }
    }
}
