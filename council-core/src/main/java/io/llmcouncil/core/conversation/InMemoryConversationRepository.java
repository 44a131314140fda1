package io.llmcouncil.core.conversation;

import io.llmcouncil.core.council.CouncilResult;
import io.llmcouncil.core.exception.ConversationNotFoundException;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/// In-memory {@link ConversationRepository} for tests and single-process use.
///
/// @implNote Thread-safe. Updates are atomic per conversation via
/// {@link ConcurrentHashMap#computeIfPresent}.
public class InMemoryConversationRepository implements ConversationRepository {

    private final Map<String, Conversation> conversations = new ConcurrentHashMap<>();

    @Override
    public Conversation create(String id, ConversationSettings settings) {
        Conversation conversation = Conversation.create(id, settings);
        if (conversations.putIfAbsent(id, conversation) != null) {
            throw new IllegalStateException("Conversation already exists: " + id);
        }
        return conversation;
    }

    @Override
    public Optional<Conversation> find(String id) {
        return Optional.ofNullable(conversations.get(id));
    }

    @Override
    public List<ConversationSummary> list() {
        return conversations.values().stream()
                .map(Conversation::summary)
                .sorted(Comparator.comparing(ConversationSummary::createdAt).reversed())
                .toList();
    }

    @Override
    public Conversation appendUserMessage(String id, String content) {
        return update(id, c -> c.withMessage(new ConversationMessage.UserTurn(content, null)));
    }

    @Override
    public Conversation appendAssistantMessage(String id, CouncilResult result) {
        return update(id, c -> c.withMessage(ConversationMessage.CouncilTurn.from(result)));
    }

    @Override
    public Conversation updateTitle(String id, String title) {
        return update(id, c -> c.withTitle(title));
    }

    @Override
    public boolean delete(String id) {
        return conversations.remove(id) != null;
    }

    private Conversation update(String id, UnaryOperator<Conversation> change) {
        Conversation updated = conversations.computeIfPresent(id, (key, c) -> change.apply(c));
        if (updated == null) {
            throw new ConversationNotFoundException(id);
        }
        return updated;
    }
}
