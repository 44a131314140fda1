package io.llmcouncil.core.conversation;

import io.llmcouncil.core.council.CouncilResult;
import io.llmcouncil.core.exception.ConversationNotFoundException;
import java.util.List;
import java.util.Optional;

/// Storage for conversations.
///
/// Mutating methods throw {@link ConversationNotFoundException} for unknown ids.
///
/// @implNote Implementations must be thread-safe.
public interface ConversationRepository {

    /// Creates and stores an empty conversation.
    ///
    /// @param id conversation id, not null
    /// @param settings per-conversation overrides, not null
    /// @return the stored conversation, never null
    /// @throws IllegalStateException if the id is already taken
    Conversation create(String id, ConversationSettings settings);

    Optional<Conversation> find(String id);

    /// Lists all conversations, newest first.
    List<ConversationSummary> list();

    /// @return the updated conversation, never null
    Conversation appendUserMessage(String id, String content);

    /// Stores the council's response as an assistant turn.
    ///
    /// @return the updated conversation, never null
    Conversation appendAssistantMessage(String id, CouncilResult result);

    /// @return the updated conversation, never null
    Conversation updateTitle(String id, String title);

    /// @return `true` if a conversation was removed
    boolean delete(String id);
}
