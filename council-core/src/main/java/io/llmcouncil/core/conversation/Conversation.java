package io.llmcouncil.core.conversation;

import io.llmcouncil.core.message.Message;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// Stored conversation: metadata, settings and ordered turns.
///
/// Immutable; `with*` methods return updated copies.
///
/// @param id conversation id, not null
/// @param createdAt creation time, not null
/// @param title display title, not null
/// @param messages turns in order, never null
/// @param settings per-conversation overrides, never null
public record Conversation(
        String id,
        Instant createdAt,
        String title,
        List<ConversationMessage> messages,
        ConversationSettings settings) {

    public static final String UNTITLED = "New Conversation";

    public Conversation {
        Objects.requireNonNull(id, "id must not be null");
        createdAt = createdAt != null ? createdAt : Instant.now();
        title = title != null ? title : UNTITLED;
        messages = messages != null ? List.copyOf(messages) : List.of();
        settings = settings != null ? settings : ConversationSettings.defaults();
    }

    /// Creates an empty conversation.
    public static Conversation create(String id, ConversationSettings settings) {
        return new Conversation(id, Instant.now(), UNTITLED, List.of(), settings);
    }

    public Conversation withMessage(ConversationMessage message) {
        List<ConversationMessage> updated = new ArrayList<>(messages);
        updated.add(message);
        return new Conversation(id, createdAt, title, updated, settings);
    }

    public Conversation withTitle(String newTitle) {
        return new Conversation(id, createdAt, newTitle, messages, settings);
    }

    public ConversationSummary summary() {
        return new ConversationSummary(id, createdAt, title, messages.size());
    }

    /// Builds the model-facing history: user messages as-is, council turns as the
    /// chairman's answer.
    ///
    /// @return message history in order, never null
    public List<Message> history() {
        List<Message> history = new ArrayList<>(messages.size());
        for (ConversationMessage message : messages) {
            if (message instanceof ConversationMessage.UserTurn user) {
                history.add(Message.user(user.content()));
            } else if (message instanceof ConversationMessage.CouncilTurn turn) {
                history.add(Message.assistant(turn.stage3().answerText()));
            }
        }
        return history;
    }
}
