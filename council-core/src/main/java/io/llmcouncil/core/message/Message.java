package io.llmcouncil.core.message;

import java.util.Objects;

/// One entry of a conversation history sent to a model.
///
/// Messages are immutable once appended; a history is an ordered `List<Message>`.
///
/// @param role who authored the message, not null
/// @param content message text, not null (may be empty)
public record Message(Role role, String content) {

    public Message {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static Message user(String content) {
        return new Message(Role.USER, content);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content);
    }

    public static Message system(String content) {
        return new Message(Role.SYSTEM, content);
    }
}
