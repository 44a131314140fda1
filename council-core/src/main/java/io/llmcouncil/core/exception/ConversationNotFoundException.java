package io.llmcouncil.core.exception;

import java.io.Serial;

/// Thrown when a conversation id does not resolve to a stored conversation.
public class ConversationNotFoundException extends RuntimeException {

    @Serial private static final long serialVersionUID = -4405834109771269302L;

    private final String conversationId;

    public ConversationNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
        this.conversationId = conversationId;
    }

    public String getConversationId() {
        return conversationId;
    }
}
