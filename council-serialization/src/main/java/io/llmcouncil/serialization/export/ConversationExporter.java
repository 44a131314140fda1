package io.llmcouncil.serialization.export;

import io.llmcouncil.core.conversation.Conversation;

/// Renders a stored conversation into a downloadable document.
public interface ConversationExporter {

    /// @param conversation the conversation to render, not null
    /// @return rendered document, never null
    String export(Conversation conversation);

    /// File extension without the dot, e.g. `"md"`.
    String fileExtension();

    /// MIME type of the rendered document.
    String contentType();
}
