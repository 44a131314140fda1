package io.llmcouncil.serialization.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.llmcouncil.core.conversation.Conversation;
import io.llmcouncil.serialization.ConversationSerializer;
import io.llmcouncil.serialization.PersistenceException;

/// Renders a conversation in its stored JSON shape, pretty-printed or compact.
public class JsonConversationExporter implements ConversationExporter {

    private final ObjectMapper mapper;

    public JsonConversationExporter(boolean pretty) {
        ObjectMapper base = ConversationSerializer.createMapper();
        this.mapper = pretty ? base : base.disable(SerializationFeature.INDENT_OUTPUT);
    }

    public JsonConversationExporter() {
        this(true);
    }

    @Override
    public String export(Conversation conversation) {
        try {
            return mapper.writeValueAsString(conversation);
        } catch (JsonProcessingException e) {
            throw new PersistenceException(
                    "Failed to export conversation " + conversation.id(), e);
        }
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    @Override
    public String contentType() {
        return "application/json";
    }
}
