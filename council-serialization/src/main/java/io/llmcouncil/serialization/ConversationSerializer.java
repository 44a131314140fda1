package io.llmcouncil.serialization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.llmcouncil.core.conversation.Conversation;

/// Serializes conversations to and from JSON.
///
/// The stored shape uses snake_case field names:
/// {@snippet :
/// String json = ConversationSerializer.toJson(conversation);
/// Conversation restored = ConversationSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. A new mapper is created per call; cache
/// {@link #createMapper()} for repeated use.
///
/// @see CouncilJacksonModule for the registered type handlers
public final class ConversationSerializer {

    private ConversationSerializer() {}

    /// Serializes a conversation to pretty-printed JSON.
    ///
    /// @param conversation the conversation to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Conversation conversation) {
        try {
            return createMapper().writeValueAsString(conversation);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize conversation: " + e.getMessage(), e);
        }
    }

    /// Deserializes a conversation from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized conversation, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static Conversation fromJson(String json) {
        try {
            return createMapper().readValue(json, Conversation.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize conversation: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for council types.
    ///
    /// Registers:
    /// - `CouncilJacksonModule` for the conversation message hierarchy and council mode
    /// - `JavaTimeModule` for `Instant` fields, written as ISO-8601 strings
    /// - snake_case property naming, null fields omitted
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new CouncilJacksonModule())
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
