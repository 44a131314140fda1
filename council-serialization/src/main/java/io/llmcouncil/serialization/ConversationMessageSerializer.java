package io.llmcouncil.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.llmcouncil.core.conversation.ConversationMessage;
import java.io.IOException;
import java.io.Serial;

/// Serializes the `ConversationMessage` sealed hierarchy with a `"role"` discriminator field.
///
/// Emitted JSON shape per subtype:
/// - **`UserTurn`**: `{"role":"user","content":"...","timestamp":"..."}`
/// - **`CouncilTurn`**: `{"role":"assistant","stage1":[...],"stage2":[...],
///   "stage3":{...},"metadata":{...},"timestamp":"..."}`
///
/// @implNote Package-private. Registered by {@link CouncilJacksonModule}.
/// @see ConversationMessageDeserializer for the inverse operation
class ConversationMessageSerializer extends StdSerializer<ConversationMessage> {

    @Serial private static final long serialVersionUID = 6215038845129935817L;

    ConversationMessageSerializer() {
        super(ConversationMessage.class);
    }

    @Override
    public void serialize(
            ConversationMessage message, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("role", message.role().wireName());

        if (message instanceof ConversationMessage.UserTurn user) {
            gen.writeStringField("content", user.content());
        } else if (message instanceof ConversationMessage.CouncilTurn turn) {
            provider.defaultSerializeField("stage1", turn.stage1(), gen);
            provider.defaultSerializeField("stage2", turn.stage2(), gen);
            provider.defaultSerializeField("stage3", turn.stage3(), gen);
            provider.defaultSerializeField("metadata", turn.metadata(), gen);
        }

        provider.defaultSerializeField("timestamp", message.timestamp(), gen);
        gen.writeEndObject();
    }
}
