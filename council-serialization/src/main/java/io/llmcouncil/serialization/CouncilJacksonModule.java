package io.llmcouncil.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.llmcouncil.core.conversation.ConversationMessage;
import io.llmcouncil.core.persona.CouncilMode;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the council serialization configuration.
///
/// - `ConversationMessage`: `ConversationMessageSerializer` / `ConversationMessageDeserializer`,
///   discriminator: `"role"` (`"user"` or `"assistant"`)
/// - `CouncilMode`: written as its lower-case wire name, unknown names read as standard
///
/// Records (answers, verdicts, chairman result, run metadata, token usage) bind through
/// their canonical constructors and need no registration.
///
/// @see ConversationSerializer for the convenience factory API
public class CouncilJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3184209473615830552L;

    public CouncilJacksonModule() {
        super("CouncilJacksonModule");

        addSerializer(ConversationMessage.class, new ConversationMessageSerializer());
        addDeserializer(ConversationMessage.class, new ConversationMessageDeserializer());

        addSerializer(CouncilMode.class, new CouncilModeCodec.Serializer());
        addDeserializer(CouncilMode.class, new CouncilModeCodec.Deserializer());
    }
}
