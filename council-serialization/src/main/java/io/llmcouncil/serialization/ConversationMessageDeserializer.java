package io.llmcouncil.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.llmcouncil.core.conversation.ConversationMessage;
import io.llmcouncil.core.council.ChairmanResult;
import io.llmcouncil.core.council.ModelAnswer;
import io.llmcouncil.core.council.RankingVerdict;
import io.llmcouncil.core.council.RunMetadata;
import java.io.IOException;
import java.io.Serial;
import java.time.Instant;
import java.util.List;

/// Deserializes the `ConversationMessage` sealed hierarchy using a `"role"` discriminator.
///
/// Missing stage arrays read as empty lists and a missing timestamp as "now", so turns
/// written by older versions still load. A council turn without `stage3` is rejected.
///
/// @implNote Package-private. Registered by {@link CouncilJacksonModule}.
/// @see ConversationMessageSerializer for the inverse operation
class ConversationMessageDeserializer extends StdDeserializer<ConversationMessage> {

    @Serial private static final long serialVersionUID = -1940254388410628873L;

    ConversationMessageDeserializer() {
        super(ConversationMessage.class);
    }

    @Override
    public ConversationMessage deserialize(JsonParser p, DeserializationContext ctx)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        JsonNode roleNode = root.get("role");
        if (roleNode == null) {
            throw new IOException("Conversation message is missing 'role'");
        }
        Instant timestamp =
                root.hasNonNull("timestamp")
                        ? mapper.convertValue(root.get("timestamp"), Instant.class)
                        : null;

        String role = roleNode.asText();
        return switch (role) {
            case "user" -> {
                JsonNode content = root.get("content");
                yield new ConversationMessage.UserTurn(
                        content != null ? content.asText() : "", timestamp);
            }
            case "assistant" -> {
                if (!root.hasNonNull("stage3")) {
                    throw new IOException("Council turn is missing 'stage3'");
                }
                List<ModelAnswer> stage1 =
                        root.has("stage1")
                                ? mapper.convertValue(
                                        root.get("stage1"),
                                        new TypeReference<List<ModelAnswer>>() {})
                                : List.of();
                List<RankingVerdict> stage2 =
                        root.has("stage2")
                                ? mapper.convertValue(
                                        root.get("stage2"),
                                        new TypeReference<List<RankingVerdict>>() {})
                                : List.of();
                ChairmanResult stage3 =
                        mapper.convertValue(root.get("stage3"), ChairmanResult.class);
                RunMetadata metadata =
                        root.hasNonNull("metadata")
                                ? mapper.convertValue(root.get("metadata"), RunMetadata.class)
                                : null;
                yield new ConversationMessage.CouncilTurn(
                        stage1, stage2, stage3, metadata, timestamp);
            }
            default -> throw new IOException("Unknown conversation message role: " + role);
        };
    }
}
