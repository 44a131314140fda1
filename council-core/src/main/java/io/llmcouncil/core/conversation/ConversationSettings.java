package io.llmcouncil.core.conversation;

import io.llmcouncil.core.persona.CouncilMode;
import java.util.List;
import java.util.Map;

/// Per-conversation overrides of the council configuration.
///
/// Null roster or chairman means "use the configured default". Explicit personas bypass
/// persona resolution for the conversation.
///
/// @param councilModels roster override, may be null
/// @param chairmanModel chairman override, may be null
/// @param personas explicit personas, never null (may be empty)
/// @param mode council mode, never null
public record ConversationSettings(
        List<String> councilModels,
        String chairmanModel,
        Map<String, String> personas,
        CouncilMode mode) {

    public ConversationSettings {
        councilModels = councilModels != null ? List.copyOf(councilModels) : null;
        chairmanModel = chairmanModel != null && !chairmanModel.isBlank() ? chairmanModel : null;
        personas = personas != null ? Map.copyOf(personas) : Map.of();
        mode = mode != null ? mode : CouncilMode.STANDARD;
    }

    /// Settings with no overrides in standard mode.
    public static ConversationSettings defaults() {
        return new ConversationSettings(null, null, Map.of(), CouncilMode.STANDARD);
    }
}
