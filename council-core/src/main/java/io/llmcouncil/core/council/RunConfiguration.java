package io.llmcouncil.core.council;

import io.llmcouncil.core.CouncilConfig;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Roster, chairman and personas for a single run.
///
/// Duplicate roster ids are collapsed with the first occurrence kept, so the label map
/// stays a bijection.
///
/// @param councilModels distinct council model ids, in dispatch order
/// @param chairmanModel chairman model id, not null
/// @param personas model id to persona text, never null (may be empty)
public record RunConfiguration(
        List<String> councilModels, String chairmanModel, Map<String, String> personas) {

    public RunConfiguration {
        Objects.requireNonNull(councilModels, "councilModels must not be null");
        Objects.requireNonNull(chairmanModel, "chairmanModel must not be null");
        councilModels = List.copyOf(new ArrayList<>(new LinkedHashSet<>(councilModels)));
        if (councilModels.isEmpty()) {
            throw new IllegalArgumentException("At least one council model is required");
        }
        if (councilModels.size() > CouncilConfig.MAX_COUNCIL_SIZE) {
            throw new IllegalArgumentException(
                    "At most " + CouncilConfig.MAX_COUNCIL_SIZE + " council models are supported");
        }
        personas = personas != null ? Map.copyOf(personas) : Map.of();
    }

    /// Configuration without personas.
    public static RunConfiguration of(List<String> councilModels, String chairmanModel) {
        return new RunConfiguration(councilModels, chairmanModel, Map.of());
    }

    /// Returns the persona for a model, or null.
    public String personaFor(String modelId) {
        return personas.get(modelId);
    }
}
