package io.llmcouncil.core.persona;

import java.util.List;
import java.util.Map;

/// Derives the persona of each council member for a question.
///
/// ### Contracts
/// - **Postcondition**: returns an empty map for {@link CouncilMode#STANDARD}
/// - **Postcondition**: keys are always a subset of `councilModels`
/// - **Invariant**: never throws for model or parse failures; those yield an empty map
public interface PersonaResolver {

    /// @param mode council mode, not null
    /// @param query the user question, not null
    /// @param councilModels council roster, not null
    /// @param chairmanModel chairman model id, not null
    /// @return model id to persona text, never null
    Map<String, String> resolve(
            CouncilMode mode, String query, List<String> councilModels, String chairmanModel);
}
