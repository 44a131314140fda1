package io.llmcouncil.core.conversation;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.council.RunConfiguration;
import io.llmcouncil.core.persona.PersonaResolver;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Resolves the roster, chairman and personas for a conversation's next run.
///
/// ### Precedence
/// 1. Conversation overrides for roster and chairman, else the configured defaults
/// 2. Explicit conversation personas, restricted to the roster
/// 3. Otherwise personas from the {@link PersonaResolver} for the conversation's mode
public class CouncilConfigResolver {

    private final CouncilConfig defaults;
    private final PersonaResolver personaResolver;

    /// @param defaults configured defaults, not null
    /// @param personaResolver resolver used when no explicit personas are set, not null
    public CouncilConfigResolver(CouncilConfig defaults, PersonaResolver personaResolver) {
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.personaResolver =
                Objects.requireNonNull(personaResolver, "personaResolver must not be null");
    }

    /// @param conversation the conversation, not null
    /// @param query the user message about to be answered, not null
    /// @return run configuration, never null
    public RunConfiguration resolve(Conversation conversation, String query) {
        ConversationSettings settings = conversation.settings();
        List<String> models = roster(settings);
        String chairman = chairman(settings);

        Map<String, String> personas;
        if (!settings.personas().isEmpty()) {
            personas = new LinkedHashMap<>();
            for (String model : models) {
                String persona = settings.personas().get(model);
                if (persona != null) {
                    personas.put(model, persona);
                }
            }
        } else {
            personas = personaResolver.resolve(settings.mode(), query, models, chairman);
        }
        return new RunConfiguration(models, chairman, personas);
    }

    /// Roster and chairman for a conversation without resolving personas.
    ///
    /// @param conversation the conversation, may be null for the defaults
    /// @return distinct model ids that a run would call, roster first then chairman
    public List<String> participants(Conversation conversation) {
        ConversationSettings settings =
                conversation != null ? conversation.settings() : ConversationSettings.defaults();
        LinkedHashSet<String> all = new LinkedHashSet<>(roster(settings));
        all.add(chairman(settings));
        return List.copyOf(all);
    }

    private List<String> roster(ConversationSettings settings) {
        return settings.councilModels() != null && !settings.councilModels().isEmpty()
                ? settings.councilModels()
                : defaults.getCouncilModels();
    }

    private String chairman(ConversationSettings settings) {
        return settings.chairmanModel() != null
                ? settings.chairmanModel()
                : defaults.getChairmanModel();
    }
}
