package io.llmcouncil.core.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.council.RunConfiguration;
import io.llmcouncil.core.persona.CouncilMode;
import io.llmcouncil.core.persona.PersonaResolver;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CouncilConfigResolverTest {

    private static final CouncilConfig DEFAULTS =
            CouncilConfig.builder()
                    .councilModels(List.of("a/one", "b/two"))
                    .chairmanModel("c/chair")
                    .build();

    @Mock private PersonaResolver personaResolver;

    private CouncilConfigResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new CouncilConfigResolver(DEFAULTS, personaResolver);
    }

    @Test
    void shouldUseConfiguredDefaultsWithoutOverrides() {
        // GIVEN
        Conversation conversation = Conversation.create("c1", ConversationSettings.defaults());
        when(personaResolver.resolve(any(), anyString(), anyList(), anyString()))
                .thenReturn(Map.of());

        // WHEN
        RunConfiguration run = resolver.resolve(conversation, "q");

        // THEN
        assertThat(run.councilModels()).containsExactly("a/one", "b/two");
        assertThat(run.chairmanModel()).isEqualTo("c/chair");
        verify(personaResolver)
                .resolve(CouncilMode.STANDARD, "q", List.of("a/one", "b/two"), "c/chair");
    }

    @Test
    void shouldPreferConversationOverrides() {
        // GIVEN
        ConversationSettings settings =
                new ConversationSettings(
                        List.of("x/one"), "x/chair", Map.of(), CouncilMode.SPECIALIST);
        when(personaResolver.resolve(
                        eq(CouncilMode.SPECIALIST), eq("q"), eq(List.of("x/one")), eq("x/chair")))
                .thenReturn(Map.of("x/one", "You are a chemist."));

        // WHEN
        RunConfiguration run = resolver.resolve(Conversation.create("c1", settings), "q");

        // THEN
        assertThat(run.councilModels()).containsExactly("x/one");
        assertThat(run.chairmanModel()).isEqualTo("x/chair");
        assertThat(run.personaFor("x/one")).isEqualTo("You are a chemist.");
    }

    @Test
    void shouldUseExplicitPersonasRestrictedToRoster() {
        // GIVEN
        ConversationSettings settings =
                new ConversationSettings(
                        null,
                        null,
                        Map.of("a/one", "You are a poet.", "z/other", "Ignored."),
                        CouncilMode.SPECIALIST);

        // WHEN
        RunConfiguration run = resolver.resolve(Conversation.create("c1", settings), "q");

        // THEN
        assertThat(run.personas()).containsExactly(Map.entry("a/one", "You are a poet."));
        verifyNoInteractions(personaResolver);
    }

    @Test
    void shouldListRosterThenChairmanAsParticipants() {
        ConversationSettings settings =
                new ConversationSettings(
                        List.of("a/one", "c/chair"), null, Map.of(), CouncilMode.STANDARD);

        assertThat(resolver.participants(null)).containsExactly("a/one", "b/two", "c/chair");
        assertThat(resolver.participants(Conversation.create("c1", settings)))
                .containsExactly("a/one", "c/chair");
    }
}
