package io.llmcouncil.core.persona;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.usage.TokenUsage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ModelPersonaResolverTest {

    private static final List<String> ROSTER = List.of("openai/gpt-5.2", "x-ai/grok-4");
    private static final String CHAIRMAN = "google/gemini-3-pro-preview";

    @Mock private ModelGateway gateway;
    @Mock private PersonaResponseParser parser;

    private ModelPersonaResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new ModelPersonaResolver(gateway, parser);
    }

    @Test
    void shouldNotCallChairmanInStandardMode() {
        assertThat(resolver.resolve(CouncilMode.STANDARD, "q", ROSTER, CHAIRMAN)).isEmpty();

        verifyNoInteractions(gateway, parser);
    }

    @Test
    void shouldKeepOnlyRosterModelsWithPersonas() throws PersonaParseException {
        // GIVEN
        when(gateway.call(eq(CHAIRMAN), anyList()))
                .thenReturn(
                        new GatewayResult.Success(CHAIRMAN, "{...}", "", false, TokenUsage.ZERO));
        when(parser.parse("{...}"))
                .thenReturn(
                        Map.of(
                                "openai/gpt-5.2", "  You are a DBA.  ",
                                "x-ai/grok-4", " ",
                                "someone/else", "You are an intruder."));

        // WHEN
        Map<String, String> personas =
                resolver.resolve(CouncilMode.SPECIALIST, "How to index?", ROSTER, CHAIRMAN);

        // THEN
        assertThat(personas).containsExactly(Map.entry("openai/gpt-5.2", "You are a DBA."));
    }

    @Test
    void shouldReturnEmptyMappingWhenReplyIsUnparseable() throws PersonaParseException {
        when(gateway.call(eq(CHAIRMAN), anyList()))
                .thenReturn(
                        new GatewayResult.Success(
                                CHAIRMAN, "not json", "", false, TokenUsage.ZERO));
        when(parser.parse("not json")).thenThrow(new PersonaParseException("bad json"));

        assertThat(resolver.resolve(CouncilMode.SPECIALIST, "q", ROSTER, CHAIRMAN)).isEmpty();
    }

    @Test
    void shouldReturnEmptyMappingWhenChairmanFails() {
        when(gateway.call(eq(CHAIRMAN), anyList()))
                .thenReturn(GatewayResult.Failure.of(CHAIRMAN, "HTTP 500", false));

        assertThat(resolver.resolve(CouncilMode.SPECIALIST, "q", ROSTER, CHAIRMAN)).isEmpty();
        verifyNoInteractions(parser);
    }

    @Test
    void shouldListRosterInPrompt() {
        String prompt = ModelPersonaResolver.buildPrompt("Why?", ROSTER);

        assertThat(prompt)
                .contains("Question: Why?")
                .contains("- openai/gpt-5.2\n")
                .contains("- x-ai/grok-4\n")
                .contains("JSON object");
    }

    @Test
    void shouldParseModeNamesLeniently() {
        assertThat(CouncilMode.fromWireName("Specialist")).isEqualTo(CouncilMode.SPECIALIST);
        assertThat(CouncilMode.fromWireName("bogus")).isEqualTo(CouncilMode.STANDARD);
        assertThat(CouncilMode.fromWireName(null)).isEqualTo(CouncilMode.STANDARD);
    }
}
