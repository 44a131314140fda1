package io.llmcouncil.core.persona;

import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.message.Message;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link PersonaResolver} that asks the chairman model to cast the council.
///
/// In {@link CouncilMode#SPECIALIST} mode the chairman receives the question and the
/// roster and replies with a JSON object of personas. Entries for models outside the
/// roster and blank personas are dropped. A failed call or unparseable reply yields an
/// empty mapping so the run proceeds in standard mode.
public class ModelPersonaResolver implements PersonaResolver {

    private static final Logger logger = Logger.getLogger(ModelPersonaResolver.class.getName());

    private final ModelGateway gateway;
    private final PersonaResponseParser parser;

    /// @param gateway gateway used to reach the chairman, not null
    /// @param parser reply parser, not null
    public ModelPersonaResolver(ModelGateway gateway, PersonaResponseParser parser) {
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public Map<String, String> resolve(
            CouncilMode mode, String query, List<String> councilModels, String chairmanModel) {
        if (mode != CouncilMode.SPECIALIST) {
            return Map.of();
        }

        String prompt = buildPrompt(query, councilModels);
        GatewayResult result = gateway.call(chairmanModel, List.of(Message.user(prompt)));
        if (!(result instanceof GatewayResult.Success success)) {
            logger.warning("Persona assignment by " + chairmanModel + " failed, using no personas");
            return Map.of();
        }

        Map<String, String> parsed;
        try {
            parsed = parser.parse(success.answerText());
        } catch (PersonaParseException e) {
            logger.warning("Persona assignment reply unparseable: " + e.getMessage());
            return Map.of();
        }

        Map<String, String> personas = new LinkedHashMap<>();
        for (String model : councilModels) {
            String persona = parsed.get(model);
            if (persona != null && !persona.isBlank()) {
                personas.put(model, persona.trim());
            }
        }
        logger.info("Assigned personas to " + personas.size() + " of " + councilModels.size());
        return personas;
    }

    static String buildPrompt(String query, List<String> councilModels) {
        StringBuilder roster = new StringBuilder();
        for (String model : councilModels) {
            roster.append("- ").append(model).append('\n');
        }
        return """
                You are assembling a council of AI experts to answer the question below. \
                Assign each council member a distinct specialist role that brings a useful \
                perspective to the question.

                Question: %s

                Council members:
                %s
                For each member write a short system prompt in the second person \
                ("You are ...") describing its role and how it should approach the question.

                Respond ONLY with a JSON object that maps each member id exactly as listed to \
                its system prompt, for example:
                {"provider/model-a": "You are a security engineer...", \
                "provider/model-b": "You are a product manager..."}"""
                .formatted(query, roster);
    }
}
