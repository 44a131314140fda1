package io.llmcouncil.core.gateway.stub;

import io.llmcouncil.core.gateway.ModelClient;
import io.llmcouncil.core.gateway.ModelClientConfig;
import io.llmcouncil.core.gateway.ModelReply;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.message.Role;
import io.llmcouncil.core.pricing.CostCalculator;
import io.llmcouncil.core.usage.TokenUsage;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// Testing client that returns mock replies without calling external APIs.
///
/// ### Reply Resolution Order
/// 1. Response configured in {@link StubResponseRegistry} for the model id
/// 2. Generated reply shaped after the prompt:
///    - peer ranking prompts get an evaluation ending in a well-formed `FINAL RANKING:` list
///    - ranking extraction prompts get the comma-separated label list
///    - title prompts get a fixed short title
///    - JSON persona prompts get one persona per listed model
///    - anything else gets a generic stub answer
///
/// Token usage is estimated from text length so cost accounting has non-zero input.
///
/// @implNote Thread-safe. Stateless apart from the shared registry.
///
/// @see StubModelProvider for enabling stub mode
public class StubModelClient implements ModelClient {

    private static final Logger logger = Logger.getLogger(StubModelClient.class.getName());

    private static final Pattern LABEL_HEADER =
            Pattern.compile("^(Response [A-Z]):\\s*$", Pattern.MULTILINE);
    private static final Pattern EXTRACTION_LABELS =
            Pattern.compile("Use the exact labels provided: (.+)$", Pattern.MULTILINE);
    private static final Pattern LISTED_MODEL =
            Pattern.compile("^- (\\S+)\\s*$", Pattern.MULTILINE);

    static final String STUB_TITLE = "Stub Council Conversation";

    private final ModelClientConfig config;
    private final StubResponseRegistry responseRegistry;

    public StubModelClient(ModelClientConfig config) {
        this.config = config;
        this.responseRegistry = StubResponseRegistry.getInstance();
    }

    @Override
    public ModelClientConfig getConfig() {
        return config;
    }

    @Override
    public ModelReply chat(List<Message> messages) {
        String modelId = config.getModelId();
        String prompt = messages.stream().map(Message::content).collect(Collectors.joining("\n"));
        logger.info(
                "[STUB] Model '" + modelId + "' received prompt (" + prompt.length() + " chars)");

        String response = responseRegistry.getResponse(modelId);
        if (response == null) {
            response = generateMockResponse(lastUserContent(messages));
        }

        long promptTokens = CostCalculator.estimateTokens(prompt);
        long completionTokens = CostCalculator.estimateTokens(response);
        TokenUsage usage =
                new TokenUsage(promptTokens, completionTokens, promptTokens + completionTokens);

        return ModelReply.Text.of(response, usage, Map.of("stub", true, "model", modelId));
    }

    private String generateMockResponse(String prompt) {
        if (prompt.contains("FINAL RANKING:")) {
            List<String> labels = find(LABEL_HEADER, prompt);
            if (!labels.isEmpty()) {
                return generateRanking(labels);
            }
        }

        Matcher extraction = EXTRACTION_LABELS.matcher(prompt);
        if (extraction.find()) {
            return extraction.group(1).trim();
        }

        if (prompt.startsWith("Generate a very short title")) {
            return STUB_TITLE;
        }

        if (prompt.toLowerCase(Locale.ROOT).contains("json object")) {
            return generatePersonaJson(find(LISTED_MODEL, prompt));
        }

        return String.format(
                """
                [STUB RESPONSE from %s]

                This is a stub response for testing purposes.

                The actual prompt was:
                %s""",
                config.getModelId(),
                prompt.length() > 500 ? prompt.substring(0, 500) + "..." : prompt);
    }

    private String generateRanking(List<String> labels) {
        StringBuilder text = new StringBuilder();
        for (String label : labels) {
            text.append(label).append(" is a stub answer evaluated by ")
                    .append(config.getModelId())
                    .append(".\n");
        }
        text.append("\nFINAL RANKING:\n");
        for (int i = 0; i < labels.size(); i++) {
            text.append(i + 1).append(". ").append(labels.get(i)).append('\n');
        }
        return text.toString();
    }

    private String generatePersonaJson(List<String> modelIds) {
        return modelIds.stream()
                .map(id -> "  \"" + id + "\": \"You are a stub specialist for " + id + ".\"")
                .collect(Collectors.joining(",\n", "{\n", "\n}"));
    }

    private static List<String> find(Pattern pattern, String text) {
        Set<String> found = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group(1));
        }
        return new ArrayList<>(found);
    }

    private static String lastUserContent(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message message = messages.get(i);
            if (message.role() == Role.USER) {
                return message.content();
            }
        }
        return "";
    }
}
