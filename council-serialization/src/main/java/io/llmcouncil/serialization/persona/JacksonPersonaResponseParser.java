package io.llmcouncil.serialization.persona;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.llmcouncil.core.persona.PersonaParseException;
import io.llmcouncil.core.persona.PersonaResponseParser;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Jackson-based implementation of {@link PersonaResponseParser}.
///
/// Accepts a JSON object of model id to persona text, optionally wrapped in markdown code
/// fences or surrounded by prose:
/// ```json
/// {"openai/gpt-5.2": "You are a senior database engineer..."}
/// ```
///
/// Non-string values are skipped.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
/// @see io.llmcouncil.core.persona.ModelPersonaResolver for the primary caller
public class JacksonPersonaResponseParser implements PersonaResponseParser {

    private final ObjectMapper objectMapper;

    public JacksonPersonaResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    public JacksonPersonaResponseParser() {
        this(new ObjectMapper());
    }

    @Override
    public Map<String, String> parse(String content) throws PersonaParseException {
        Objects.requireNonNull(content, "content must not be null");
        String json = extractJson(content);

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PersonaParseException("Failed to parse persona JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PersonaParseException("Persona reply is not a JSON object");
        }

        Map<String, String> personas = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                personas.put(field.getKey(), field.getValue().asText());
            }
        }
        return personas;
    }

    /// Extracts the JSON object from a model reply, stripping markdown fences.
    ///
    /// @param content raw reply, not null
    /// @return cleaned JSON string ready for parsing
    private String extractJson(String content) {
        int start = content.indexOf("```json");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        start = content.indexOf("```");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        int objectStart = content.indexOf('{');
        int objectEnd = content.lastIndexOf('}');
        if (objectStart >= 0 && objectEnd > objectStart) {
            return content.substring(objectStart, objectEnd + 1);
        }

        return content.trim();
    }
}
