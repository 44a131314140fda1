package io.llmcouncil.core.persona;

import java.util.Map;

/// Parses a model's persona assignment reply into a model id to persona mapping.
///
/// Keeps JSON handling out of {@code council-core}. The Jackson-based implementation
/// lives in {@code council-serialization} as {@code JacksonPersonaResponseParser}.
///
/// Expected reply shape, optionally wrapped in a ` ```json ` fence:
/// ```json
/// {"openai/gpt-5.2": "You are a pragmatic systems engineer...", "x-ai/grok-4": "..."}
/// ```
public interface PersonaResponseParser {

    /// @param content raw model reply, not null
    /// @return model id to persona text, never null
    /// @throws PersonaParseException if the content is not a JSON object of strings
    Map<String, String> parse(String content) throws PersonaParseException;
}
