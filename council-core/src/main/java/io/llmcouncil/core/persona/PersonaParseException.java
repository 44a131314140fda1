package io.llmcouncil.core.persona;

import java.io.Serial;

/// Thrown when a persona assignment reply cannot be parsed.
///
/// @see PersonaResponseParser#parse
public class PersonaParseException extends Exception {

    @Serial private static final long serialVersionUID = 4127905348816275031L;

    public PersonaParseException(String message) {
        super(message);
    }

    public PersonaParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
