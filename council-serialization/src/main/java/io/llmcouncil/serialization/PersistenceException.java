package io.llmcouncil.serialization;

import java.io.Serial;

/// Thrown when conversation storage cannot be read or written.
public class PersistenceException extends RuntimeException {

    @Serial private static final long serialVersionUID = -2870114539672093418L;

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
