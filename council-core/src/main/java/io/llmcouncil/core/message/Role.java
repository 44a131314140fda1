package io.llmcouncil.core.message;

import java.util.Locale;

/// Author of a {@link Message} in a conversation history.
public enum Role {
    USER,
    ASSISTANT,
    SYSTEM;

    /// Returns the lower-case name used by chat-completion APIs.
    ///
    /// @return `"user"`, `"assistant"` or `"system"`, never null
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Resolves a role from its wire name, ignoring case.
    ///
    /// @param wireName role name such as `"user"`, not null
    /// @return matching role, never null
    /// @throws IllegalArgumentException if the name is not a known role
    public static Role fromWireName(String wireName) {
        return Role.valueOf(wireName.trim().toUpperCase(Locale.ROOT));
    }
}
