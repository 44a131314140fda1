package io.llmcouncil.core.persona;

import java.util.Locale;

/// How personas are assigned to council members.
public enum CouncilMode {
    /// No personas; every model answers as itself.
    STANDARD,
    /// The chairman assigns each model a specialist role for the question.
    SPECIALIST;

    /// Lower-case name used in stored conversations.
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a stored mode name; null, blank and unknown names map to {@link #STANDARD}.
    public static CouncilMode fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return STANDARD;
        }
        for (CouncilMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        return STANDARD;
    }
}
