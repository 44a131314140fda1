package io.llmcouncil.core.gateway;

import io.llmcouncil.core.message.Message;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/// Boundary through which every council stage talks to backend models.
///
/// ### Contracts
/// - **Postcondition**: `call()` returns a non-null {@link GatewayResult}
/// - **Invariant**: `call()` never throws; every failure becomes a {@link GatewayResult.Failure}
///
/// @implNote Implementations must be thread-safe; stages call the gateway from
/// parallel tasks.
public interface ModelGateway {

    /// Sends messages to one model.
    ///
    /// @param modelId target model, not null
    /// @param messages ordered conversation, not null
    /// @param timeout per-call timeout, or null for the model's default timeout
    /// @return normalized result, never null
    GatewayResult call(String modelId, List<Message> messages, Duration timeout);

    /// Sends messages to one model using its default timeout.
    default GatewayResult call(String modelId, List<Message> messages) {
        return call(modelId, messages, null);
    }

    /// Sends messages to one model, prefixed with a persona system message when present.
    ///
    /// @param persona system prompt for the model, may be null
    default GatewayResult call(
            String modelId, List<Message> messages, String persona, Duration timeout) {
        return call(modelId, withPersona(messages, persona), timeout);
    }

    /// Returns a copy of `messages` with a leading system message holding `persona`.
    ///
    /// @param messages original history, not modified
    /// @param persona persona text; when null or blank the copy is returned unchanged
    /// @return new list, never null
    static List<Message> withPersona(List<Message> messages, String persona) {
        List<Message> copy = new ArrayList<>(messages.size() + 1);
        if (persona != null && !persona.isBlank()) {
            copy.add(Message.system(persona));
        }
        copy.addAll(messages);
        return copy;
    }
}
