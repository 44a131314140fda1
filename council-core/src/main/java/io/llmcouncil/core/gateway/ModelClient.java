package io.llmcouncil.core.gateway;

import io.llmcouncil.core.message.Message;
import java.util.List;

/// A connection to one backend model.
///
/// ### Contracts
/// - **Postcondition**: `chat()` returns a non-null {@link ModelReply} and never throws
/// - **Invariant**: model id and configuration remain constant after construction
///
/// @implNote Implementations must be thread-safe. The same client serves every stage
/// of a run and may be called concurrently by parallel runs.
///
/// @see ModelGateway for the boundary the council stages talk to
/// @see io.llmcouncil.core.gateway.spi.ModelProvider for implementing backends
public interface ModelClient {

    /// Sends the message sequence to the model.
    ///
    /// @param messages ordered role/content messages, not null and not empty
    /// @return the model's text or an error reply, never null
    ModelReply chat(List<Message> messages);

    /// Returns the configuration this client was created from.
    ///
    /// @return immutable configuration, never null
    ModelClientConfig getConfig();
}
