package io.llmcouncil.core.event;

/// Receives {@link CouncilEvent}s as a run progresses.
///
/// Events are delivered in order from the thread driving the run.
///
/// @implNote Implementations must be thread-safe and should return quickly.
@FunctionalInterface
public interface CouncilEventListener {

    CouncilEventListener NONE = event -> {};

    /// @param event the event, never null
    void onEvent(CouncilEvent event);
}
