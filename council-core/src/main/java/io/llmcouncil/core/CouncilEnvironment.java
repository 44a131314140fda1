package io.llmcouncil.core;

import io.llmcouncil.core.conversation.ConversationRepository;
import io.llmcouncil.core.conversation.ConversationService;
import io.llmcouncil.core.council.CouncilOrchestrator;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.pricing.CostCalculator;
import java.util.concurrent.ExecutorService;
import java.util.logging.Logger;

/// Container holding the wired council components.
///
/// Implements {@link AutoCloseable} to release the worker pools and, when it owns one,
/// the gateway's resources.
///
/// ### Contracts
/// - **Postcondition**: getters return the instances passed to the constructor
/// - **Invariant**: component references never change after construction
///
/// @apiNote Create instances via {@link CouncilFactory} rather than direct construction.
public final class CouncilEnvironment implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(CouncilEnvironment.class.getName());

    private final CouncilConfig config;
    private final ModelGateway gateway;
    private final CouncilOrchestrator orchestrator;
    private final ConversationService conversationService;
    private final ConversationRepository conversationRepository;
    private final CostCalculator costCalculator;
    private final ExecutorService stageExecutor;
    private final ExecutorService titleExecutor;

    public CouncilEnvironment(
            CouncilConfig config,
            ModelGateway gateway,
            CouncilOrchestrator orchestrator,
            ConversationService conversationService,
            ConversationRepository conversationRepository,
            CostCalculator costCalculator,
            ExecutorService stageExecutor,
            ExecutorService titleExecutor) {
        this.config = config;
        this.gateway = gateway;
        this.orchestrator = orchestrator;
        this.conversationService = conversationService;
        this.conversationRepository = conversationRepository;
        this.costCalculator = costCalculator;
        this.stageExecutor = stageExecutor;
        this.titleExecutor = titleExecutor;
    }

    public CouncilConfig getConfig() {
        return config;
    }

    public ModelGateway getGateway() {
        return gateway;
    }

    /// Returns the pipeline, for callers that manage history themselves.
    public CouncilOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ConversationService getConversationService() {
        return conversationService;
    }

    public ConversationRepository getConversationRepository() {
        return conversationRepository;
    }

    public CostCalculator getCostCalculator() {
        return costCalculator;
    }

    /// Shuts down the worker pools and closes the gateway if it is closeable.
    ///
    /// @implNote Does not wait for running tasks to finish.
    @Override
    public void close() {
        stageExecutor.shutdown();
        titleExecutor.shutdown();
        if (gateway instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                logger.warning("Failed to close model gateway: " + e.getMessage());
            }
        }
    }
}
