package io.llmcouncil.core.council;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.pricing.CostCalculator;
import io.llmcouncil.core.reasoning.ReasoningModels;
import io.llmcouncil.core.usage.TokenUsage;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Stage 1: every council model answers the conversation independently.
///
/// Each model gets its own copy of the history, prefixed with its persona when one is
/// configured. Failed calls are kept as answers with `error` set; models for which the
/// gateway produced no response at all are dropped. Output follows roster order.
public class IndependentGenerationStage {

    private static final Logger logger =
            Logger.getLogger(IndependentGenerationStage.class.getName());

    private final ModelGateway gateway;
    private final StageDispatcher dispatcher;
    private final CostCalculator costCalculator;
    private final CouncilConfig config;

    public IndependentGenerationStage(
            ModelGateway gateway,
            StageDispatcher dispatcher,
            CostCalculator costCalculator,
            CouncilConfig config) {
        this.gateway = gateway;
        this.dispatcher = dispatcher;
        this.costCalculator = costCalculator;
        this.config = config;
    }

    /// @param history full conversation history, not null
    /// @param run roster and personas, not null
    /// @return answers in roster order, never null
    public List<ModelAnswer> run(List<Message> history, RunConfiguration run) {
        List<String> models = run.councilModels();
        logger.info("Stage 1: collecting answers from " + models.size() + " models");

        List<ModelAnswer> answers =
                dispatcher.dispatch(
                        "stage1",
                        models,
                        model -> answer(model, history, run.personaFor(model)),
                        (model, error) -> failed(model, run.personaFor(model), error),
                        ceiling(models));

        logger.info("Stage 1 complete: " + answers.size() + " answers");
        return answers;
    }

    private Optional<ModelAnswer> answer(String model, List<Message> history, String persona) {
        GatewayResult result = gateway.call(model, history, persona, config.timeoutFor(model));

        if (result instanceof GatewayResult.Success success) {
            return Optional.of(
                    new ModelAnswer(
                            model,
                            success.answerText(),
                            success.thinkingText(),
                            success.reasoningModel(),
                            success.usage(),
                            costCalculator.cost(model, success.usage()),
                            persona,
                            null,
                            false));
        }
        if (result instanceof GatewayResult.Failure failure) {
            return Optional.of(
                    new ModelAnswer(
                            model,
                            failure.answerText(),
                            "",
                            failure.reasoningModel(),
                            failure.usage(),
                            costCalculator.cost(model, failure.usage()),
                            persona,
                            failure.error(),
                            false));
        }
        logger.warning("Stage 1: no response from " + model + ", dropping it from the round");
        return Optional.empty();
    }

    private ModelAnswer failed(String model, String persona, String error) {
        return new ModelAnswer(
                model,
                "Error: " + error,
                "",
                ReasoningModels.isReasoningModel(model),
                TokenUsage.ZERO,
                0.0,
                persona,
                error,
                false);
    }

    private Duration ceiling(List<String> models) {
        Duration longest =
                models.stream().map(config::timeoutFor).max(Duration::compareTo).orElseThrow();
        return longest.plus(config.getDispatchGrace());
    }
}
