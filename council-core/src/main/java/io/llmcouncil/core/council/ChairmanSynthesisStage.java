package io.llmcouncil.core.council;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.pricing.CostCalculator;
import java.util.List;
import java.util.logging.Logger;

/// Stage 3: the chairman reads every answer and verdict and writes the final answer.
///
/// A failed or missing chairman reply becomes the {@link ChairmanResult#failure} sentinel
/// instead of failing the run.
public class ChairmanSynthesisStage {

    private static final Logger logger = Logger.getLogger(ChairmanSynthesisStage.class.getName());

    private final ModelGateway gateway;
    private final CostCalculator costCalculator;
    private final CouncilConfig config;

    public ChairmanSynthesisStage(
            ModelGateway gateway, CostCalculator costCalculator, CouncilConfig config) {
        this.gateway = gateway;
        this.costCalculator = costCalculator;
        this.config = config;
    }

    /// @param userQuery original question, not null
    /// @param answers final answers, possibly revised, not null
    /// @param verdicts Stage 2 verdicts, not null
    /// @param chairmanModel chairman model id, not null
    /// @return synthesized result or failure sentinel, never null
    public ChairmanResult run(
            String userQuery,
            List<ModelAnswer> answers,
            List<RankingVerdict> verdicts,
            String chairmanModel) {
        logger.info("Stage 3: chairman " + chairmanModel + " synthesizing");

        String prompt = CouncilPrompts.chairman(userQuery, answers, verdicts);
        GatewayResult result =
                gateway.call(
                        chairmanModel,
                        List.of(Message.user(prompt)),
                        config.timeoutFor(chairmanModel));

        if (result instanceof GatewayResult.Success success) {
            return new ChairmanResult(
                    chairmanModel,
                    success.answerText(),
                    success.thinkingText(),
                    success.reasoningModel(),
                    success.usage(),
                    costCalculator.cost(chairmanModel, success.usage()),
                    null);
        }

        String error =
                result instanceof GatewayResult.Failure failure
                        ? failure.error()
                        : "No response from chairman";
        logger.warning("Stage 3: chairman " + chairmanModel + " failed: " + error);
        return ChairmanResult.failure(chairmanModel, error);
    }
}
