package io.llmcouncil.core.council;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.pricing.CostCalculator;
import io.llmcouncil.core.ranking.RankingExtractor;
import io.llmcouncil.core.reasoning.ReasoningModels;
import io.llmcouncil.core.usage.TokenUsage;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/// Stage 2: every council model ranks the anonymized Stage 1 answers.
///
/// Labels are assigned in Stage 1 order. Reviewers see only labels, never model ids.
/// Each verdict is parsed inside its own task; the model-assisted fallback runs only for
/// verdicts whose call succeeded.
public class PeerRankingStage {

    private static final Logger logger = Logger.getLogger(PeerRankingStage.class.getName());

    private final ModelGateway gateway;
    private final StageDispatcher dispatcher;
    private final CostCalculator costCalculator;
    private final RankingExtractor rankingExtractor;
    private final CouncilConfig config;

    public PeerRankingStage(
            ModelGateway gateway,
            StageDispatcher dispatcher,
            CostCalculator costCalculator,
            RankingExtractor rankingExtractor,
            CouncilConfig config) {
        this.gateway = gateway;
        this.dispatcher = dispatcher;
        this.costCalculator = costCalculator;
        this.rankingExtractor = rankingExtractor;
        this.config = config;
    }

    /// @param userQuery question being answered, not null
    /// @param answers Stage 1 answers, not empty
    /// @param run roster of reviewers, not null
    /// @return label map and verdicts, never null
    public PeerRankingRound run(String userQuery, List<ModelAnswer> answers, RunConfiguration run) {
        LabelMap labels = LabelMap.assign(answers);
        List<String> labelList = labels.labels();
        List<Message> prompt =
                List.of(Message.user(CouncilPrompts.ranking(userQuery, answers, labels)));
        List<String> reviewers = run.councilModels();

        logger.info(
                "Stage 2: "
                        + reviewers.size()
                        + " reviewers ranking "
                        + labels.size()
                        + " answers");

        List<RankingVerdict> verdicts =
                dispatcher.dispatch(
                        "stage2",
                        reviewers,
                        reviewer -> verdict(reviewer, prompt, labelList),
                        this::failed,
                        ceiling(reviewers));

        long unparsed = verdicts.stream().filter(v -> v.parsedOrder().isEmpty()).count();
        if (unparsed > 0) {
            logger.warning("Stage 2: " + unparsed + " verdicts yielded no ranking");
        }
        return new PeerRankingRound(labels, verdicts);
    }

    private Optional<RankingVerdict> verdict(
            String reviewer, List<Message> prompt, List<String> labels) {
        GatewayResult result = gateway.call(reviewer, prompt, config.timeoutFor(reviewer));

        if (result instanceof GatewayResult.Success success) {
            List<String> parsed = rankingExtractor.extract(success.answerText(), labels, true);
            return Optional.of(
                    new RankingVerdict(
                            reviewer,
                            success.answerText(),
                            success.thinkingText(),
                            success.reasoningModel(),
                            parsed,
                            success.usage(),
                            costCalculator.cost(reviewer, success.usage()),
                            null));
        }
        if (result instanceof GatewayResult.Failure failure) {
            List<String> parsed = rankingExtractor.extract(failure.answerText(), labels, false);
            return Optional.of(
                    new RankingVerdict(
                            reviewer,
                            failure.answerText(),
                            "",
                            failure.reasoningModel(),
                            parsed,
                            failure.usage(),
                            costCalculator.cost(reviewer, failure.usage()),
                            failure.error()));
        }
        logger.warning("Stage 2: no verdict from " + reviewer);
        return Optional.empty();
    }

    private RankingVerdict failed(String reviewer, String error) {
        return new RankingVerdict(
                reviewer,
                "Error: " + error,
                "",
                ReasoningModels.isReasoningModel(reviewer),
                List.of(),
                TokenUsage.ZERO,
                0.0,
                error);
    }

    private Duration ceiling(List<String> reviewers) {
        Duration longest =
                reviewers.stream().map(config::timeoutFor).max(Duration::compareTo).orElseThrow();
        return longest.plus(config.getExtractionTimeout()).plus(config.getDispatchGrace());
    }
}
