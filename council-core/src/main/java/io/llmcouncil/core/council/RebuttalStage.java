package io.llmcouncil.core.council;

import io.llmcouncil.core.CouncilConfig;
import io.llmcouncil.core.gateway.GatewayResult;
import io.llmcouncil.core.gateway.ModelGateway;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.pricing.CostCalculator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// Stage 2.5: authors see the peer verdicts and may revise their answers.
///
/// Every verdict that produced text is forwarded whole to every author, including the
/// `Error: ...` text of a reviewer whose call failed; the critique addressed to one label
/// is not isolated. An author with no critiques is passed through without a call. A
/// revision replaces the answer only when its call succeeded; usage and cost of both calls
/// are summed and the answer is flagged as a rebuttal.
public class RebuttalStage {

    private static final Logger logger = Logger.getLogger(RebuttalStage.class.getName());

    private final ModelGateway gateway;
    private final StageDispatcher dispatcher;
    private final CostCalculator costCalculator;
    private final CouncilConfig config;

    public RebuttalStage(
            ModelGateway gateway,
            StageDispatcher dispatcher,
            CostCalculator costCalculator,
            CouncilConfig config) {
        this.gateway = gateway;
        this.dispatcher = dispatcher;
        this.costCalculator = costCalculator;
        this.config = config;
    }

    /// @param userQuery original question, not null
    /// @param answers Stage 1 answers, not null
    /// @param round Stage 2 output, not null
    /// @param run personas for the round, not null
    /// @return answers in the same order, revised where a rebuttal succeeded, never null
    public List<ModelAnswer> run(
            String userQuery,
            List<ModelAnswer> answers,
            PeerRankingRound round,
            RunConfiguration run) {
        List<RankingVerdict> critiques = forwardable(round.verdicts());
        if (critiques.isEmpty()) {
            logger.info("Stage 2.5: no critiques to forward, answers unchanged");
            return List.copyOf(answers);
        }

        LabelMap labels = round.labels();
        List<ModelAnswer> participants =
                answers.stream().filter(a -> labels.labelFor(a.modelId()).isPresent()).toList();
        String critiqueText = CouncilPrompts.critiques(critiques);

        logger.info("Stage 2.5: " + participants.size() + " models may revise their answers");

        List<Revision> revisions =
                dispatcher.dispatch(
                        "stage2.5",
                        participants,
                        answer -> Optional.of(revise(userQuery, answer, labels, critiqueText, run)),
                        (answer, error) -> new Revision(answer, answer),
                        ceiling(participants));

        Map<String, ModelAnswer> revised = new HashMap<>();
        for (Revision revision : revisions) {
            revised.put(revision.original().modelId(), revision.result());
        }

        List<ModelAnswer> merged = new ArrayList<>(answers.size());
        int count = 0;
        for (ModelAnswer answer : answers) {
            ModelAnswer result = revised.getOrDefault(answer.modelId(), answer);
            if (result != answer) {
                count++;
            }
            merged.add(result);
        }
        logger.info("Stage 2.5 complete: " + count + " answers revised");
        return merged;
    }

    private Revision revise(
            String userQuery,
            ModelAnswer answer,
            LabelMap labels,
            String critiqueText,
            RunConfiguration run) {
        String label = labels.labelFor(answer.modelId()).orElse("Unknown");
        String prompt = CouncilPrompts.rebuttal(userQuery, answer, label, critiqueText);
        String model = answer.modelId();

        GatewayResult result =
                gateway.call(
                        model,
                        List.of(Message.user(prompt)),
                        run.personaFor(model),
                        config.timeoutFor(model));

        if (result instanceof GatewayResult.Success success) {
            return new Revision(
                    answer,
                    answer.revisedWith(
                            success.answerText(),
                            success.thinkingText(),
                            success.usage(),
                            costCalculator.cost(model, success.usage())));
        }
        logger.warning("Stage 2.5: rebuttal from " + model + " failed, keeping original answer");
        return new Revision(answer, answer);
    }

    private static List<RankingVerdict> forwardable(List<RankingVerdict> verdicts) {
        return verdicts.stream().filter(v -> !v.rawText().isBlank()).toList();
    }

    private Duration ceiling(List<ModelAnswer> participants) {
        Duration longest =
                participants.stream()
                        .map(a -> config.timeoutFor(a.modelId()))
                        .max(Duration::compareTo)
                        .orElse(config.getStandardTimeout());
        return longest.plus(config.getDispatchGrace());
    }

    private record Revision(ModelAnswer original, ModelAnswer result) {}
}
