package io.llmcouncil.core.council;

import io.llmcouncil.core.event.CouncilEvent;
import io.llmcouncil.core.event.CouncilEventListener;
import io.llmcouncil.core.message.Message;
import io.llmcouncil.core.usage.UsageAccountant;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Runs the council pipeline for one user turn.
///
/// ### Pipeline
/// 1. {@link IndependentGenerationStage} collects answers
/// 2. {@link PeerRankingStage} collects anonymized verdicts, then {@link AggregateRanker}
///    builds the league table
/// 3. {@link RebuttalStage} lets authors revise their answers
/// 4. {@link ChairmanSynthesisStage} writes the final answer from the revised answers
///
/// Stages are strict barriers: each starts only after every task of the previous stage
/// settled. When Stage 1 yields no answer without an error, the run ends with
/// {@link CouncilResult#terminalError()} and no later stage is invoked.
///
/// @implNote Thread-safe. Runs are independent; all per-run state lives on the stack.
/// `run` blocks the calling thread until the run finishes.
public class CouncilOrchestrator {

    private static final Logger logger = Logger.getLogger(CouncilOrchestrator.class.getName());

    private final IndependentGenerationStage generationStage;
    private final PeerRankingStage rankingStage;
    private final AggregateRanker aggregateRanker;
    private final RebuttalStage rebuttalStage;
    private final ChairmanSynthesisStage chairmanStage;

    public CouncilOrchestrator(
            IndependentGenerationStage generationStage,
            PeerRankingStage rankingStage,
            AggregateRanker aggregateRanker,
            RebuttalStage rebuttalStage,
            ChairmanSynthesisStage chairmanStage) {
        this.generationStage = Objects.requireNonNull(generationStage, "generationStage");
        this.rankingStage = Objects.requireNonNull(rankingStage, "rankingStage");
        this.aggregateRanker = Objects.requireNonNull(aggregateRanker, "aggregateRanker");
        this.rebuttalStage = Objects.requireNonNull(rebuttalStage, "rebuttalStage");
        this.chairmanStage = Objects.requireNonNull(chairmanStage, "chairmanStage");
    }

    /// Runs the full pipeline.
    ///
    /// @param history conversation history ending with the current user message, not empty
    /// @param run roster, chairman and personas, not null
    /// @param listener receives stage events, not null
    /// @return the run result, never null
    /// @throws IllegalArgumentException if history is empty
    public CouncilResult run(
            List<Message> history, RunConfiguration run, CouncilEventListener listener) {
        if (history.isEmpty()) {
            throw new IllegalArgumentException("Conversation history must not be empty");
        }
        String userQuery = history.get(history.size() - 1).content();
        logger.info(
                "Starting council run: "
                        + run.councilModels().size()
                        + " models, chairman "
                        + run.chairmanModel());

        emit(listener, new CouncilEvent.Stage1Started(Instant.now()));
        List<ModelAnswer> answers = generationStage.run(history, run);
        emit(listener, new CouncilEvent.Stage1Completed(answers, Instant.now()));

        if (answers.stream().allMatch(ModelAnswer::hasError)) {
            logger.warning("All council models failed in Stage 1, aborting run");
            return CouncilResult.terminalError();
        }

        emit(listener, new CouncilEvent.Stage2Started(Instant.now()));
        PeerRankingRound round = rankingStage.run(userQuery, answers, run);
        List<AggregateEntry> aggregate =
                aggregateRanker.aggregate(round.verdicts(), round.labels());
        emit(
                listener,
                new CouncilEvent.Stage2Completed(
                        round.verdicts(), round.labels().asMap(), aggregate, Instant.now()));

        emit(listener, new CouncilEvent.RebuttalStarted(Instant.now()));
        List<ModelAnswer> revised = rebuttalStage.run(userQuery, answers, round, run);
        emit(listener, new CouncilEvent.Stage1Completed(revised, Instant.now()));

        emit(listener, new CouncilEvent.Stage3Started(Instant.now()));
        ChairmanResult chairman =
                chairmanStage.run(userQuery, revised, round.verdicts(), run.chairmanModel());
        emit(listener, new CouncilEvent.Stage3Completed(chairman, Instant.now()));

        UsageAccountant totals = total(revised, round.verdicts(), chairman);
        RunMetadata metadata =
                new RunMetadata(
                        round.labels().asMap(),
                        aggregate,
                        totals.totalCost(),
                        totals.totalTokens());

        logger.info(
                "Council run complete: "
                        + metadata.totalTokens().totalTokens()
                        + " tokens, $"
                        + metadata.totalCost());
        return new CouncilResult(revised, round.verdicts(), chairman, metadata);
    }

    /// Sums the post-rebuttal answers, the verdicts and the chairman result.
    static UsageAccountant total(
            List<ModelAnswer> answers, List<RankingVerdict> verdicts, ChairmanResult chairman) {
        UsageAccountant accountant = new UsageAccountant();
        answers.forEach(a -> accountant.add(a.usage(), a.cost()));
        verdicts.forEach(v -> accountant.add(v.usage(), v.cost()));
        accountant.add(chairman.usage(), chairman.cost());
        return accountant;
    }

    private static void emit(CouncilEventListener listener, CouncilEvent event) {
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            logger.warning("Event listener failed on " + event.type() + ": " + e.getMessage());
        }
    }
}
