package io.llmcouncil.core.event;

import io.llmcouncil.core.council.AggregateEntry;
import io.llmcouncil.core.council.ChairmanResult;
import io.llmcouncil.core.council.ModelAnswer;
import io.llmcouncil.core.council.RankingVerdict;
import io.llmcouncil.core.council.RunMetadata;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Progress events emitted while a council run executes, in emission order.
///
/// ### Event Types
/// - `stage1_start`, `stage1_complete` - independent answers
/// - `stage2_start`, `stage2_complete` - peer verdicts with label map and league table
/// - `stage2_5_start` - rebuttal round; followed by a second `stage1_complete` carrying the
///   revised answers, which replaces the first
/// - `stage3_start`, `stage3_complete` - chairman synthesis
/// - `title_complete` - conversation title, first message only
/// - `complete` or `error` - terminal event
///
/// @see CouncilEventListener
public sealed interface CouncilEvent
        permits CouncilEvent.Stage1Started,
                CouncilEvent.Stage1Completed,
                CouncilEvent.Stage2Started,
                CouncilEvent.Stage2Completed,
                CouncilEvent.RebuttalStarted,
                CouncilEvent.Stage3Started,
                CouncilEvent.Stage3Completed,
                CouncilEvent.TitleCompleted,
                CouncilEvent.RunCompleted,
                CouncilEvent.RunFailed {

    /// Returns the wire name of the event.
    String type();

    /// Returns when the event occurred.
    Instant timestamp();

    record Stage1Started(Instant timestamp) implements CouncilEvent {
        @Override
        public String type() {
            return "stage1_start";
        }
    }

    /// Answers of Stage 1, or revised answers after the rebuttal round.
    record Stage1Completed(List<ModelAnswer> answers, Instant timestamp) implements CouncilEvent {

        public Stage1Completed {
            answers = List.copyOf(answers);
        }

        @Override
        public String type() {
            return "stage1_complete";
        }
    }

    record Stage2Started(Instant timestamp) implements CouncilEvent {
        @Override
        public String type() {
            return "stage2_start";
        }
    }

    record Stage2Completed(
            List<RankingVerdict> verdicts,
            Map<String, String> labelToModel,
            List<AggregateEntry> aggregateRankings,
            Instant timestamp)
            implements CouncilEvent {

        public Stage2Completed {
            verdicts = List.copyOf(verdicts);
            labelToModel = Collections.unmodifiableMap(new LinkedHashMap<>(labelToModel));
            aggregateRankings = List.copyOf(aggregateRankings);
        }

        @Override
        public String type() {
            return "stage2_complete";
        }
    }

    record RebuttalStarted(Instant timestamp) implements CouncilEvent {
        @Override
        public String type() {
            return "stage2_5_start";
        }
    }

    record Stage3Started(Instant timestamp) implements CouncilEvent {
        @Override
        public String type() {
            return "stage3_start";
        }
    }

    record Stage3Completed(ChairmanResult chairman, Instant timestamp) implements CouncilEvent {
        @Override
        public String type() {
            return "stage3_complete";
        }
    }

    record TitleCompleted(String title, Instant timestamp) implements CouncilEvent {
        @Override
        public String type() {
            return "title_complete";
        }
    }

    record RunCompleted(RunMetadata metadata, Instant timestamp) implements CouncilEvent {
        @Override
        public String type() {
            return "complete";
        }
    }

    record RunFailed(String message, Instant timestamp) implements CouncilEvent {
        @Override
        public String type() {
            return "error";
        }
    }
}
