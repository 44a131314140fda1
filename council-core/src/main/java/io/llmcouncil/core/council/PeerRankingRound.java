package io.llmcouncil.core.council;

import java.util.List;
import java.util.Objects;

/// Output of Stage 2: the round's label map and the verdicts in roster order.
public record PeerRankingRound(LabelMap labels, List<RankingVerdict> verdicts) {

    public PeerRankingRound {
        Objects.requireNonNull(labels, "labels must not be null");
        verdicts = List.copyOf(verdicts);
    }
}
