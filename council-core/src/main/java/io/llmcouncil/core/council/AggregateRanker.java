package io.llmcouncil.core.council;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Reduces the verdicts of a round into one league table by mean rank position.
///
/// For each verdict, the label at 1-based position `p` adds `p` to its model's positions.
/// Models never placed are omitted. Entries sort by ascending average rank, then by model
/// id so the order is total.
public final class AggregateRanker {

    private static final Comparator<AggregateEntry> ORDER =
            Comparator.comparingDouble(AggregateEntry::averageRank)
                    .thenComparing(AggregateEntry::modelId);

    /// @param verdicts verdicts of the round, not null
    /// @param labels label map of the round, not null
    /// @return league table, best first, never null
    public List<AggregateEntry> aggregate(List<RankingVerdict> verdicts, LabelMap labels) {
        Map<String, List<Integer>> positions = new LinkedHashMap<>();

        for (RankingVerdict verdict : verdicts) {
            List<String> order = verdict.parsedOrder();
            for (int i = 0; i < order.size(); i++) {
                int position = i + 1;
                Optional<String> model = labels.modelFor(order.get(i));
                model.ifPresent(
                        id ->
                                positions
                                        .computeIfAbsent(id, key -> new ArrayList<>())
                                        .add(position));
            }
        }

        List<AggregateEntry> entries = new ArrayList<>(positions.size());
        positions.forEach(
                (modelId, ranks) -> {
                    double average = ranks.stream().mapToInt(Integer::intValue).average().orElse(0);
                    entries.add(new AggregateEntry(modelId, round2(average), ranks.size()));
                });
        entries.sort(ORDER);
        return List.copyOf(entries);
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
