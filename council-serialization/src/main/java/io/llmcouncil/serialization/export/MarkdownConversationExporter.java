package io.llmcouncil.serialization.export;

import io.llmcouncil.core.conversation.Conversation;
import io.llmcouncil.core.conversation.ConversationMessage;
import io.llmcouncil.core.council.AggregateEntry;
import io.llmcouncil.core.council.ModelAnswer;
import io.llmcouncil.core.council.RankingVerdict;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Renders a conversation as Markdown.
///
/// Layout: title and metadata header, then one section per message. Council turns list the
/// Stage 1 answers, the aggregate ranking table, each reviewer's evaluation and the
/// chairman's answer. Model ids are shortened to the part after the last `/`.
public class MarkdownConversationExporter implements ConversationExporter {

    private static final String SEPARATOR = "---";

    @Override
    public String export(Conversation conversation) {
        List<String> lines = new ArrayList<>();

        lines.add("# " + conversation.title());
        lines.add("");
        lines.add("**Date:** " + conversation.createdAt());
        lines.add("**ID:** " + conversation.id());
        lines.add("");
        lines.add(SEPARATOR);
        lines.add("");

        int index = 1;
        for (ConversationMessage message : conversation.messages()) {
            if (message instanceof ConversationMessage.UserTurn user) {
                lines.add("## Message " + index + ": User");
                lines.add("");
                lines.add(user.content());
                lines.add("");
            } else if (message instanceof ConversationMessage.CouncilTurn turn) {
                lines.add("## Message " + index + ": Council Response");
                lines.add("");
                appendCouncilTurn(lines, turn);
            }
            lines.add(SEPARATOR);
            lines.add("");
            index++;
        }

        return String.join("\n", lines);
    }

    @Override
    public String fileExtension() {
        return "md";
    }

    @Override
    public String contentType() {
        return "text/markdown";
    }

    private void appendCouncilTurn(List<String> lines, ConversationMessage.CouncilTurn turn) {
        if (!turn.stage1().isEmpty()) {
            lines.add("### Stage 1: Individual Responses");
            lines.add("");
            for (ModelAnswer answer : turn.stage1()) {
                lines.add("#### " + shortName(answer.modelId()));
                lines.add("");
                lines.add(answer.answerText());
                lines.add("");
            }
        }

        if (!turn.stage2().isEmpty()) {
            lines.add("### Stage 2: Peer Rankings");
            lines.add("");

            List<AggregateEntry> aggregate = turn.metadata().aggregateRankings();
            if (!aggregate.isEmpty()) {
                lines.add("#### Aggregate Rankings");
                lines.add("");
                lines.add("| Rank | Model | Avg Score | Votes |");
                lines.add("|------|-------|-----------|-------|");
                int rank = 1;
                for (AggregateEntry entry : aggregate) {
                    lines.add(
                            String.format(
                                    Locale.ROOT,
                                    "| %d | %s | %.2f | %d |",
                                    rank++,
                                    shortName(entry.modelId()),
                                    entry.averageRank(),
                                    entry.voteCount()));
                }
                lines.add("");
            }

            for (RankingVerdict verdict : turn.stage2()) {
                lines.add("#### " + shortName(verdict.modelId()) + "'s Evaluation");
                lines.add("");
                lines.add(verdict.rawText());
                lines.add("");
            }
        }

        lines.add("### Stage 3: Final Answer");
        lines.add("");
        lines.add("**Chairman:** " + shortName(turn.stage3().modelId()));
        lines.add("");
        lines.add(turn.stage3().answerText());
        lines.add("");
    }

    static String shortName(String modelId) {
        int slash = modelId.lastIndexOf('/');
        return slash >= 0 ? modelId.substring(slash + 1) : modelId;
    }
}
