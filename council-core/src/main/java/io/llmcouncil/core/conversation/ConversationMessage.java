package io.llmcouncil.core.conversation;

import io.llmcouncil.core.council.ChairmanResult;
import io.llmcouncil.core.council.CouncilResult;
import io.llmcouncil.core.council.ModelAnswer;
import io.llmcouncil.core.council.RankingVerdict;
import io.llmcouncil.core.council.RunMetadata;
import io.llmcouncil.core.message.Role;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// One stored turn of a conversation.
///
/// - {@link UserTurn}: the user's message
/// - {@link CouncilTurn}: the council's full response to it, all stages included
public sealed interface ConversationMessage
        permits ConversationMessage.UserTurn, ConversationMessage.CouncilTurn {

    Role role();

    Instant timestamp();

    /// @param content message text, not null
    /// @param timestamp when the message was stored, not null
    record UserTurn(String content, Instant timestamp) implements ConversationMessage {

        public UserTurn {
            Objects.requireNonNull(content, "content must not be null");
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        @Override
        public Role role() {
            return Role.USER;
        }
    }

    /// @param stage1 final answers, post-rebuttal
    /// @param stage2 peer verdicts
    /// @param stage3 chairman result, not null
    /// @param metadata run summary, not null
    /// @param timestamp when the turn was stored, not null
    record CouncilTurn(
            List<ModelAnswer> stage1,
            List<RankingVerdict> stage2,
            ChairmanResult stage3,
            RunMetadata metadata,
            Instant timestamp)
            implements ConversationMessage {

        public CouncilTurn {
            stage1 = stage1 != null ? List.copyOf(stage1) : List.of();
            stage2 = stage2 != null ? List.copyOf(stage2) : List.of();
            Objects.requireNonNull(stage3, "stage3 must not be null");
            metadata = metadata != null ? metadata : RunMetadata.EMPTY;
            timestamp = timestamp != null ? timestamp : Instant.now();
        }

        public static CouncilTurn from(CouncilResult result) {
            return new CouncilTurn(
                    result.answers(),
                    result.verdicts(),
                    result.chairman(),
                    result.metadata(),
                    Instant.now());
        }

        @Override
        public Role role() {
            return Role.ASSISTANT;
        }
    }
}
