package io.llmcouncil.core.conversation;

import java.time.Instant;

/// List-view metadata of a conversation.
public record ConversationSummary(String id, Instant createdAt, String title, int messageCount) {}
