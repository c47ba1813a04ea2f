package com.llmcouncil.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record ConversationSummary(
        @JsonProperty("id") String id,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("title") String title,
        @JsonProperty("message_count") long messageCount
) {
}
