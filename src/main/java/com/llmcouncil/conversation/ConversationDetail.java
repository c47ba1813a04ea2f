package com.llmcouncil.conversation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.List;

public record ConversationDetail(
        @JsonProperty("id") String id,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("title") String title,
        @JsonProperty("messages") List<ConversationMessage> messages
) {
}
