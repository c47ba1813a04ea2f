package com.llmcouncil.conversation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmcouncil.council.model.CouncilMetadata;
import com.llmcouncil.council.model.FinalAnswer;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Critique;

import java.util.List;

/**
 * A stored message as the client renders it: a user question, or the council's three stages
 * for that question.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationMessage(
        @JsonProperty("role") String role,
        @JsonProperty("content") String content,
        @JsonProperty("images") List<String> images,
        @JsonProperty("stage1") List<Stage1Answer> stage1,
        @JsonProperty("stage2") List<Stage2Critique> stage2,
        @JsonProperty("stage3") FinalAnswer stage3,
        @JsonProperty("metadata") CouncilMetadata metadata,
        @JsonProperty("status") String status,
        @JsonProperty("error") String error
) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public static ConversationMessage user(String content, List<String> images) {
        return new ConversationMessage(ROLE_USER, content, images == null || images.isEmpty() ? null : images,
                null, null, null, null, null, null);
    }

    public static ConversationMessage assistant(List<Stage1Answer> stage1, List<Stage2Critique> stage2,
                                                FinalAnswer stage3, CouncilMetadata metadata,
                                                String status, String error) {
        return new ConversationMessage(ROLE_ASSISTANT, null, null, stage1, stage2, stage3, metadata, status, error);
    }
}
