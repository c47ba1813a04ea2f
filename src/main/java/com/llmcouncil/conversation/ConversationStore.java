package com.llmcouncil.conversation;

import com.llmcouncil.client.TurnStatus;
import com.llmcouncil.council.model.CouncilMetadata;
import com.llmcouncil.council.model.CouncilResult;
import com.llmcouncil.council.model.HistoryEntry;
import com.llmcouncil.council.model.ImageAttachment;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Critique;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of conversations and their turns. Conversation ids that do not name a stored
 * conversation are treated as absent, never as errors.
 */
public interface ConversationStore {

    ConversationSummary create();

    /**
     * All conversations, newest first.
     */
    List<ConversationSummary> list();

    Optional<ConversationDetail> load(String conversationId);

    boolean exists(String conversationId);

    /**
     * Prior completed exchanges of the conversation, oldest first: each turn contributes the
     * user question and the chairman's answer.
     */
    List<HistoryEntry> history(String conversationId);

    long turnCount(String conversationId);

    /**
     * Records a new running turn.
     *
     * @return the turn id
     */
    String appendTurn(String conversationId, String question, List<ImageAttachment> images);

    void completeTurn(String turnId, CouncilResult result);

    /**
     * Closes a turn that did not complete, keeping whatever output it produced.
     */
    void abortTurn(String turnId, TurnStatus status, List<Stage1Answer> stage1, List<Stage2Critique> stage2,
                   @Nullable CouncilMetadata metadata, @Nullable String error);

    void updateTitle(String conversationId, String title);
}
