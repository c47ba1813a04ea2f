package com.llmcouncil.repository;

import com.llmcouncil.entity.ConversationTurn;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ConversationTurnRepository extends JpaRepository<ConversationTurn, UUID> {

    List<ConversationTurn> findByConversationIdOrderByTurnIndexAsc(UUID conversationId);

    List<ConversationTurn> findByConversationIdAndStatusOrderByTurnIndexAsc(UUID conversationId, String status);

    long countByConversationId(UUID conversationId);
}
