package com.llmcouncil.conversation;

import static com.llmcouncil.council.CouncilConstants.DEFAULT_TITLE;

import com.fasterxml.jackson.core.type.TypeReference;
import com.llmcouncil.client.TurnStatus;
import com.llmcouncil.council.model.CouncilMetadata;
import com.llmcouncil.council.model.CouncilResult;
import com.llmcouncil.council.model.FinalAnswer;
import com.llmcouncil.council.model.HistoryEntry;
import com.llmcouncil.council.model.ImageAttachment;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Critique;
import com.llmcouncil.entity.Conversation;
import com.llmcouncil.entity.ConversationTurn;
import com.llmcouncil.repository.ConversationRepository;
import com.llmcouncil.repository.ConversationTurnRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaConversationStore implements ConversationStore {

    private static final TypeReference<List<String>> IMAGES = new TypeReference<>() {
    };
    private static final TypeReference<List<Stage1Answer>> STAGE1 = new TypeReference<>() {
    };
    private static final TypeReference<List<Stage2Critique>> STAGE2 = new TypeReference<>() {
    };
    private static final TypeReference<FinalAnswer> STAGE3 = new TypeReference<>() {
    };
    private static final TypeReference<CouncilMetadata> METADATA = new TypeReference<>() {
    };

    private final ConversationRepository conversationRepository;
    private final ConversationTurnRepository turnRepository;
    private final JsonProcessingService jsonProcessingService;

    @Override
    @Transactional
    public ConversationSummary create() {
        Conversation conversation = conversationRepository.save(Conversation.builder()
                .title(DEFAULT_TITLE)
                .build());
        log.info("Created conversation {}.", conversation.getId());
        return toSummary(conversation, 0);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ConversationSummary> list() {
        return conversationRepository.findAllByOrderByCreatedAtDesc().stream()
                .map(conversation -> toSummary(conversation, turnRepository.countByConversationId(conversation.getId())))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationDetail> load(String conversationId) {
        return parseId(conversationId)
                .flatMap(conversationRepository::findById)
                .map(this::toDetail);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String conversationId) {
        return parseId(conversationId).map(conversationRepository::existsById).orElse(false);
    }

    @Override
    @Transactional(readOnly = true)
    public List<HistoryEntry> history(String conversationId) {
        Optional<UUID> id = parseId(conversationId);
        if (id.isEmpty()) {
            return List.of();
        }
        List<HistoryEntry> history = new ArrayList<>();
        for (ConversationTurn turn : turnRepository.findByConversationIdAndStatusOrderByTurnIndexAsc(
                id.get(), TurnStatus.COMPLETE.name())) {
            FinalAnswer answer = jsonProcessingService.fromJson("stage3", turn.getStage3Json(), STAGE3);
            if (answer == null) {
                continue;
            }
            history.add(HistoryEntry.user(turn.getUserContent()));
            history.add(HistoryEntry.assistant(answer.response()));
        }
        return history;
    }

    @Override
    @Transactional(readOnly = true)
    public long turnCount(String conversationId) {
        return parseId(conversationId).map(turnRepository::countByConversationId).orElse(0L);
    }

    @Override
    @Transactional
    public String appendTurn(String conversationId, String question, List<ImageAttachment> images) {
        Conversation conversation = parseId(conversationId)
                .flatMap(conversationRepository::findById)
                .orElseThrow(() -> new IllegalArgumentException("Conversation not found: " + conversationId));
        int index = (int) turnRepository.countByConversationId(conversation.getId());
        List<String> dataUrls = images == null ? List.of() : images.stream().map(ImageAttachment::dataUrl).toList();
        ConversationTurn turn = turnRepository.save(ConversationTurn.builder()
                .conversation(conversation)
                .turnIndex(index)
                .userContent(question)
                .imagesJson(dataUrls.isEmpty() ? null : jsonProcessingService.toJson(dataUrls))
                .status(TurnStatus.RUNNING.name())
                .build());
        return turn.getId().toString();
    }

    @Override
    @Transactional
    public void completeTurn(String turnId, CouncilResult result) {
        findTurn(turnId).ifPresent(turn -> {
            turn.setStage1Json(jsonProcessingService.toJson(result.stage1()));
            turn.setStage2Json(jsonProcessingService.toJson(result.stage2()));
            turn.setStage3Json(jsonProcessingService.toJson(result.stage3()));
            turn.setMetadataJson(jsonProcessingService.toJson(result.metadata()));
            turn.setStatus(TurnStatus.COMPLETE.name());
            turnRepository.save(turn);
        });
    }

    @Override
    @Transactional
    public void abortTurn(String turnId, TurnStatus status, List<Stage1Answer> stage1, List<Stage2Critique> stage2,
                          @Nullable CouncilMetadata metadata, @Nullable String error) {
        findTurn(turnId).ifPresent(turn -> {
            turn.setStage1Json(stage1 == null || stage1.isEmpty() ? null : jsonProcessingService.toJson(stage1));
            turn.setStage2Json(stage2 == null || stage2.isEmpty() ? null : jsonProcessingService.toJson(stage2));
            turn.setMetadataJson(jsonProcessingService.toJson(metadata));
            turn.setErrorMessage(error);
            turn.setStatus(status.name());
            turnRepository.save(turn);
        });
    }

    @Override
    @Transactional
    public void updateTitle(String conversationId, String title) {
        parseId(conversationId)
                .flatMap(conversationRepository::findById)
                .ifPresent(conversation -> {
                    conversation.setTitle(title);
                    conversationRepository.save(conversation);
                });
    }

    private Optional<ConversationTurn> findTurn(String turnId) {
        Optional<ConversationTurn> turn = parseId(turnId).flatMap(turnRepository::findById);
        if (turn.isEmpty()) {
            log.warn("Turn {} not found; result not stored.", turnId);
        }
        return turn;
    }

    private ConversationDetail toDetail(Conversation conversation) {
        List<ConversationMessage> messages = new ArrayList<>();
        for (ConversationTurn turn : turnRepository.findByConversationIdOrderByTurnIndexAsc(conversation.getId())) {
            messages.add(ConversationMessage.user(turn.getUserContent(),
                    jsonProcessingService.fromJson("images", turn.getImagesJson(), IMAGES)));
            if (TurnStatus.RUNNING.name().equals(turn.getStatus())) {
                continue;
            }
            messages.add(ConversationMessage.assistant(
                    jsonProcessingService.fromJson("stage1", turn.getStage1Json(), STAGE1),
                    jsonProcessingService.fromJson("stage2", turn.getStage2Json(), STAGE2),
                    jsonProcessingService.fromJson("stage3", turn.getStage3Json(), STAGE3),
                    jsonProcessingService.fromJson("metadata", turn.getMetadataJson(), METADATA),
                    turn.getStatus(),
                    turn.getErrorMessage()));
        }
        return new ConversationDetail(conversation.getId().toString(), conversation.getCreatedAt(),
                conversation.getTitle(), messages);
    }

    private ConversationSummary toSummary(Conversation conversation, long turns) {
        return new ConversationSummary(conversation.getId().toString(), conversation.getCreatedAt(),
                conversation.getTitle(), turns);
    }

    private Optional<UUID> parseId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException ex) {
            log.debug("Not a conversation id: {}", value);
            return Optional.empty();
        }
    }
}
