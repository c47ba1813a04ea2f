package com.llmcouncil.api;

import com.llmcouncil.client.TurnState;
import com.llmcouncil.conversation.ConversationDetail;
import com.llmcouncil.conversation.ConversationStore;
import com.llmcouncil.conversation.ConversationSummary;
import com.llmcouncil.council.CouncilOrchestrator;
import com.llmcouncil.council.CouncilPipelineException;
import com.llmcouncil.council.TurnCancelledException;
import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.CouncilResult;
import com.llmcouncil.council.model.ImageAttachment;
import com.llmcouncil.stream.CouncilStreamService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

@RestController
@RequestMapping("/api/conversations")
@Slf4j
public class ConversationController {

    private final ConversationStore conversationStore;
    private final CouncilOrchestrator orchestrator;
    private final CouncilStreamService streamService;
    private final ImageAttachmentValidator imageValidator;
    private final ExecutorService orchestrationExecutor;

    public ConversationController(ConversationStore conversationStore,
                                  CouncilOrchestrator orchestrator,
                                  CouncilStreamService streamService,
                                  ImageAttachmentValidator imageValidator,
                                  @Qualifier("orchestrationExecutor") ExecutorService orchestrationExecutor) {
        this.conversationStore = conversationStore;
        this.orchestrator = orchestrator;
        this.streamService = streamService;
        this.imageValidator = imageValidator;
        this.orchestrationExecutor = orchestrationExecutor;
    }

    @GetMapping
    public List<ConversationSummary> list() {
        return conversationStore.list();
    }

    @PostMapping
    public ConversationSummary create() {
        return conversationStore.create();
    }

    @GetMapping("/{id}")
    public ConversationDetail get(@PathVariable String id) {
        return conversationStore.load(id).orElseThrow(() -> notFound(id));
    }

    @PostMapping("/{id}/message")
    public CouncilResult sendMessage(@PathVariable String id, @Valid @RequestBody SendMessageRequest request) {
        requireConversation(id);
        List<ImageAttachment> images = imageValidator.validate(request.images());
        try {
            return orchestrator.runTurn(id, null, request.content(), images);
        } catch (CouncilPipelineException ex) {
            throw new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex);
        }
    }

    @PostMapping("/{id}/message/stream")
    public ChatStreamResponse sendMessageStream(@PathVariable String id, @Valid @RequestBody SendMessageRequest request) {
        requireConversation(id);
        List<ImageAttachment> images = imageValidator.validate(request.images());
        String runId = streamService.createRun(id);
        CompletableFuture.runAsync(() -> {
            try {
                orchestrator.runTurn(id, runId, request.content(), images);
            } catch (TurnCancelledException ex) {
                log.info("Run {} stopped: {}", runId, ex.getMessage());
            } catch (RuntimeException ex) {
                // no-op for the hub when the orchestrator already closed the run
                streamService.publish(runId, new CouncilEvent.TurnError(ex.getMessage()));
            }
        }, orchestrationExecutor);
        return new ChatStreamResponse(runId, Instant.now());
    }

    @GetMapping("/{id}/live")
    public TurnState live(@PathVariable String id) {
        requireConversation(id);
        return streamService.liveState(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "No streamed turn for " + id));
    }

    private void requireConversation(String id) {
        if (!conversationStore.exists(id)) {
            throw notFound(id);
        }
    }

    private ResponseStatusException notFound(String id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Conversation not found: " + id);
    }
}
