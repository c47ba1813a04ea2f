package com.llmcouncil.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.llmcouncil.client.ConversationLiveState;
import com.llmcouncil.client.TurnState;
import com.llmcouncil.council.event.CouncilEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one event buffer per streamed turn and fans events out to the WebSocket sessions
 * watching it. At most one run per conversation is active: creating a run cancels the
 * previous one.
 */
@Component
public class CouncilStreamHub {
    private static final Logger log = LoggerFactory.getLogger(CouncilStreamHub.class);
    private static final int MAX_BUFFER_SIZE = 500;
    private static final long CLEANUP_TTL_MS = 30 * 60 * 1000L;

    private final ObjectMapper objectMapper;
    private final Map<String, StreamRun> runs = new ConcurrentHashMap<>();
    private final Map<String, String> activeRunByConversation = new ConcurrentHashMap<>();
    private final Map<String, ConversationLiveState> liveStates = new ConcurrentHashMap<>();

    public CouncilStreamHub(ObjectMapper objectMapper) {
        // start, complete and cancelled events carry no fields
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }

    public String createRun(@Nullable String conversationId) {
        cleanupExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new StreamRun(runId, conversationId));
        if (conversationId != null) {
            String previous = activeRunByConversation.put(conversationId, runId);
            if (previous != null && cancelRun(previous)) {
                log.info("Run {} superseded by {} in conversation {}", previous, runId, conversationId);
            }
            liveStates.computeIfAbsent(conversationId, id -> new ConversationLiveState()).beginTurn(runId);
        }
        return runId;
    }

    public boolean hasRun(String runId) {
        return runs.containsKey(runId);
    }

    public void registerSession(String runId, WebSocketSession session, long sinceId) throws IOException {
        StreamRun run = runs.get(runId);
        if (run == null) {
            session.close();
            return;
        }
        cleanupExpiredRuns();
        run.sessions().put(session.getId(), session);
        session.getAttributes().put("runId", runId);
        for (StreamEvent event : run.snapshotSince(sinceId)) {
            send(session, event);
        }
    }

    public void removeSession(WebSocketSession session) {
        Object runIdObj = session.getAttributes().get("runId");
        if (runIdObj == null) {
            return;
        }
        StreamRun run = runs.get(runIdObj.toString());
        if (run == null) {
            return;
        }
        run.sessions().remove(session.getId());
        pruneIfComplete(run);
    }

    /**
     * Buffers and broadcasts an event. Events of a cancelled run and events after a terminal
     * event are dropped.
     */
    public void emit(String runId, CouncilEvent event) {
        StreamRun run = runs.get(runId);
        if (run == null || run.cancelled()) {
            return;
        }
        append(run, event);
    }

    public boolean cancelRun(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null || run.completed()) {
            return false;
        }
        if (run.cancelled()) {
            return true;
        }
        run.markCancelled();
        append(run, new CouncilEvent.TurnCancelled());
        return true;
    }

    public boolean isCancelled(String runId) {
        StreamRun run = runs.get(runId);
        return run != null && run.cancelled();
    }

    /**
     * The folded state of the conversation's latest streamed turn, if any.
     */
    public Optional<TurnState> liveState(String conversationId) {
        ConversationLiveState state = liveStates.get(conversationId);
        return state == null ? Optional.empty() : state.current();
    }

    private void append(StreamRun run, CouncilEvent event) {
        StreamEvent streamEvent = run.addEvent(event, MAX_BUFFER_SIZE);
        if (streamEvent == null) {
            log.debug("Dropping {} for finished run {}", event.type(), run.runId());
            return;
        }
        if (run.conversationId() != null) {
            ConversationLiveState state = liveStates.get(run.conversationId());
            if (state != null) {
                state.apply(run.runId(), event);
            }
        }
        run.sessions().values().forEach(session -> send(session, streamEvent));
        if (event.terminal()) {
            if (run.conversationId() != null) {
                activeRunByConversation.remove(run.conversationId(), run.runId());
            }
            pruneIfComplete(run);
        }
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to send stream event: {}", ex.getMessage());
        }
    }

    private void pruneIfComplete(StreamRun run) {
        if (!run.completed() || !run.sessions().isEmpty()) {
            return;
        }
        long cutoff = System.currentTimeMillis() - CLEANUP_TTL_MS;
        if (run.lastUpdated().toEpochMilli() < cutoff) {
            runs.remove(run.runId());
        }
    }

    private void cleanupExpiredRuns() {
        long cutoff = System.currentTimeMillis() - CLEANUP_TTL_MS;
        runs.values().removeIf(run -> run.completed()
                && run.sessions().isEmpty()
                && run.lastUpdated().toEpochMilli() < cutoff);
    }
}
