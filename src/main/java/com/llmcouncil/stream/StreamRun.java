package com.llmcouncil.stream;

import com.llmcouncil.council.event.CouncilEvent;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

class StreamRun {
    private final String runId;
    private final String conversationId;
    private final AtomicLong sequence = new AtomicLong();
    private final List<StreamEvent> buffer = new ArrayList<>();
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    private boolean completed;
    private volatile boolean cancelled;
    private volatile Instant lastUpdated = Instant.now();

    StreamRun(String runId, @Nullable String conversationId) {
        this.runId = runId;
        this.conversationId = conversationId;
    }

    String runId() {
        return runId;
    }

    @Nullable
    String conversationId() {
        return conversationId;
    }

    Map<String, WebSocketSession> sessions() {
        return sessions;
    }

    /**
     * Buffers the event unless the run already ended. Terminal events close the run, so
     * nothing can be appended after them.
     *
     * @return the buffered event, or {@code null} when the run had already ended
     */
    @Nullable
    synchronized StreamEvent addEvent(CouncilEvent event, int maxBufferSize) {
        if (completed) {
            return null;
        }
        StreamEvent streamEvent = new StreamEvent(sequence.incrementAndGet(), Instant.now(), event.type(), event);
        buffer.add(streamEvent);
        if (buffer.size() > maxBufferSize) {
            buffer.remove(0);
        }
        if (event.terminal()) {
            completed = true;
        }
        lastUpdated = Instant.now();
        return streamEvent;
    }

    synchronized List<StreamEvent> snapshotSince(long sinceId) {
        return buffer.stream()
                .filter(event -> event.id() > sinceId)
                .toList();
    }

    synchronized boolean completed() {
        return completed;
    }

    boolean cancelled() {
        return cancelled;
    }

    void markCancelled() {
        cancelled = true;
        lastUpdated = Instant.now();
    }

    Instant lastUpdated() {
        return lastUpdated;
    }
}
