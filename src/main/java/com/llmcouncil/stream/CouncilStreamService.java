package com.llmcouncil.stream;

import com.llmcouncil.client.TurnState;
import com.llmcouncil.council.api.CouncilEventPublisher;
import com.llmcouncil.council.event.CouncilEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Publishes council events to the stream hub. Synchronous turns carry no run id and publish
 * nothing.
 */
@Service
@RequiredArgsConstructor
public class CouncilStreamService implements CouncilEventPublisher {

    private final CouncilStreamHub hub;

    /**
     * Opens a run for a new turn of the conversation, superseding the conversation's
     * previous run.
     */
    public String createRun(String conversationId) {
        return hub.createRun(conversationId);
    }

    public boolean cancelRun(String runId) {
        return hub.cancelRun(runId);
    }

    public Optional<TurnState> liveState(String conversationId) {
        return hub.liveState(conversationId);
    }

    @Override
    public void publish(@Nullable String runId, CouncilEvent event) {
        if (runId == null) {
            return;
        }
        hub.emit(runId, event);
    }

    @Override
    public boolean isCancelled(@Nullable String runId) {
        return runId != null && hub.isCancelled(runId);
    }
}
