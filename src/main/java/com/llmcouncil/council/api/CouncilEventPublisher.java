package com.llmcouncil.council.api;

import com.llmcouncil.council.event.CouncilEvent;
import org.springframework.lang.Nullable;

/**
 * Delivers turn progress to whoever is watching the run. A {@code null} run id means the turn
 * runs synchronously and nobody is listening.
 */
public interface CouncilEventPublisher {

    /**
     * Publishes an event for the given run. Implementations drop events for unknown or
     * cancelled runs.
     */
    void publish(@Nullable String runId, CouncilEvent event);

    /**
     * Checks if the run was cancelled by its consumer or superseded by a newer turn.
     */
    boolean isCancelled(@Nullable String runId);
}
