package com.llmcouncil.client;

import com.llmcouncil.council.event.CouncilEvent;

import java.util.Optional;

/**
 * Tracks the one turn of a conversation that is allowed to change visible state. Starting a
 * new turn supersedes the previous one; late events for a superseded turn are dropped.
 */
public class ConversationLiveState {

    private TurnEventLog active;

    public synchronized void beginTurn(String turnId) {
        active = new TurnEventLog(turnId);
    }

    /**
     * @return true when the event belonged to the active turn and was applied
     */
    public synchronized boolean apply(String turnId, CouncilEvent event) {
        if (active == null || !active.turnId().equals(turnId)) {
            return false;
        }
        active.append(event);
        return true;
    }

    public synchronized Optional<String> activeTurnId() {
        return active == null ? Optional.empty() : Optional.of(active.turnId());
    }

    public synchronized Optional<TurnState> current() {
        return active == null ? Optional.empty() : Optional.of(active.state());
    }
}
