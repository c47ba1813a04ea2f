package com.llmcouncil.client;

import com.llmcouncil.council.event.CouncilEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of one turn's events. The visible state is always the replay of the log.
 */
public class TurnEventLog {

    private final String turnId;
    private final List<CouncilEvent> events = new ArrayList<>();
    private TurnState state;

    public TurnEventLog(String turnId) {
        this.turnId = turnId;
        this.state = TurnState.initial(turnId);
    }

    public String turnId() {
        return turnId;
    }

    public synchronized TurnState append(CouncilEvent event) {
        events.add(event);
        state = TurnStateReducer.reduce(state, event);
        return state;
    }

    public synchronized List<CouncilEvent> events() {
        return List.copyOf(events);
    }

    public synchronized TurnState state() {
        return state;
    }

    /**
     * Rebuilds the state from scratch; equal to {@link #state()} because the reducer is pure.
     */
    public synchronized TurnState replay() {
        return TurnStateReducer.replay(turnId, events);
    }
}
