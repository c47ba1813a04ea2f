package com.llmcouncil.client;

import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.Stage1Answer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConversationLiveStateTest {

    @Test
    void testSupersededTurnCannotMutateNewTurn() {
        ConversationLiveState live = new ConversationLiveState();
        live.beginTurn("old");
        assertTrue(live.apply("old", new CouncilEvent.Stage1Start(List.of("m1"))));

        live.beginTurn("new");
        assertTrue(live.apply("new", new CouncilEvent.Stage1Start(List.of("m2"))));
        assertFalse(live.apply("old", CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "late"))));

        TurnState state = live.current().orElseThrow();
        assertEquals("new", state.turnId());
        assertTrue(state.stage1().entries().isEmpty());
        assertEquals(List.of("m2"), List.copyOf(state.stage1().pending()));
        assertEquals("new", live.activeTurnId().orElseThrow());
    }

    @Test
    void testNoTurnYet() {
        ConversationLiveState live = new ConversationLiveState();
        assertTrue(live.current().isEmpty());
        assertFalse(live.apply("t1", new CouncilEvent.Stage3Start()));
    }
}
