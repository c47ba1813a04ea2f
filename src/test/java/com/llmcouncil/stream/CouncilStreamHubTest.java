package com.llmcouncil.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.llmcouncil.client.TurnState;
import com.llmcouncil.client.TurnStatus;
import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.Stage1Answer;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.HashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CouncilStreamHubTest {

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();
    private final CouncilStreamHub hub = new CouncilStreamHub(objectMapper);

    private WebSocketSession openSession(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        when(session.getAttributes()).thenReturn(new HashMap<>());
        return session;
    }

    @Test
    void testEmitFeedsLiveState() {
        String runId = hub.createRun("c1");
        hub.emit(runId, new CouncilEvent.Stage1Start(List.of("m1", "m2")));
        hub.emit(runId, CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "hi")));

        TurnState state = hub.liveState("c1").orElseThrow();
        assertEquals(runId, state.turnId());
        assertEquals(List.of("m2"), List.copyOf(state.stage1().pending()));
        assertTrue(hub.liveState("other").isEmpty());
    }

    @Test
    void testNewRunSupersedesPreviousRunOfConversation() {
        String first = hub.createRun("c1");
        hub.emit(first, new CouncilEvent.Stage1Start(List.of("m1")));

        String second = hub.createRun("c1");
        assertTrue(hub.isCancelled(first));
        assertFalse(hub.isCancelled(second));

        hub.emit(first, CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "late")));
        hub.emit(second, new CouncilEvent.Stage1Start(List.of("m2")));

        TurnState state = hub.liveState("c1").orElseThrow();
        assertEquals(second, state.turnId());
        assertTrue(state.stage1().entries().isEmpty());
        assertEquals(TurnStatus.RUNNING, state.status());
    }

    @Test
    void testReplaysBufferedEventsSinceId() throws Exception {
        String runId = hub.createRun("c1");
        hub.emit(runId, new CouncilEvent.Stage1Start(List.of("m1")));
        hub.emit(runId, CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "hi")));
        hub.emit(runId, new CouncilEvent.Stage1Complete(List.of(new Stage1Answer("m1", "hi"))));

        WebSocketSession session = openSession("s1");
        hub.registerSession(runId, session, 1);

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(2)).sendMessage(sent.capture());
        assertTrue(sent.getAllValues().get(0).getPayload().contains("\"type\":\"stage1_response\""));
        assertTrue(sent.getAllValues().get(1).getPayload().contains("\"id\":3"));
    }

    @Test
    void testNothingAfterTerminalEvent() throws Exception {
        String runId = hub.createRun("c1");
        WebSocketSession session = openSession("s1");
        hub.registerSession(runId, session, 0);

        hub.emit(runId, new CouncilEvent.TurnError("boom"));
        hub.emit(runId, new CouncilEvent.Stage3Start());
        hub.emit(runId, new CouncilEvent.TurnComplete());

        verify(session, times(1)).sendMessage(any(TextMessage.class));
        assertFalse(hub.cancelRun(runId));
        assertEquals(TurnStatus.FAILED, hub.liveState("c1").orElseThrow().status());
    }

    @Test
    void testCancelRun() throws Exception {
        String runId = hub.createRun("c1");
        WebSocketSession session = openSession("s1");
        hub.registerSession(runId, session, 0);

        assertTrue(hub.cancelRun(runId));
        assertFalse(hub.cancelRun(runId));
        hub.emit(runId, new CouncilEvent.Stage1Start(List.of("m1")));

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(1)).sendMessage(sent.capture());
        assertTrue(sent.getValue().getPayload().contains("\"type\":\"cancelled\""));
        assertEquals(TurnStatus.CANCELLED, hub.liveState("c1").orElseThrow().status());
        assertFalse(hub.cancelRun("unknown"));
    }

    @Test
    void testUnknownRunClosesSession() throws Exception {
        WebSocketSession session = openSession("s1");
        hub.registerSession("missing", session, 0);
        verify(session).close();
    }
}
