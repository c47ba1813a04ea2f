package com.llmcouncil.client;

import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.AggregateEntry;
import com.llmcouncil.council.model.CouncilMetadata;
import com.llmcouncil.council.model.FinalAnswer;
import com.llmcouncil.council.model.LabelMapping;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Critique;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class TurnStateReducerTest {

    @Test
    void testPendingShrinksAndCompletionClearsIt() {
        TurnState state = TurnState.initial("t1");
        state = TurnStateReducer.reduce(state, new CouncilEvent.Stage1Start(List.of("m1", "m2")));
        assertEquals(List.of("m1", "m2"), List.copyOf(state.stage1().pending()));
        assertTrue(state.stage1().loading());

        state = TurnStateReducer.reduce(state, CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "hello")));
        assertEquals(List.of("m2"), List.copyOf(state.stage1().pending()));

        state = TurnStateReducer.reduce(state, CouncilEvent.Stage1Response.failure("m2"));
        assertTrue(state.stage1().pending().isEmpty());
        assertEquals(1, state.stage1().entries().size());

        state = TurnStateReducer.reduce(state, new CouncilEvent.Stage1Complete(List.of(new Stage1Answer("m1", "hello"))));
        assertTrue(state.stage1().pending().isEmpty());
        assertFalse(state.stage1().loading());
        assertEquals(List.of(new Stage1Answer("m1", "hello")), state.stage1().values());
    }

    @Test
    void testDuplicateArrivalsKeepOneEntry() {
        TurnState state = TurnStateReducer.replay("t1", List.of(
                new CouncilEvent.Stage1Start(List.of("m1", "m2")),
                CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "first")),
                CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "again"))));

        assertEquals(1, state.stage1().entries().size());
        assertEquals("first", state.stage1().entries().get("m1").response());
        assertEquals(List.of("m2"), List.copyOf(state.stage1().pending()));
    }

    @Test
    void testConvergesToCompletionPayloadForAnyInterleaving() {
        List<String> models = List.of("m1", "m2", "m3", "m4");
        List<Stage1Answer> authoritative = List.of(
                new Stage1Answer("m1", "a1"), new Stage1Answer("m3", "a3"), new Stage1Answer("m4", "a4"));
        Random random = new Random(42);

        for (int round = 0; round < 50; round++) {
            List<CouncilEvent> arrivals = new ArrayList<>();
            arrivals.add(CouncilEvent.Stage1Response.failure("m2"));
            for (Stage1Answer answer : authoritative) {
                arrivals.add(CouncilEvent.Stage1Response.of(answer));
                if (random.nextBoolean()) {
                    arrivals.add(CouncilEvent.Stage1Response.of(new Stage1Answer(answer.model(), "stale")));
                }
            }
            Collections.shuffle(arrivals, random);
            List<CouncilEvent> events = new ArrayList<>();
            events.add(new CouncilEvent.Stage1Start(models));
            events.addAll(arrivals);
            events.add(new CouncilEvent.Stage1Complete(authoritative));

            TurnState state = TurnStateReducer.replay("t" + round, events);
            assertEquals(authoritative, state.stage1().values());
            assertTrue(state.stage1().pending().isEmpty());
        }
    }

    @Test
    void testFullTurn() {
        LabelMapping labels = new LabelMapping(Map.of("Response A", "m1"));
        Stage2Critique critique = new Stage2Critique("m1", "FINAL RANKING:\n1. Response A", List.of("Response A"));
        List<AggregateEntry> aggregate = List.of(new AggregateEntry("m1", 1.0, 1));
        FinalAnswer answer = new FinalAnswer("m1", "final");

        TurnState state = TurnStateReducer.replay("t1", List.of(
                new CouncilEvent.Stage1Start(List.of("m1")),
                CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "a1")),
                new CouncilEvent.Stage1Complete(List.of(new Stage1Answer("m1", "a1"))),
                new CouncilEvent.Stage2Start(List.of("m1"), CouncilMetadata.labelsOnly(labels)),
                CouncilEvent.Stage2Response.of(critique),
                new CouncilEvent.Stage2Complete(List.of(critique), new CouncilMetadata(labels, aggregate)),
                new CouncilEvent.Stage3Start(),
                new CouncilEvent.Stage3Complete(answer),
                new CouncilEvent.TitleComplete("A title"),
                new CouncilEvent.TurnComplete()));

        assertEquals(TurnStatus.COMPLETE, state.status());
        assertEquals(labels, state.labelToModel());
        assertEquals(aggregate, state.aggregateRankings());
        assertEquals(List.of(critique), state.stage2().values());
        assertEquals(answer, state.stage3());
        assertFalse(state.stage3Loading());
        assertEquals("A title", state.title());
    }

    @Test
    void testErrorKeepsStreamedOutput() {
        TurnState state = TurnStateReducer.replay("t1", List.of(
                new CouncilEvent.Stage1Start(List.of("m1", "m2")),
                CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "partial")),
                new CouncilEvent.TurnError("boom")));

        assertEquals(TurnStatus.FAILED, state.status());
        assertEquals("boom", state.error());
        assertFalse(state.stage1().loading());
        assertEquals("partial", state.stage1().entries().get("m1").response());
    }

    @Test
    void testIgnoresEventsAfterTerminal() {
        TurnState state = TurnStateReducer.replay("t1", List.of(
                new CouncilEvent.Stage1Start(List.of("m1")),
                new CouncilEvent.TurnCancelled(),
                CouncilEvent.Stage1Response.of(new Stage1Answer("m1", "late"))));

        assertEquals(TurnStatus.CANCELLED, state.status());
        assertTrue(state.stage1().entries().isEmpty());
    }

    @Test
    void testEventLogReplayMatchesState() {
        TurnEventLog log = new TurnEventLog("t1");
        log.append(new CouncilEvent.Stage1Start(List.of("m1", "m2")));
        log.append(CouncilEvent.Stage1Response.of(new Stage1Answer("m2", "b")));
        log.append(CouncilEvent.Stage1Response.failure("m1"));

        assertEquals(3, log.events().size());
        assertEquals(log.state(), log.replay());
    }
}
