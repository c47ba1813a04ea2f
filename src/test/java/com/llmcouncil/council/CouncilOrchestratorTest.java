package com.llmcouncil.council;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmcouncil.client.TurnStatus;
import com.llmcouncil.config.CouncilConfigService;
import com.llmcouncil.config.CouncilConfigUpdate;
import com.llmcouncil.config.CouncilProperties;
import com.llmcouncil.conversation.ConversationStore;
import com.llmcouncil.council.api.CouncilEventPublisher;
import com.llmcouncil.council.api.ModelInvocationService;
import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.CouncilResult;
import com.llmcouncil.council.model.HistoryEntry;
import com.llmcouncil.council.model.ModelReply;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.TurnPrompt;
import com.llmcouncil.council.service.AnonymizationService;
import com.llmcouncil.council.service.CouncilMetricsService;
import com.llmcouncil.council.service.FanOutCollector;
import com.llmcouncil.council.service.RankingAggregator;
import com.llmcouncil.council.service.RankingParser;
import com.llmcouncil.council.service.Stage1Collector;
import com.llmcouncil.council.service.Stage2Collector;
import com.llmcouncil.council.service.Stage3Synthesizer;
import com.llmcouncil.council.service.TitleGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class CouncilOrchestratorTest {

    private static final List<String> COUNCIL = List.of("p/m1", "p/m2", "p/m3");

    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private final RecordingPublisher publisher = new RecordingPublisher();
    private final ConversationStore store = mock(ConversationStore.class);
    private final CouncilProperties properties = new CouncilProperties();
    private final List<TurnPrompt> stage1Prompts = new CopyOnWriteArrayList<>();
    private final List<TurnPrompt> stage2Prompts = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        properties.setModels(COUNCIL);
        properties.setChairmanModel("p/m1");
        properties.setTitleModel("p/title");
        properties.setModelReasoning(Map.of());
        properties.setModelTimeout(Duration.ofSeconds(2));
        properties.setTitleTimeout(Duration.ofSeconds(2));
        when(store.appendTurn(anyString(), anyString(), anyList())).thenReturn("turn-1");
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private CouncilOrchestrator orchestrator(CouncilConfigService configService, ModelInvocationService invoker) {
        CouncilMetricsService metrics = new CouncilMetricsService();
        FanOutCollector fanOut = new FanOutCollector(invoker, executor, metrics);
        AnonymizationService anonymization = new AnonymizationService();
        return new CouncilOrchestrator(configService, store,
                new Stage1Collector(fanOut, publisher, metrics, properties),
                anonymization,
                new Stage2Collector(fanOut, new RankingParser(), new RankingAggregator(), publisher, metrics, properties),
                new Stage3Synthesizer(fanOut, anonymization, publisher, metrics, properties),
                new TitleGenerator(fanOut, properties),
                publisher, metrics);
    }

    private CouncilOrchestrator orchestrator(ModelInvocationService invoker) {
        return orchestrator(new CouncilConfigService(properties, new ObjectMapper()), invoker);
    }

    /**
     * Answers each kind of prompt the way a cooperative model would.
     */
    private ModelReply cooperative(String model, TurnPrompt prompt) {
        String question = prompt.question();
        if (question.startsWith("Generate a very short title")) {
            return ModelReply.success(model, "\"Quantum Basics\"");
        }
        if (question.startsWith("You are the Chairman")) {
            return ModelReply.success(model, "Final synthesis");
        }
        if (question.startsWith("You are evaluating")) {
            stage2Prompts.add(prompt);
            return ModelReply.success(model, "Thoughts.\n\nFINAL RANKING:\n1. Response B\n2. Response A\n3. Response C");
        }
        stage1Prompts.add(prompt);
        return ModelReply.success(model, "answer from " + model);
    }

    private static boolean isStage2(TurnPrompt prompt) {
        return prompt.question().startsWith("You are evaluating");
    }

    @Test
    void testFullTurnEventOrder() {
        CouncilResult result = orchestrator((model, prompt, config) -> cooperative(model, prompt))
                .runTurn("c1", "run-1", "What is quantum computing?", List.of());

        assertEquals(List.of(
                "stage1_start", "stage1_response", "stage1_response", "stage1_response", "stage1_complete",
                "stage2_start", "stage2_response", "stage2_response", "stage2_response", "stage2_complete",
                "stage3_start", "stage3_complete", "title_complete", "complete"), publisher.types());

        assertEquals(List.of("p/m1", "p/m2", "p/m3"), result.stage1().stream().map(Stage1Answer::model).toList());
        assertEquals("p/m2", result.metadata().labelToModel().modelFor("Response B"));
        assertEquals("p/m2", result.metadata().aggregateRankings().get(0).model());
        assertEquals(1.0, result.metadata().aggregateRankings().get(0).averageRank());
        assertEquals(3, result.metadata().aggregateRankings().get(0).rankingsCount());
        assertEquals("p/m1", result.stage3().model());
        assertEquals("Final synthesis", result.stage3().response());

        verify(store).completeTurn("turn-1", result);
        verify(store).updateTitle("c1", "Quantum Basics");
        CouncilEvent.TitleComplete title = (CouncilEvent.TitleComplete) publisher.events.get(12);
        assertEquals("Quantum Basics", title.title());
    }

    @Test
    void testFollowUpSendsHistoryToStage1Only() {
        when(store.turnCount("c1")).thenReturn(1L);
        when(store.history("c1")).thenReturn(List.of(HistoryEntry.user("Hi"), HistoryEntry.assistant("Hello")));

        orchestrator((model, prompt, config) -> cooperative(model, prompt))
                .runTurn("c1", "run-1", "And then?", List.of());

        assertFalse(publisher.types().contains("title_complete"));
        verify(store, never()).updateTitle(anyString(), anyString());
        assertEquals(3, stage1Prompts.size());
        stage1Prompts.forEach(prompt -> assertEquals(2, prompt.history().size()));
        stage2Prompts.forEach(prompt -> assertTrue(prompt.history().isEmpty()));
    }

    @Test
    void testFailedModelIsIsolated() {
        CouncilResult result = orchestrator((model, prompt, config) -> {
            if ("p/m2".equals(model) && !isStage2(prompt)) {
                throw new IllegalStateException("provider down");
            }
            return cooperative(model, prompt);
        }).runTurn("c1", "run-1", "Question?", List.of());

        assertEquals(List.of("p/m1", "p/m3"), result.stage1().stream().map(Stage1Answer::model).toList());
        assertEquals(2, result.metadata().labelToModel().size());
        assertEquals("p/m3", result.metadata().labelToModel().modelFor("Response B"));
        assertTrue(publisher.events.stream().anyMatch(event ->
                event instanceof CouncilEvent.Stage1Response response && response.failed()
                        && "p/m2".equals(response.model())));
        assertEquals("complete", publisher.types().get(publisher.types().size() - 1));
    }

    @Test
    void testAllRankingsFailedStillSynthesizes() {
        CouncilResult result = orchestrator((model, prompt, config) -> {
            if (isStage2(prompt)) {
                return ModelReply.failure(model, "rate limited");
            }
            return cooperative(model, prompt);
        }).runTurn("c1", "run-1", "Question?", List.of());

        assertTrue(result.stage2().isEmpty());
        assertTrue(result.metadata().aggregateRankings().isEmpty());
        assertEquals("Final synthesis", result.stage3().response());
        assertTrue(publisher.types().contains("stage3_complete"));
    }

    @Test
    void testChairmanFailureStillCompletes() {
        CouncilResult result = orchestrator((model, prompt, config) -> {
            if (prompt.question().startsWith("You are the Chairman")) {
                throw new IllegalStateException("chairman unavailable");
            }
            return cooperative(model, prompt);
        }).runTurn("c1", "run-1", "Question?", List.of());

        assertEquals(CouncilConstants.SYNTHESIS_FAILED_MESSAGE, result.stage3().response());
        assertEquals("complete", publisher.types().get(publisher.types().size() - 1));
    }

    @Test
    void testEmptyCouncilIsPipelineError() {
        properties.setModels(List.of());
        AtomicBoolean invoked = new AtomicBoolean();

        CouncilOrchestrator orchestrator = orchestrator((model, prompt, config) -> {
            invoked.set(true);
            return cooperative(model, prompt);
        });
        assertThrows(CouncilPipelineException.class,
                () -> orchestrator.runTurn("c1", "run-1", "Question?", List.of()));

        assertEquals(List.of("error"), publisher.types());
        assertFalse(invoked.get());
        verify(store).abortTurn(eq("turn-1"), eq(TurnStatus.FAILED), anyList(), anyList(), any(), anyString());
    }

    @Test
    void testNoStage1AnswersStillRanksAndSynthesizes() {
        CouncilResult result = orchestrator((model, prompt, config) -> {
            String question = prompt.question();
            if (question.startsWith("Generate a very short title") || question.startsWith("You are the Chairman")) {
                return cooperative(model, prompt);
            }
            return ModelReply.failure(model, "down");
        }).runTurn("c1", "run-1", "Question?", List.of());

        assertTrue(result.stage1().isEmpty());
        assertEquals(0, result.metadata().labelToModel().size());
        assertTrue(result.metadata().aggregateRankings().isEmpty());
        assertEquals("Final synthesis", result.stage3().response());

        List<String> types = publisher.types();
        assertFalse(types.contains("error"));
        assertTrue(types.indexOf("stage1_complete") < types.indexOf("stage2_start"));
        assertTrue(types.indexOf("stage2_complete") < types.indexOf("stage3_complete"));
        assertEquals("complete", types.get(types.size() - 1));
        verify(store).completeTurn(eq("turn-1"), any());
        verify(store, never()).abortTurn(anyString(), any(), anyList(), anyList(), any(), any());
    }

    @Test
    void testRunningTurnKeepsConfigSnapshot() {
        CouncilConfigService configService = new CouncilConfigService(properties, new ObjectMapper());
        AtomicBoolean updated = new AtomicBoolean();

        CouncilResult result = orchestrator(configService, (model, prompt, config) -> {
            if (updated.compareAndSet(false, true)) {
                configService.update(new CouncilConfigUpdate(List.of("p/x", "p/y"), "p/x", null, null));
            }
            return cooperative(model, prompt);
        }).runTurn("c1", "run-1", "Question?", List.of());

        assertEquals(List.of("p/x", "p/y"), configService.currentCouncilConfig().councilModels());
        CouncilEvent.Stage2Start stage2Start = publisher.events.stream()
                .filter(CouncilEvent.Stage2Start.class::isInstance)
                .map(CouncilEvent.Stage2Start.class::cast)
                .findFirst()
                .orElseThrow();
        assertEquals(COUNCIL, stage2Start.models());
        assertEquals("p/m1", result.stage3().model());
    }

    @Test
    void testCancelledTurnStopsWithoutTerminalEvent() {
        CouncilOrchestrator orchestrator = orchestrator((model, prompt, config) -> {
            publisher.cancelled = true;
            return cooperative(model, prompt);
        });

        assertThrows(TurnCancelledException.class,
                () -> orchestrator.runTurn("c1", "run-1", "Question?", List.of()));

        List<String> types = publisher.types();
        assertFalse(types.contains("stage2_start"));
        assertFalse(types.contains("complete"));
        assertFalse(types.contains("error"));
        verify(store).abortTurn(eq("turn-1"), eq(TurnStatus.CANCELLED), anyList(), anyList(), any(), isNull());
    }

    @Test
    void testSynchronousTurnPublishesNothing() {
        CouncilResult result = orchestrator((model, prompt, config) -> cooperative(model, prompt))
                .runTurn("c1", null, "Question?", List.of());

        assertEquals(3, result.stage1().size());
        assertTrue(publisher.types().isEmpty());
    }

    static class RecordingPublisher implements CouncilEventPublisher {
        final List<CouncilEvent> events = Collections.synchronizedList(new ArrayList<>());
        volatile boolean cancelled;

        @Override
        public void publish(@Nullable String runId, CouncilEvent event) {
            if (runId != null) {
                events.add(event);
            }
        }

        @Override
        public boolean isCancelled(@Nullable String runId) {
            return cancelled;
        }

        List<String> types() {
            synchronized (events) {
                return events.stream().map(CouncilEvent::type).toList();
            }
        }
    }
}
