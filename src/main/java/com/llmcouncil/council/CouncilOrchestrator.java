package com.llmcouncil.council;

import com.llmcouncil.client.TurnStatus;
import com.llmcouncil.config.CouncilConfig;
import com.llmcouncil.config.CouncilConfigService;
import com.llmcouncil.conversation.ConversationStore;
import com.llmcouncil.council.api.CouncilEventPublisher;
import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.AnonymizedStage1;
import com.llmcouncil.council.model.CouncilMetadata;
import com.llmcouncil.council.model.CouncilResult;
import com.llmcouncil.council.model.FinalAnswer;
import com.llmcouncil.council.model.HistoryEntry;
import com.llmcouncil.council.model.ImageAttachment;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Critique;
import com.llmcouncil.council.model.Stage2Result;
import com.llmcouncil.council.model.TurnPrompt;
import com.llmcouncil.council.service.AnonymizationService;
import com.llmcouncil.council.service.CouncilMetricsService;
import com.llmcouncil.council.service.Stage1Collector;
import com.llmcouncil.council.service.Stage2Collector;
import com.llmcouncil.council.service.Stage3Synthesizer;
import com.llmcouncil.council.service.TitleGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Runs one council turn: individual answers, anonymous peer review, chairman synthesis.
 * Every step is reported through the {@link CouncilEventPublisher}; with a {@code null} run id
 * the turn runs silently and only the returned result matters.
 */
@Service
@Slf4j
public class CouncilOrchestrator {

    private final CouncilConfigService configService;
    private final ConversationStore conversationStore;
    private final Stage1Collector stage1Collector;
    private final AnonymizationService anonymizationService;
    private final Stage2Collector stage2Collector;
    private final Stage3Synthesizer stage3Synthesizer;
    private final TitleGenerator titleGenerator;
    private final CouncilEventPublisher eventPublisher;
    private final CouncilMetricsService metricsService;

    public CouncilOrchestrator(CouncilConfigService configService,
                               ConversationStore conversationStore,
                               Stage1Collector stage1Collector,
                               AnonymizationService anonymizationService,
                               Stage2Collector stage2Collector,
                               Stage3Synthesizer stage3Synthesizer,
                               TitleGenerator titleGenerator,
                               CouncilEventPublisher eventPublisher,
                               CouncilMetricsService metricsService) {
        this.configService = configService;
        this.conversationStore = conversationStore;
        this.stage1Collector = stage1Collector;
        this.anonymizationService = anonymizationService;
        this.stage2Collector = stage2Collector;
        this.stage3Synthesizer = stage3Synthesizer;
        this.titleGenerator = titleGenerator;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Runs a turn for an existing conversation.
     *
     * @throws CouncilPipelineException when the turn fails as a whole, after the
     *                                  {@code error} event was published and the turn stored
     * @throws TurnCancelledException   when the run was cancelled or superseded
     */
    public CouncilResult runTurn(String conversationId, @Nullable String runId, String question,
                                 List<ImageAttachment> images) {
        // one snapshot for the whole turn; later config updates are not observed
        CouncilConfig config = configService.currentCouncilConfig();
        metricsService.recordTurnStarted();

        List<HistoryEntry> history = conversationStore.history(conversationId);
        boolean firstMessage = conversationStore.turnCount(conversationId) == 0;
        String turnId = conversationStore.appendTurn(conversationId, question, images);
        TurnContext turn = new TurnContext(runId, config, new TurnPrompt(history, question, images));
        TurnRun run = new TurnRun();
        CompletableFuture<String> title = null;

        try {
            validate(config);
            if (firstMessage) {
                title = titleGenerator.start(question, config);
            }
            log.info("Turn {} started in conversation {} with {} council models.",
                    turnId, conversationId, config.councilModels().size());

            run.advance(TurnStage.STAGE1_RUNNING);
            eventPublisher.publish(runId, new CouncilEvent.Stage1Start(config.councilModels()));
            run.stage1 = stage1Collector.collect(turn);
            if (run.stage1.isEmpty()) {
                // ranking and synthesis still run on the empty label map
                log.warn("Turn {}: no council model answered in Stage 1.", turnId);
            }
            checkCancelled(runId);

            run.advance(TurnStage.STAGE2_RUNNING);
            AnonymizedStage1 anonymized = anonymizationService.anonymize(run.stage1);
            run.metadata = CouncilMetadata.labelsOnly(anonymized.labelMapping());
            eventPublisher.publish(runId, new CouncilEvent.Stage2Start(config.councilModels(), run.metadata));
            Stage2Result stage2 = stage2Collector.collect(turn, anonymized);
            run.stage2 = stage2.critiques();
            run.metadata = new CouncilMetadata(anonymized.labelMapping(), stage2.aggregateRankings());
            checkCancelled(runId);

            run.advance(TurnStage.STAGE3_RUNNING);
            eventPublisher.publish(runId, new CouncilEvent.Stage3Start());
            FinalAnswer answer = stage3Synthesizer.synthesize(turn, run.stage1, stage2, anonymized.labelMapping());
            checkCancelled(runId);
            eventPublisher.publish(runId, new CouncilEvent.Stage3Complete(answer));

            CouncilResult result = new CouncilResult(run.stage1, run.stage2, answer, run.metadata);
            conversationStore.completeTurn(turnId, result);
            if (title != null) {
                String generated = awaitTitle(title);
                conversationStore.updateTitle(conversationId, generated);
                eventPublisher.publish(runId, new CouncilEvent.TitleComplete(generated));
            }
            run.advance(TurnStage.COMPLETE);
            eventPublisher.publish(runId, new CouncilEvent.TurnComplete());
            log.info("Turn {} complete. Chairman {} answered.", turnId, answer.model());
            return result;
        } catch (TurnCancelledException ex) {
            run.abort();
            cancelTitle(title);
            log.info("Turn {} cancelled during {}.", turnId, run.stageBeforeAbort);
            recordAbort(turnId, TurnStatus.CANCELLED, run, null);
            throw ex;
        } catch (RuntimeException ex) {
            run.abort();
            cancelTitle(title);
            CouncilPipelineException failure = ex instanceof CouncilPipelineException pipeline
                    ? pipeline
                    : new CouncilPipelineException("Council run failed: " + ex.getMessage(), ex);
            log.error("Turn {} aborted during {}: {}", turnId, run.stageBeforeAbort, failure.getMessage(), ex);
            eventPublisher.publish(runId, new CouncilEvent.TurnError(failure.getMessage()));
            recordAbort(turnId, TurnStatus.FAILED, run, failure.getMessage());
            throw failure;
        } finally {
            metricsService.logSummary();
        }
    }

    private void validate(CouncilConfig config) {
        try {
            config.validate();
        } catch (IllegalArgumentException ex) {
            throw new CouncilPipelineException("Invalid council configuration: " + ex.getMessage(), ex);
        }
    }

    private void recordAbort(String turnId, TurnStatus status, TurnRun run, @Nullable String error) {
        try {
            conversationStore.abortTurn(turnId, status, run.stage1, run.stage2, run.metadata, error);
        } catch (RuntimeException ex) {
            // the turn outcome has already been decided; keep the original failure
            log.warn("Failed to record turn {} as {}: {}", turnId, status, ex.getMessage(), ex);
        }
    }

    private void checkCancelled(@Nullable String runId) {
        if (eventPublisher.isCancelled(runId)) {
            throw new TurnCancelledException(runId);
        }
    }

    private String awaitTitle(CompletableFuture<String> title) {
        try {
            return title.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CouncilPipelineException("Interrupted while waiting for the conversation title", ex);
        } catch (ExecutionException ex) {
            throw new CouncilPipelineException("Title generation failed", ex.getCause());
        }
    }

    private void cancelTitle(@Nullable CompletableFuture<String> title) {
        if (title != null) {
            title.cancel(true);
        }
    }

    private static final class TurnRun {
        private TurnStage stage = TurnStage.IDLE;
        private TurnStage stageBeforeAbort = TurnStage.IDLE;
        private List<Stage1Answer> stage1 = List.of();
        private List<Stage2Critique> stage2 = List.of();
        private CouncilMetadata metadata;

        void advance(TurnStage next) {
            stage = stage.advanceTo(next);
        }

        void abort() {
            stageBeforeAbort = stage;
            if (!stage.terminal()) {
                stage = stage.advanceTo(TurnStage.ABORTED);
            }
        }
    }
}
