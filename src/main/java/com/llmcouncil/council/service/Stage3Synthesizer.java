package com.llmcouncil.council.service;

import static com.llmcouncil.council.CouncilConstants.NO_RANKINGS_PLACEHOLDER;
import static com.llmcouncil.council.CouncilConstants.PURPOSE_STAGE3;
import static com.llmcouncil.council.CouncilConstants.STAGE3_CHAIRMAN_PROMPT;
import static com.llmcouncil.council.CouncilConstants.SYNTHESIS_FAILED_MESSAGE;

import com.llmcouncil.config.CouncilProperties;
import com.llmcouncil.council.TurnContext;
import com.llmcouncil.council.api.CouncilEventPublisher;
import com.llmcouncil.council.model.AggregateEntry;
import com.llmcouncil.council.model.FinalAnswer;
import com.llmcouncil.council.model.LabelMapping;
import com.llmcouncil.council.model.ModelReply;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Stage 3: the chairman writes the final answer from the Stage 1 answers and the peer review.
 * Runs even when no ranking could be used.
 */
@Service
@Slf4j
public class Stage3Synthesizer {

    private final FanOutCollector fanOutCollector;
    private final AnonymizationService anonymizationService;
    private final CouncilEventPublisher eventPublisher;
    private final CouncilMetricsService metricsService;
    private final CouncilProperties properties;

    public Stage3Synthesizer(FanOutCollector fanOutCollector,
                             AnonymizationService anonymizationService,
                             CouncilEventPublisher eventPublisher,
                             CouncilMetricsService metricsService,
                             CouncilProperties properties) {
        this.fanOutCollector = fanOutCollector;
        this.anonymizationService = anonymizationService;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    public FinalAnswer synthesize(TurnContext turn, List<Stage1Answer> stage1, Stage2Result stage2, LabelMapping mapping) {
        String chairman = turn.config().chairmanModel();
        String prompt = buildChairmanPrompt(turn.question(), stage1, stage2, mapping);
        ModelReply reply = fanOutCollector.await(
                fanOutCollector.dispatch(PURPOSE_STAGE3, chairman, turn.prompt().withQuestion(prompt),
                        turn.config(), properties.getModelTimeout()),
                () -> eventPublisher.isCancelled(turn.runId()),
                turn.runId());
        if (reply.failed()) {
            metricsService.recordModelFailure(PURPOSE_STAGE3, chairman, reply.failureReason());
            return new FinalAnswer(chairman, SYNTHESIS_FAILED_MESSAGE);
        }
        return new FinalAnswer(chairman, reply.content());
    }

    String buildChairmanPrompt(String question, List<Stage1Answer> stage1, Stage2Result stage2, LabelMapping mapping) {
        String answers = stage1.stream()
                .map(answer -> "Model: " + answer.model() + "\nResponse: " + answer.response())
                .collect(Collectors.joining("\n\n"));
        String rankings = stage2.critiques().isEmpty()
                ? NO_RANKINGS_PLACEHOLDER
                : stage2.critiques().stream()
                .map(critique -> "Model: " + critique.model() + "\nRanking: "
                        + anonymizationService.deAnonymize(critique.ranking(), mapping))
                .collect(Collectors.joining("\n\n"));
        return STAGE3_CHAIRMAN_PROMPT.formatted(question, answers, rankings, formatLeaderboard(stage2.aggregateRankings()));
    }

    private String formatLeaderboard(List<AggregateEntry> leaderboard) {
        if (leaderboard.isEmpty()) {
            return NO_RANKINGS_PLACEHOLDER;
        }
        StringBuilder out = new StringBuilder();
        for (int index = 0; index < leaderboard.size(); index++) {
            AggregateEntry entry = leaderboard.get(index);
            out.append(index + 1).append(". ").append(entry.model())
                    .append(String.format(Locale.ROOT, " (average rank %.2f across %d rankings)",
                            entry.averageRank(), entry.rankingsCount()))
                    .append('\n');
        }
        return out.toString().trim();
    }
}
