package com.llmcouncil.council.service;

import static com.llmcouncil.council.CouncilConstants.PURPOSE_STAGE2;
import static com.llmcouncil.council.CouncilConstants.STAGE2_RANKING_PROMPT;

import com.llmcouncil.config.CouncilProperties;
import com.llmcouncil.council.TurnContext;
import com.llmcouncil.council.api.CouncilEventPublisher;
import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.AggregateEntry;
import com.llmcouncil.council.model.AnonymizedAnswer;
import com.llmcouncil.council.model.AnonymizedStage1;
import com.llmcouncil.council.model.CouncilMetadata;
import com.llmcouncil.council.model.LabelMapping;
import com.llmcouncil.council.model.ModelReply;
import com.llmcouncil.council.model.Stage2Critique;
import com.llmcouncil.council.model.Stage2Result;
import com.llmcouncil.council.model.TurnPrompt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Stage 2: every council member ranks the anonymized Stage 1 answers, its own included.
 */
@Service
@Slf4j
public class Stage2Collector {

    private final FanOutCollector fanOutCollector;
    private final RankingParser rankingParser;
    private final RankingAggregator rankingAggregator;
    private final CouncilEventPublisher eventPublisher;
    private final CouncilMetricsService metricsService;
    private final CouncilProperties properties;

    public Stage2Collector(FanOutCollector fanOutCollector,
                           RankingParser rankingParser,
                           RankingAggregator rankingAggregator,
                           CouncilEventPublisher eventPublisher,
                           CouncilMetricsService metricsService,
                           CouncilProperties properties) {
        this.fanOutCollector = fanOutCollector;
        this.rankingParser = rankingParser;
        this.rankingAggregator = rankingAggregator;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    public Stage2Result collect(TurnContext turn, AnonymizedStage1 anonymized) {
        List<String> models = turn.config().councilModels();
        LabelMapping mapping = anonymized.labelMapping();
        TurnPrompt rankingPrompt = turn.prompt().withQuestion(buildRankingPrompt(turn.question(), anonymized));
        Map<String, Stage2Critique> critiquesByModel = new HashMap<>();

        Map<String, ModelReply> replies = fanOutCollector.collect(PURPOSE_STAGE2, models,
                model -> rankingPrompt,
                turn.config(),
                properties.getModelTimeout(),
                reply -> {
                    if (reply.failed()) {
                        eventPublisher.publish(turn.runId(), CouncilEvent.Stage2Response.failure(reply.model()));
                        return;
                    }
                    Stage2Critique critique = toCritique(reply, mapping);
                    critiquesByModel.put(reply.model(), critique);
                    log.info("Stage 2: {} ranked {} labels.", reply.model(), critique.parsedRanking().size());
                    eventPublisher.publish(turn.runId(), CouncilEvent.Stage2Response.of(critique));
                },
                () -> eventPublisher.isCancelled(turn.runId()),
                turn.runId());

        List<Stage2Critique> critiques = new ArrayList<>(models.size());
        for (String model : models) {
            Stage2Critique critique = critiquesByModel.get(model);
            if (critique != null) {
                critiques.add(critique);
            }
        }
        List<AggregateEntry> aggregate = rankingAggregator.aggregate(critiques, mapping);
        metricsService.recordStage("Stage 2", models.size(), (int) replies.values().stream()
                .filter(reply -> !reply.failed())
                .count());
        eventPublisher.publish(turn.runId(), new CouncilEvent.Stage2Complete(critiques,
                new CouncilMetadata(mapping, aggregate)));
        return new Stage2Result(critiques, aggregate);
    }

    String buildRankingPrompt(String question, AnonymizedStage1 anonymized) {
        String responses = anonymized.answers().stream()
                .map(this::formatAnswer)
                .collect(Collectors.joining("\n\n"));
        return STAGE2_RANKING_PROMPT.formatted(question, responses);
    }

    private String formatAnswer(AnonymizedAnswer answer) {
        return answer.label() + ":\n" + answer.response();
    }

    private Stage2Critique toCritique(ModelReply reply, LabelMapping mapping) {
        List<String> parsed = rankingParser.parse(reply.content(), mapping);
        if (parsed.isEmpty()) {
            metricsService.recordUnparsedRanking(reply.model());
        }
        return new Stage2Critique(reply.model(), reply.content(), parsed);
    }
}
