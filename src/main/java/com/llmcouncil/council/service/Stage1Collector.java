package com.llmcouncil.council.service;

import static com.llmcouncil.council.CouncilConstants.PURPOSE_STAGE1;

import com.llmcouncil.config.CouncilProperties;
import com.llmcouncil.council.TurnContext;
import com.llmcouncil.council.api.CouncilEventPublisher;
import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.ModelReply;
import com.llmcouncil.council.model.Stage1Answer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stage 1: every council member answers the question independently.
 */
@Service
@Slf4j
public class Stage1Collector {

    private final FanOutCollector fanOutCollector;
    private final CouncilEventPublisher eventPublisher;
    private final CouncilMetricsService metricsService;
    private final CouncilProperties properties;

    public Stage1Collector(FanOutCollector fanOutCollector,
                           CouncilEventPublisher eventPublisher,
                           CouncilMetricsService metricsService,
                           CouncilProperties properties) {
        this.fanOutCollector = fanOutCollector;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    /**
     * Publishes one arrival event per member as it settles, then the authoritative list of
     * successful answers in council order.
     */
    public List<Stage1Answer> collect(TurnContext turn) {
        List<String> models = turn.config().councilModels();
        Map<String, ModelReply> replies = fanOutCollector.collect(PURPOSE_STAGE1, models,
                model -> turn.prompt(),
                turn.config(),
                properties.getModelTimeout(),
                reply -> publishArrival(turn, reply),
                () -> eventPublisher.isCancelled(turn.runId()),
                turn.runId());

        List<Stage1Answer> answers = new ArrayList<>(models.size());
        for (String model : models) {
            ModelReply reply = replies.get(model);
            if (reply != null && !reply.failed()) {
                answers.add(new Stage1Answer(model, reply.content()));
            }
        }
        metricsService.recordStage("Stage 1", models.size(), answers.size());
        eventPublisher.publish(turn.runId(), new CouncilEvent.Stage1Complete(answers));
        return answers;
    }

    private void publishArrival(TurnContext turn, ModelReply reply) {
        if (reply.failed()) {
            eventPublisher.publish(turn.runId(), CouncilEvent.Stage1Response.failure(reply.model()));
            return;
        }
        log.info("Stage 1: {} responded.", reply.model());
        eventPublisher.publish(turn.runId(),
                CouncilEvent.Stage1Response.of(new Stage1Answer(reply.model(), reply.content())));
    }
}
