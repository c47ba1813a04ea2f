package com.llmcouncil.client;

import com.llmcouncil.council.event.CouncilEvent;
import com.llmcouncil.council.model.AggregateEntry;
import com.llmcouncil.council.model.LabelMapping;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Critique;

import java.util.List;

/**
 * Pure fold of council events into {@link TurnState}.
 *
 * <p>Arrival events are idempotent per model and stage. Completion events replace the stage's
 * accumulated entries, so the state converges on the completion payload whatever arrivals were
 * lost, repeated or reordered before it. Once the turn is terminal further events are ignored.
 */
public final class TurnStateReducer {

    private TurnStateReducer() {
    }

    public static TurnState replay(String turnId, List<? extends CouncilEvent> events) {
        TurnState state = TurnState.initial(turnId);
        for (CouncilEvent event : events) {
            state = reduce(state, event);
        }
        return state;
    }

    public static TurnState reduce(TurnState state, CouncilEvent event) {
        if (event == null || state.status().terminal()) {
            return state;
        }
        if (event instanceof CouncilEvent.Stage1Start start) {
            return state.withStage1(state.stage1().started(start.models()));
        }
        if (event instanceof CouncilEvent.Stage1Response response) {
            Stage1Answer answer = response.failed() ? null : new Stage1Answer(response.model(), response.response());
            return state.withStage1(state.stage1().arrived(response.model(), answer));
        }
        if (event instanceof CouncilEvent.Stage1Complete complete) {
            return state.withStage1(state.stage1().completed(complete.data(), Stage1Answer::model));
        }
        if (event instanceof CouncilEvent.Stage2Start start) {
            LabelMapping labels = start.metadata() != null && start.metadata().labelToModel() != null
                    ? start.metadata().labelToModel()
                    : state.labelToModel();
            return state.withStage2(state.stage2().started(start.models()), labels, List.of());
        }
        if (event instanceof CouncilEvent.Stage2Response response) {
            Stage2Critique critique = response.failed()
                    ? null
                    : new Stage2Critique(response.model(), response.ranking(), response.parsedRanking());
            return state.withStage2(state.stage2().arrived(response.model(), critique),
                    state.labelToModel(), state.aggregateRankings());
        }
        if (event instanceof CouncilEvent.Stage2Complete complete) {
            LabelMapping labels = state.labelToModel();
            List<AggregateEntry> aggregate = List.of();
            if (complete.metadata() != null) {
                if (complete.metadata().labelToModel() != null) {
                    labels = complete.metadata().labelToModel();
                }
                if (complete.metadata().aggregateRankings() != null) {
                    aggregate = complete.metadata().aggregateRankings();
                }
            }
            return state.withStage2(state.stage2().completed(complete.data(), Stage2Critique::model), labels, aggregate);
        }
        if (event instanceof CouncilEvent.Stage3Start) {
            return state.withStage3(true, null);
        }
        if (event instanceof CouncilEvent.Stage3Complete complete) {
            return state.withStage3(false, complete.data());
        }
        if (event instanceof CouncilEvent.TitleComplete title) {
            return state.withTitle(title.title());
        }
        if (event instanceof CouncilEvent.TurnComplete) {
            return state.stopped(TurnStatus.COMPLETE, null);
        }
        if (event instanceof CouncilEvent.TurnError error) {
            return state.stopped(TurnStatus.FAILED, error.message());
        }
        if (event instanceof CouncilEvent.TurnCancelled) {
            return state.stopped(TurnStatus.CANCELLED, null);
        }
        return state;
    }
}
