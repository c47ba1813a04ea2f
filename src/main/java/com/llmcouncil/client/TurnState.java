package com.llmcouncil.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.llmcouncil.council.model.AggregateEntry;
import com.llmcouncil.council.model.FinalAnswer;
import com.llmcouncil.council.model.LabelMapping;
import com.llmcouncil.council.model.Stage1Answer;
import com.llmcouncil.council.model.Stage2Critique;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Everything a consumer shows for one turn, folded from its event sequence.
 */
public record TurnState(
        @JsonProperty("turn_id") String turnId,
        @JsonProperty("status") TurnStatus status,
        @JsonProperty("stage1") StageState<Stage1Answer> stage1,
        @JsonProperty("stage2") StageState<Stage2Critique> stage2,
        @JsonProperty("stage3_loading") boolean stage3Loading,
        @JsonProperty("stage3") @Nullable FinalAnswer stage3,
        @JsonProperty("label_to_model") LabelMapping labelToModel,
        @JsonProperty("aggregate_rankings") List<AggregateEntry> aggregateRankings,
        @JsonProperty("title") @Nullable String title,
        @JsonProperty("error") @Nullable String error
) {

    public TurnState {
        aggregateRankings = aggregateRankings == null ? List.of() : List.copyOf(aggregateRankings);
        labelToModel = labelToModel == null ? LabelMapping.empty() : labelToModel;
    }

    public static TurnState initial(String turnId) {
        return new TurnState(turnId, TurnStatus.RUNNING, StageState.notStarted(), StageState.notStarted(),
                false, null, LabelMapping.empty(), List.of(), null, null);
    }

    TurnState withStatus(TurnStatus next) {
        return new TurnState(turnId, next, stage1, stage2, stage3Loading, stage3, labelToModel,
                aggregateRankings, title, error);
    }

    TurnState withStage1(StageState<Stage1Answer> next) {
        return new TurnState(turnId, status, next, stage2, stage3Loading, stage3, labelToModel,
                aggregateRankings, title, error);
    }

    TurnState withStage2(StageState<Stage2Critique> next, LabelMapping labels, List<AggregateEntry> aggregate) {
        return new TurnState(turnId, status, stage1, next, stage3Loading, stage3, labels, aggregate, title, error);
    }

    TurnState withStage3(boolean loading, @Nullable FinalAnswer answer) {
        return new TurnState(turnId, status, stage1, stage2, loading, answer, labelToModel,
                aggregateRankings, title, error);
    }

    TurnState withTitle(String nextTitle) {
        return new TurnState(turnId, status, stage1, stage2, stage3Loading, stage3, labelToModel,
                aggregateRankings, nextTitle, error);
    }

    TurnState stopped(TurnStatus terminalStatus, @Nullable String message) {
        return new TurnState(turnId, terminalStatus, stage1.stopped(), stage2.stopped(), false, stage3,
                labelToModel, aggregateRankings, title, message);
    }
}
