package com.llmcouncil.council.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CouncilMetadata(
        @JsonProperty("label_to_model") LabelMapping labelToModel,
        @JsonProperty("aggregate_rankings") List<AggregateEntry> aggregateRankings
) {

    public static CouncilMetadata labelsOnly(LabelMapping labelToModel) {
        return new CouncilMetadata(labelToModel, null);
    }
}
