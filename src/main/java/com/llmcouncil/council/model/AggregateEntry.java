package com.llmcouncil.council.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AggregateEntry(
        @JsonProperty("model") String model,
        @JsonProperty("average_rank") double averageRank,
        @JsonProperty("rankings_count") int rankingsCount
) {
}
