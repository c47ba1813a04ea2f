package com.llmcouncil.council.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One model's peer review. An empty {@code parsedRanking} marks the critique as unparsed: it is
 * still shown but takes no part in aggregation.
 */
public record Stage2Critique(
        @JsonProperty("model") String model,
        @JsonProperty("ranking") String ranking,
        @JsonProperty("parsed_ranking") List<String> parsedRanking
) {

    public Stage2Critique {
        parsedRanking = parsedRanking == null ? List.of() : List.copyOf(parsedRanking);
    }

    @JsonIgnore
    public boolean isParsed() {
        return !parsedRanking.isEmpty();
    }
}
