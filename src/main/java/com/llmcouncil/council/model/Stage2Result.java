package com.llmcouncil.council.model;

import java.util.List;

public record Stage2Result(
        List<Stage2Critique> critiques,
        List<AggregateEntry> aggregateRankings
) {

    public Stage2Result {
        critiques = List.copyOf(critiques);
        aggregateRankings = List.copyOf(aggregateRankings);
    }
}
