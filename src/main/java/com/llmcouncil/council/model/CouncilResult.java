package com.llmcouncil.council.model;

import java.util.List;

public record CouncilResult(
        List<Stage1Answer> stage1,
        List<Stage2Critique> stage2,
        FinalAnswer stage3,
        CouncilMetadata metadata
) {
}
