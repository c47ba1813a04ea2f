package com.llmcouncil.council.model;

import java.util.List;

/**
 * Stage 1 answers stripped of model identity, in label order, plus the mapping that undoes it.
 */
public record AnonymizedStage1(
        List<AnonymizedAnswer> answers,
        LabelMapping labelMapping
) {

    public AnonymizedStage1 {
        answers = List.copyOf(answers);
    }
}
