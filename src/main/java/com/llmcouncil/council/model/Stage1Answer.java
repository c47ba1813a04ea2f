package com.llmcouncil.council.model;

public record Stage1Answer(
        String model,
        String response
) {
}
