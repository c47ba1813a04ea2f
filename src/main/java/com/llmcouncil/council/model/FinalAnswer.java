package com.llmcouncil.council.model;

public record FinalAnswer(
        String model,
        String response
) {
}
