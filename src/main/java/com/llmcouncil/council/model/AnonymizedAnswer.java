package com.llmcouncil.council.model;

public record AnonymizedAnswer(
        String label,
        String response
) {
}
