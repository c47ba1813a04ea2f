package com.llmcouncil.api;

import java.time.Instant;

public record ChatStreamResponse(
        String runId,
        Instant createdAt
) {
}
