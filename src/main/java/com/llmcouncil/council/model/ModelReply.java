package com.llmcouncil.council.model;

import org.springframework.lang.Nullable;

/**
 * Outcome of one model invocation: either text or a failure reason, never both.
 */
public record ModelReply(
        String model,
        @Nullable String content,
        @Nullable String failureReason
) {

    public static ModelReply success(String model, @Nullable String content) {
        return new ModelReply(model, content == null ? "" : content, null);
    }

    public static ModelReply failure(String model, String reason) {
        return new ModelReply(model, null, reason == null ? "unknown failure" : reason);
    }

    public boolean failed() {
        return failureReason != null;
    }
}
