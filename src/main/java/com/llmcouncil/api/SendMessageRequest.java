package com.llmcouncil.api;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * A question for the council. {@code images} holds base64 {@code data:} URLs.
 */
public record SendMessageRequest(
        @NotBlank String content,
        List<String> images
) {
}
