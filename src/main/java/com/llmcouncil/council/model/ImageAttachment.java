package com.llmcouncil.council.model;

/**
 * A decoded image from a {@code data:} URL. {@code dataUrl} is kept verbatim for persistence.
 */
public record ImageAttachment(
        String mimeType,
        byte[] data,
        String dataUrl
) {
}
