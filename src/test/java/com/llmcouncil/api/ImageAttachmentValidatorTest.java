package com.llmcouncil.api;

import com.llmcouncil.config.CouncilProperties;
import com.llmcouncil.council.model.ImageAttachment;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImageAttachmentValidatorTest {

    private final CouncilProperties properties = new CouncilProperties();
    private final ImageAttachmentValidator validator = new ImageAttachmentValidator(properties);

    private static String dataUrl(String mimeType, byte[] bytes) {
        return "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(bytes);
    }

    private static void assertBadRequest(Runnable action) {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, action::run);
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void testDecodesSupportedImages() {
        byte[] png = "fake-png".getBytes(StandardCharsets.UTF_8);
        List<ImageAttachment> images = validator.validate(List.of(dataUrl("image/png", png), dataUrl("image/webp", png)));

        assertEquals(2, images.size());
        assertEquals("image/png", images.get(0).mimeType());
        assertArrayEquals(png, images.get(0).data());
        assertTrue(images.get(1).dataUrl().startsWith("data:image/webp;base64,"));
    }

    @Test
    void testNoImages() {
        assertTrue(validator.validate(null).isEmpty());
        assertTrue(validator.validate(List.of()).isEmpty());
    }

    @Test
    void testRejectsInvalidInput() {
        byte[] bytes = "x".getBytes(StandardCharsets.UTF_8);
        assertBadRequest(() -> validator.validate(List.of("http://example.com/cat.png")));
        assertBadRequest(() -> validator.validate(List.of(dataUrl("image/bmp", bytes))));
        assertBadRequest(() -> validator.validate(List.of(dataUrl("application/pdf", bytes))));
        assertBadRequest(() -> validator.validate(List.of("data:image/png;base64,@@@not-base64@@@")));
        assertBadRequest(() -> validator.validate(Collections.nCopies(properties.getMaxImages() + 1,
                dataUrl("image/png", bytes))));
    }

    @Test
    void testRejectsOversizeImage() {
        properties.setMaxImageBytes(4);
        assertBadRequest(() -> validator.validate(List.of(dataUrl("image/jpeg", new byte[5]))));
    }
}
