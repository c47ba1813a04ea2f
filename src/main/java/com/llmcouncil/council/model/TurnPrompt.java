package com.llmcouncil.council.model;

import java.util.List;

/**
 * What a council member sees for one turn: prior exchanges, the new question and any images.
 */
public record TurnPrompt(
        List<HistoryEntry> history,
        String question,
        List<ImageAttachment> images
) {

    public TurnPrompt {
        history = history == null ? List.of() : List.copyOf(history);
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static TurnPrompt of(String question) {
        return new TurnPrompt(List.of(), question, List.of());
    }

    public TurnPrompt withQuestion(String text) {
        return new TurnPrompt(List.of(), text, images);
    }
}
