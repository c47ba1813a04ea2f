package com.llmcouncil.council.model;

public record HistoryEntry(
        Role role,
        String content
) {

    public enum Role {
        USER, ASSISTANT
    }

    public static HistoryEntry user(String content) {
        return new HistoryEntry(Role.USER, content);
    }

    public static HistoryEntry assistant(String content) {
        return new HistoryEntry(Role.ASSISTANT, content);
    }
}
