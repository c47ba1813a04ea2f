package com.llmcouncil.client;

public enum TurnStatus {
    RUNNING,
    COMPLETE,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this != RUNNING;
    }
}
