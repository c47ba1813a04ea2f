package com.llmcouncil.council;

public class TurnCancelledException extends RuntimeException {

    public TurnCancelledException(String runId) {
        super("Run " + runId + " was cancelled");
    }
}
