package com.llmcouncil.council;

/**
 * A failure that ends the whole turn, as opposed to a single model failing.
 */
public class CouncilPipelineException extends RuntimeException {

    public CouncilPipelineException(String message) {
        super(message);
    }

    public CouncilPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
