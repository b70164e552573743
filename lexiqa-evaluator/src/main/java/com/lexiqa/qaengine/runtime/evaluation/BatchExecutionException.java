package com.lexiqa.qaengine.runtime.evaluation;

/**
 * Raised when processing a record fails for a reason other than an invalid rule.
 * The batch is abandoned as a whole.
 */
public class BatchExecutionException extends RuntimeException {

    public BatchExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
