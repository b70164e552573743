package com.lexiqa.qaengine.api.exceptions;

import com.lexiqa.qaengine.api.model.ErrorKind;

/**
 * Base class of the checked failures raised by the QA engine.
 */
public class QaEngineException extends Exception {

    private final ErrorKind kind;

    public QaEngineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QaEngineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
