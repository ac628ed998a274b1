package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

/**
 * The similarity index could not answer. Callers continue with an empty context.
 */
@Getter
public class RetrievalUnavailableException extends RuntimeException {

    private final boolean timedOut;

    public RetrievalUnavailableException(String message, boolean timedOut) {
        super(message);
        this.timedOut = timedOut;
    }

    public RetrievalUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.timedOut = false;
    }
}
