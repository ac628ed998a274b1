package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

/**
 * Base type for failures of a single model provider call.
 */
@Getter
public abstract class ModelProviderException extends RuntimeException {

    private final String providerId;

    protected ModelProviderException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }
}
