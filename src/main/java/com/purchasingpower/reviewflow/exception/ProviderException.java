package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

/**
 * Provider answered with an error, or the call failed before an answer arrived.
 */
@Getter
public class ProviderException extends ModelProviderException {

    private final int statusCode;

    public ProviderException(String providerId, String message, Throwable cause) {
        this(providerId, message, -1, cause);
    }

    public ProviderException(String providerId, String message, int statusCode, Throwable cause) {
        super(providerId, message, cause);
        this.statusCode = statusCode;
    }
}
