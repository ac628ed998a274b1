package com.purchasingpower.reviewflow.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class ProviderTimeoutException extends ModelProviderException {

    private final Duration timeout;

    public ProviderTimeoutException(String providerId, Duration timeout) {
        super(providerId, "Provider " + providerId + " did not answer within " + timeout.toMillis() + "ms", null);
        this.timeout = timeout;
    }
}
