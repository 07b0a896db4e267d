package com.chainrouter.rpc.error;

import lombok.Getter;

/**
 * Network-level failure talking to a provider: timeout, connection reset, DNS, HTTP 5xx/429.
 * Always retried by the executor.
 */
@Getter
public class TransportException extends RpcException {

    private final String providerId;

    public TransportException(String providerId, String message) {
        super(message);
        this.providerId = providerId;
    }

    public TransportException(String providerId, String message, Throwable cause) {
        super(message, cause);
        this.providerId = providerId;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
