package com.chainrouter.rpc.error;

import lombok.Getter;

/**
 * A pool acquire waited longer than the connection timeout.
 */
@Getter
public class AcquireTimeoutException extends RpcException {

    private final String providerId;
    private final long waitedMs;

    public AcquireTimeoutException(String providerId, long waitedMs) {
        super("Timed out after " + waitedMs + " ms waiting for a connection to " + providerId);
        this.providerId = providerId;
        this.waitedMs = waitedMs;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
