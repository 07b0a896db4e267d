package com.chainrouter.rpc.error;

import lombok.Getter;

/**
 * The provider answered with a JSON-RPC error object.
 */
@Getter
public class ProviderErrorException extends RpcException {

    private final String providerId;
    private final int code;
    private final String rpcMessage;
    private final boolean transientError;

    public ProviderErrorException(String providerId, int code, String rpcMessage, boolean transientError) {
        super("RPC error from " + providerId + ": code=" + code + " message=" + rpcMessage);
        this.providerId = providerId;
        this.code = code;
        this.rpcMessage = rpcMessage;
        this.transientError = transientError;
    }

    @Override
    public boolean isRetryable() {
        return transientError;
    }
}
