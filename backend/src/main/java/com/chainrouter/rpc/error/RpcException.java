package com.chainrouter.rpc.error;

/**
 * Base type for failures raised by the RPC routing layer.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * True when the caller may retry the same logical request after a delay.
     */
    public boolean isRetryable() {
        return false;
    }
}
