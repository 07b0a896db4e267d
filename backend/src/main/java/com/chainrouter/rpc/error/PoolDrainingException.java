package com.chainrouter.rpc.error;

/**
 * The connection pool is shutting down and no longer hands out leases.
 */
public class PoolDrainingException extends RpcException {

    public PoolDrainingException(String message) {
        super(message);
    }
}
