package com.chainrouter.rpc.error;

import lombok.Getter;

/**
 * The per-chain dispatch queue is at capacity; the caller must back off.
 */
@Getter
public class QueueSaturatedException extends RpcException {

    private final String chain;
    private final String method;
    private final int depth;
    private final int maxDepth;

    public QueueSaturatedException(String chain, String method, int depth, int maxDepth) {
        super("Dispatch queue for " + chain + " saturated (" + depth + "/" + maxDepth + "), rejected " + method);
        this.chain = chain;
        this.method = method;
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
