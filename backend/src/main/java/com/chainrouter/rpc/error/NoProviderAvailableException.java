package com.chainrouter.rpc.error;

import lombok.Getter;

/**
 * No provider for the chain passed the selection filters (inactive, blacklisted, unhealthy, over budget).
 * Retryable after backoff: blacklists expire and budgets reset at the UTC day boundary.
 */
@Getter
public class NoProviderAvailableException extends RpcException {

    private final String chain;

    public NoProviderAvailableException(String chain) {
        super("No available RPC provider for chain " + chain);
        this.chain = chain;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
