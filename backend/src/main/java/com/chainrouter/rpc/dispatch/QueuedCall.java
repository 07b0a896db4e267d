package com.chainrouter.rpc.dispatch;

import com.chainrouter.domain.RpcRequest;
import com.chainrouter.domain.RpcResponse;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's handle on a queued request. Cancelling only succeeds while the call is still waiting for
 * a dispatch tick; once handed to the executor it runs to completion or timeout.
 */
public class QueuedCall extends CompletableFuture<RpcResponse> {

    private final RpcRequest request;
    private final Instant enqueuedAt;
    private final DispatchQueue owner;

    QueuedCall(RpcRequest request, Instant enqueuedAt, DispatchQueue owner) {
        this.request = request;
        this.enqueuedAt = enqueuedAt;
        this.owner = owner;
    }

    public RpcRequest getRequest() {
        return request;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        if (!owner.withdraw(this)) {
            return false;
        }
        return super.cancel(mayInterruptIfRunning);
    }
}
