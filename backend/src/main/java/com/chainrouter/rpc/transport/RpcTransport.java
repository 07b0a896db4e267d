package com.chainrouter.rpc.transport;

import com.chainrouter.domain.Provider;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * JSON-RPC transport abstraction for testing and provider failover.
 * Retries and provider selection are handled by the executor.
 */
public interface RpcTransport {

    /**
     * Perform a single JSON-RPC 2.0 call against the provider's base URL.
     *
     * @param requestId envelope id, echoed back by the provider
     * @param method    e.g. "eth_blockNumber"
     * @param params    positional params; empty list when none
     * @param timeout   per-call timeout
     * @return response body as string (JSON); errors with {@link com.chainrouter.rpc.error.TransportException}
     *         on HTTP, connection or timeout failures
     */
    Mono<String> call(Provider provider, String requestId, String method, List<Object> params, Duration timeout);
}
