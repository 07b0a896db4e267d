package com.chainrouter.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful JSON-RPC result with the provider that served it.
 *
 * @param attempts total attempts made for the logical request (1 when the first provider answered)
 * @param cached   true when served from the response cache without a network call
 */
public record RpcResponse(
        String requestId,
        JsonNode result,
        String providerId,
        long latencyMs,
        int attempts,
        boolean cached
) {

    /**
     * Same result re-issued for another request id without a network call.
     */
    public RpcResponse asCached(String forRequestId) {
        return new RpcResponse(forRequestId, result, providerId, 0L, 0, true);
    }
}
