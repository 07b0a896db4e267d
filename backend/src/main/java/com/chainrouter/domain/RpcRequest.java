package com.chainrouter.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A logical JSON-RPC call. Only the retry counter changes after creation; failover and retries
 * reuse the same instance until it resolves.
 */
@Getter
public class RpcRequest {

    private final String id;
    private final String method;
    private final List<Object> params;
    private final String chain;
    private final Urgency urgency;
    private final int maxRetries;
    private final Instant createdAt;
    private final String pinnedProviderId;
    private volatile int retryCount;

    public RpcRequest(String id, String method, List<?> params, String chain, Urgency urgency,
                      int maxRetries, Instant createdAt, String pinnedProviderId) {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method required");
        }
        if (chain == null || chain.isBlank()) {
            throw new IllegalArgumentException("chain required");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.id = id != null ? id : newId();
        this.method = method;
        this.params = params != null ? List.copyOf(params) : List.of();
        this.chain = chain;
        this.urgency = urgency != null ? urgency : Urgency.MEDIUM;
        this.maxRetries = maxRetries;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.pinnedProviderId = pinnedProviderId;
    }

    public static RpcRequest of(String chain, String method, List<?> params, Urgency urgency, int maxRetries, Instant now) {
        return new RpcRequest(null, method, params, chain, urgency, maxRetries, now, null);
    }

    /**
     * Same logical request pinned to a provider for its first attempt.
     */
    public RpcRequest pinnedTo(String providerId) {
        RpcRequest copy = new RpcRequest(id, method, params, chain, urgency, maxRetries, createdAt, providerId);
        copy.retryCount = this.retryCount;
        return copy;
    }

    public int incrementRetryCount() {
        return ++retryCount;
    }

    private static String newId() {
        return "req_" + UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }

    @Override
    public String toString() {
        return "RpcRequest{" + id + " " + chain + ":" + method + " urgency=" + urgency
                + " retry=" + retryCount + "/" + maxRetries + "}";
    }
}
