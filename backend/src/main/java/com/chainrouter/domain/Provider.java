package com.chainrouter.domain;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One upstream RPC endpoint for a chain. Immutable except {@code active} and {@code priority},
 * which operators and optimisation passes adjust at runtime.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "apiKey")
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Provider {

    @EqualsAndHashCode.Include
    private final String id;
    private final String name;
    private final String chain;
    private final ProviderTier tier;
    private final String url;
    /** Optional streaming (WebSocket) endpoint for subscription-style providers. */
    private final String wsUrl;
    private final String apiKey;
    /** Requests per second; one 1s dispatch tick releases this many queued calls. */
    private final int rateLimit;
    /** Cost per 1000 requests in the provider's billing unit. */
    private final double costPer1000;
    /** Per-provider call timeout; null means the router default. */
    private final Long timeoutMs;
    /** Per-provider pooled connection ceiling; null means the pool default. */
    private final Integer maxConnections;
    /** Per-provider daily budget; null means the global budget. */
    private final Double dailyBudget;

    private volatile int priority;
    @Builder.Default
    private volatile boolean active = true;

    public double costPerCall() {
        return costPer1000 / 1000.0;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
