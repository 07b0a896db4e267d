package com.chainrouter.rpc.health;

import java.time.Instant;

/**
 * Immutable view of a provider's metrics at one instant.
 *
 * @param successRate      successful / total, 1.0 before any request was recorded
 * @param blacklistedUntil null when the provider is not blacklisted at snapshot time
 */
public record ProviderMetricsSnapshot(
        String providerId,
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double successRate,
        double avgLatencyMs,
        double costToday,
        Instant lastHealthCheck,
        boolean healthy,
        Instant blacklistedUntil
) {

    public boolean blacklisted() {
        return blacklistedUntil != null;
    }
}
