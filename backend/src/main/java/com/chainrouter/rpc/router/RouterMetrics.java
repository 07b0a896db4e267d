package com.chainrouter.rpc.router;

import com.chainrouter.rpc.health.CostSummary;
import com.chainrouter.rpc.health.ProviderMetricsSnapshot;
import com.chainrouter.rpc.pool.PoolStats;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregate router view.
 *
 * @param avgLatencyMs mean of the per-provider latency averages, over providers with samples
 */
public record RouterMetrics(
        long totalRequests,
        long successfulRequests,
        long failedRequests,
        double successRate,
        double avgLatencyMs,
        int totalProviders,
        int healthyProviders,
        int blacklistedProviders,
        CostSummary costs,
        Map<String, Integer> queueDepths,
        PoolStats pool,
        long cachedResponses,
        Map<String, ProviderMetricsSnapshot> providers,
        Instant timestamp
) {
}
