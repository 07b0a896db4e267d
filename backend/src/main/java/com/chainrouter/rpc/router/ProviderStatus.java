package com.chainrouter.rpc.router;

import com.chainrouter.domain.ProviderTier;
import com.chainrouter.rpc.health.ProviderMetricsSnapshot;

/**
 * Operator view of one provider. Never carries the API key.
 */
public record ProviderStatus(
        String id,
        String name,
        String chain,
        ProviderTier tier,
        String url,
        int priority,
        boolean active,
        int rateLimit,
        double costPer1000,
        double dailyBudget,
        boolean blacklisted,
        boolean overBudget,
        boolean eligible,
        ProviderMetricsSnapshot metrics
) {
}
