package com.chainrouter.rpc.selection;

import com.chainrouter.domain.Provider;
import com.chainrouter.rpc.health.ProviderMetricsSnapshot;

/**
 * A selection candidate with the score it was ranked by.
 */
public record ScoredProvider(Provider provider, double score, ProviderMetricsSnapshot metrics) {
}
