package com.chainrouter.rpc.pool;

import java.util.Comparator;
import java.util.List;

/**
 * Lowest average response time; connections without samples (0 ms) are tried first.
 */
public class LatencyBiasedStrategy implements ConnectionSelectionStrategy {

    @Override
    public PooledConnection select(List<PooledConnection> candidates) {
        return candidates.stream()
                .min(Comparator.comparingDouble(PooledConnection::getAvgResponseTimeMs))
                .orElseThrow();
    }
}
