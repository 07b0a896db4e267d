package com.chainrouter.rpc.pool;

import java.util.Map;

/**
 * Point-in-time pool snapshot.
 *
 * @param utilization busy / total, 0 when the pool is empty
 */
public record PoolStats(
        int totalConnections,
        int busyConnections,
        int idleConnections,
        int inactiveConnections,
        int waiters,
        double utilization,
        long totalRequests,
        double avgResponseTimeMs,
        double avgHealthScore,
        Map<String, Integer> connectionsByProvider,
        boolean draining
) {

    public PoolStats {
        connectionsByProvider = Map.copyOf(connectionsByProvider);
    }
}
