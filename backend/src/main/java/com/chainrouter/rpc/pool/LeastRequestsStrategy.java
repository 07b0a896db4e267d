package com.chainrouter.rpc.pool;

import java.util.Comparator;
import java.util.List;

/**
 * Fewest requests served so far; oldest connection on ties.
 */
public class LeastRequestsStrategy implements ConnectionSelectionStrategy {

    @Override
    public PooledConnection select(List<PooledConnection> candidates) {
        return candidates.stream()
                .min(Comparator.comparingLong(PooledConnection::getRequestCount))
                .orElseThrow();
    }
}
