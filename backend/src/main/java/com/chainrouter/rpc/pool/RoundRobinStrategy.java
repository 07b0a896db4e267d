package com.chainrouter.rpc.pool;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cycles through candidates. Thread-safe.
 */
public class RoundRobinStrategy implements ConnectionSelectionStrategy {

    private final AtomicInteger index = new AtomicInteger(0);

    @Override
    public PooledConnection select(List<PooledConnection> candidates) {
        int i = Math.floorMod(index.getAndIncrement(), candidates.size());
        return candidates.get(i);
    }
}
