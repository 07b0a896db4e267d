package com.chainrouter.rpc.pool;

import java.util.List;

/**
 * Picks one idle connection among the leasable connections of a provider.
 */
@FunctionalInterface
public interface ConnectionSelectionStrategy {

    /**
     * @param candidates non-empty, ordered by connection creation
     */
    PooledConnection select(List<PooledConnection> candidates);
}
