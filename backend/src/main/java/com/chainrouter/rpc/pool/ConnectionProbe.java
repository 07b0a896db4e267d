package com.chainrouter.rpc.pool;

/**
 * Liveness check for one pooled connection. Called without the pool lock held.
 */
@FunctionalInterface
public interface ConnectionProbe {

    boolean probe(PooledConnection connection);
}
