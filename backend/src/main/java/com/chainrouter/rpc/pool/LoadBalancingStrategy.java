package com.chainrouter.rpc.pool;

import java.util.random.RandomGenerator;

/**
 * Configurable connection selection strategies.
 */
public enum LoadBalancingStrategy {
    ROUND_ROBIN,
    LEAST_REQUESTS,
    WEIGHTED,
    LATENCY_BIASED;

    public ConnectionSelectionStrategy create(RandomGenerator random) {
        return switch (this) {
            case ROUND_ROBIN -> new RoundRobinStrategy();
            case LEAST_REQUESTS -> new LeastRequestsStrategy();
            case WEIGHTED -> new WeightedStrategy(random);
            case LATENCY_BIASED -> new LatencyBiasedStrategy();
        };
    }
}
