package com.chainrouter.rpc.pool;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Random pick weighted by health score. Falls back to the first candidate when every score is zero.
 */
public class WeightedStrategy implements ConnectionSelectionStrategy {

    private final RandomGenerator random;

    public WeightedStrategy(RandomGenerator random) {
        this.random = random;
    }

    @Override
    public PooledConnection select(List<PooledConnection> candidates) {
        long total = 0;
        for (PooledConnection c : candidates) {
            total += c.getHealthScore();
        }
        if (total == 0) {
            return candidates.get(0);
        }
        double r = random.nextDouble() * total;
        double cumulative = 0;
        for (PooledConnection c : candidates) {
            cumulative += c.getHealthScore();
            if (r < cumulative) {
                return c;
            }
        }
        return candidates.get(candidates.size() - 1);
    }
}
