package com.chainrouter.rpc.health;

import java.time.Duration;
import java.util.Map;

/**
 * @param dailyTotal          spend since UTC midnight across all providers
 * @param windowTotal         spend within the cost-tracking window
 * @param dailyByProvider     today's spend per provider id
 */
public record CostSummary(double dailyTotal, double windowTotal, Map<String, Double> dailyByProvider, Duration window) {

    public CostSummary {
        dailyByProvider = Map.copyOf(dailyByProvider);
    }
}
