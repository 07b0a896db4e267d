package com.chainrouter.rpc.health;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Mutable reputation record for one provider. Every access goes through this object's monitor;
 * callers never hold it across a network call.
 */
class ProviderMetrics {

    private static final double LATENCY_DECAY = 0.9;

    private final String providerId;
    private long totalRequests;
    private long successfulRequests;
    private long failedRequests;
    private double avgLatencyMs;
    private boolean latencySampled;
    private double costToday;
    private LocalDate costDay;
    private LocalDate budgetAlertDay;
    private Instant lastHealthCheck;
    private boolean healthy = true;
    private Instant probeDownUntil;
    private Instant blacklistedUntil;

    ProviderMetrics(String providerId, Instant createdAt) {
        this.providerId = providerId;
        this.lastHealthCheck = createdAt;
    }

    /**
     * @return true when the healthy flag flipped
     */
    synchronized boolean recordOutcome(boolean success, Long latencyMs, int minSamples, double healthyRatio) {
        totalRequests++;
        if (success) {
            successfulRequests++;
        } else {
            failedRequests++;
        }
        if (latencyMs != null) {
            sampleLatency(latencyMs);
        }
        if (totalRequests < minSamples) {
            return false;
        }
        boolean nowHealthy = (double) successfulRequests / totalRequests > healthyRatio;
        return setHealthy(nowHealthy);
    }

    /**
     * A failed probe holds the provider down until {@code downUntil}; after that the success-rate
     * verdict applies again without another probe.
     *
     * @return true when the effective health at {@code at} flipped
     */
    synchronized boolean recordProbe(boolean success, Long latencyMs, Instant at, Instant downUntil) {
        boolean before = isHealthyAt(at);
        lastHealthCheck = at;
        if (latencyMs != null) {
            sampleLatency(latencyMs);
        }
        if (success) {
            probeDownUntil = null;
            healthy = true;
        } else {
            probeDownUntil = downUntil;
        }
        return before != isHealthyAt(at);
    }

    /**
     * Adds to today's spend, resetting it first when the UTC day rolled over.
     *
     * @return true when this call is the first to reach the budget today
     */
    synchronized boolean addCost(double cost, LocalDate today, double budget) {
        if (!today.equals(costDay)) {
            costDay = today;
            costToday = 0.0;
        }
        costToday += cost;
        if (overBudget(costToday, budget) && !today.equals(budgetAlertDay)) {
            budgetAlertDay = today;
            return true;
        }
        return false;
    }

    synchronized double costOn(LocalDate today) {
        return today.equals(costDay) ? costToday : 0.0;
    }

    synchronized void blacklistUntil(Instant until) {
        blacklistedUntil = until;
    }

    synchronized boolean isBlacklistedAt(Instant now) {
        return blacklistedUntil != null && now.isBefore(blacklistedUntil);
    }

    synchronized boolean isHealthyAt(Instant now) {
        return healthy && (probeDownUntil == null || !now.isBefore(probeDownUntil));
    }

    synchronized ProviderMetricsSnapshot snapshot(LocalDate today, Instant now) {
        double successRate = totalRequests == 0 ? 1.0 : (double) successfulRequests / totalRequests;
        return new ProviderMetricsSnapshot(
                providerId,
                totalRequests,
                successfulRequests,
                failedRequests,
                successRate,
                avgLatencyMs,
                costOn(today),
                lastHealthCheck,
                isHealthyAt(now),
                blacklistedUntil != null && now.isBefore(blacklistedUntil) ? blacklistedUntil : null
        );
    }

    static boolean overBudget(double costToday, double budget) {
        // zero budget: free calls stay allowed, the first paid call closes the gate
        return costToday > 0.0 && costToday >= budget;
    }

    private void sampleLatency(long latencyMs) {
        if (!latencySampled) {
            avgLatencyMs = latencyMs;
            latencySampled = true;
        } else {
            avgLatencyMs = avgLatencyMs * LATENCY_DECAY + latencyMs * (1 - LATENCY_DECAY);
        }
    }

    private boolean setHealthy(boolean value) {
        boolean changed = healthy != value;
        healthy = value;
        return changed;
    }
}
