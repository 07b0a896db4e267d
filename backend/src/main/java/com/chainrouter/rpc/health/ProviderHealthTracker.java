package com.chainrouter.rpc.health;

import com.chainrouter.domain.Provider;
import com.chainrouter.rpc.config.RpcRouterProperties;
import com.chainrouter.rpc.event.RouterEventBus;
import com.chainrouter.rpc.event.RouterEventType;
import com.chainrouter.rpc.registry.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Success/failure counters, latency average, daily spend, health flag and blacklist per provider.
 * All reads are computed against the injected clock, so blacklists expire and budgets reset at
 * UTC midnight without timers.
 */
@Slf4j
public class ProviderHealthTracker {

    private final ProviderRegistry registry;
    private final RouterEventBus events;
    private final Clock clock;
    private final CostLedger ledger;
    private final int minSamples;
    private final double healthyRatio;
    private final Duration blacklistDuration;
    private final double defaultDailyBudget;
    private final Map<String, ProviderMetrics> metrics = new ConcurrentHashMap<>();

    public ProviderHealthTracker(ProviderRegistry registry, RouterEventBus events, Clock clock, RpcRouterProperties properties) {
        this.registry = registry;
        this.events = events;
        this.clock = clock;
        this.ledger = new CostLedger(Duration.ofHours(properties.getCostTrackingWindowHours()), clock);
        this.minSamples = properties.getMinSamplesForHealth();
        this.healthyRatio = properties.getHealthySuccessRate();
        this.blacklistDuration = Duration.ofMillis(properties.getBlacklistDurationMs());
        this.defaultDailyBudget = properties.getDailyBudget();
    }

    /**
     * Records one request outcome. {@code latencyMs} may be null when no latency was measured.
     */
    public void recordOutcome(String providerId, boolean success, Long latencyMs) {
        ProviderMetrics m = metricsFor(providerId);
        if (m.recordOutcome(success, latencyMs, minSamples, healthyRatio)) {
            ProviderMetricsSnapshot s = m.snapshot(today(), clock.instant());
            events.publish(RouterEventType.HEALTH_CHANGED, providerId,
                    Map.of("healthy", s.healthy(), "successRate", s.successRate(), "reason", "success-rate"));
        }
    }

    public void recordCost(String providerId, double cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("cost must not be negative");
        }
        if (cost == 0.0) {
            return;
        }
        ledger.append(providerId, cost);
        double budget = dailyBudget(providerId);
        ProviderMetrics m = metricsFor(providerId);
        LocalDate today = today();
        if (m.addCost(cost, today, budget)) {
            events.publish(RouterEventType.BUDGET_EXCEEDED, providerId,
                    Map.of("costToday", m.costOn(today), "dailyBudget", budget, "day", today.toString()));
        }
    }

    public void blacklist(String providerId, Duration duration) {
        Instant until = clock.instant().plus(duration);
        metricsFor(providerId).blacklistUntil(until);
        events.publish(RouterEventType.PROVIDER_BLACKLISTED, providerId,
                Map.of("until", until, "durationMs", duration.toMillis()));
    }

    public boolean isBlacklisted(String providerId) {
        ProviderMetrics m = metrics.get(providerId);
        return m != null && m.isBlacklistedAt(clock.instant());
    }

    public boolean isHealthy(String providerId) {
        ProviderMetrics m = metrics.get(providerId);
        return m == null || m.isHealthyAt(clock.instant());
    }

    public boolean isOverBudget(String providerId) {
        return ProviderMetrics.overBudget(costToday(providerId), dailyBudget(providerId));
    }

    public double costToday(String providerId) {
        ProviderMetrics m = metrics.get(providerId);
        return m == null ? 0.0 : m.costOn(today());
    }

    public double dailyBudget(String providerId) {
        return registry.find(providerId)
                .map(Provider::getDailyBudget)
                .orElse(defaultDailyBudget);
    }

    public void recordProbeSuccess(String providerId, long latencyMs) {
        ProviderMetrics m = metricsFor(providerId);
        if (m.recordProbe(true, latencyMs, clock.instant(), null)) {
            events.publish(RouterEventType.HEALTH_CHANGED, providerId,
                    Map.of("healthy", true, "reason", "probe", "latencyMs", latencyMs));
        }
    }

    /**
     * Marks the provider unhealthy and blacklists it for the configured duration. Both lapse together.
     */
    public void recordProbeFailure(String providerId, String error) {
        ProviderMetrics m = metricsFor(providerId);
        Instant now = clock.instant();
        if (m.recordProbe(false, null, now, now.plus(blacklistDuration))) {
            events.publish(RouterEventType.HEALTH_CHANGED, providerId,
                    Map.of("healthy", false, "reason", "probe", "error", error != null ? error : "unknown"));
        }
        log.warn("Health probe failed for provider {}: {}", providerId, error);
        blacklist(providerId, blacklistDuration);
    }

    public ProviderMetricsSnapshot snapshot(String providerId) {
        return metricsFor(providerId).snapshot(today(), clock.instant());
    }

    /**
     * Snapshots for every registered provider, ordered by provider id.
     */
    public Map<String, ProviderMetricsSnapshot> snapshots() {
        Map<String, ProviderMetricsSnapshot> out = new LinkedHashMap<>();
        for (Provider p : registry.all()) {
            out.put(p.getId(), snapshot(p.getId()));
        }
        return out;
    }

    public CostSummary costSummary() {
        LocalDate today = today();
        Map<String, Double> byProvider = new LinkedHashMap<>();
        double daily = 0.0;
        for (Provider p : registry.all()) {
            double cost = costToday(p.getId());
            byProvider.put(p.getId(), cost);
            daily += cost;
        }
        return new CostSummary(daily, ledger.windowTotal(), byProvider, ledger.getWindow());
    }

    /**
     * Drops all state for a removed provider.
     */
    public void forget(String providerId) {
        metrics.remove(providerId);
        ledger.forget(providerId);
    }

    CostLedger ledger() {
        return ledger;
    }

    private ProviderMetrics metricsFor(String providerId) {
        return metrics.computeIfAbsent(providerId, id -> new ProviderMetrics(id, clock.instant()));
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
    }
}
