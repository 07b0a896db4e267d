package com.chainrouter.rpc.selection;

import com.chainrouter.domain.Provider;
import com.chainrouter.domain.Urgency;
import com.chainrouter.rpc.health.ProviderHealthTracker;
import com.chainrouter.rpc.health.ProviderMetricsSnapshot;
import com.chainrouter.rpc.registry.ProviderRegistry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Ranks the providers of a chain and picks candidates for a call.
 * <p>
 * Score: {@code tierWeight * 1000 + priority + successRate * 100 - avgLatencyMs}. Tier dominates
 * priority, which dominates latency. Providers that are inactive, blacklisted, unhealthy or over
 * their daily budget are never candidates.
 */
public class ProviderSelector {

    static final int WEIGHTED_POOL_SIZE = 3;

    private static final Comparator<ScoredProvider> BY_SCORE_DESC = Comparator
            .comparingDouble(ScoredProvider::score).reversed()
            .thenComparing(s -> s.provider().getId());

    private final ProviderRegistry registry;
    private final ProviderHealthTracker tracker;
    private final RandomGenerator random;

    public ProviderSelector(ProviderRegistry registry, ProviderHealthTracker tracker, RandomGenerator random) {
        this.registry = registry;
        this.tracker = tracker;
        this.random = random;
    }

    /**
     * Eligible providers for the chain, best first. Ties are broken by provider id.
     */
    public List<ScoredProvider> rank(String chain, Set<String> excluded) {
        List<ScoredProvider> ranked = new ArrayList<>();
        for (Provider provider : registry.forChain(chain)) {
            if (excluded.contains(provider.getId()) || !isEligible(provider)) {
                continue;
            }
            ProviderMetricsSnapshot metrics = tracker.snapshot(provider.getId());
            ranked.add(new ScoredProvider(provider, score(provider, metrics), metrics));
        }
        ranked.sort(BY_SCORE_DESC);
        return ranked;
    }

    public List<Provider> selectProviders(String chain, Urgency urgency) {
        return selectProviders(chain, urgency, Set.of());
    }

    /**
     * Ordered candidates for one attempt. {@code CRITICAL} gets the single top-scored provider;
     * other urgencies get a weighted-random pick among the top three (weights 4/2/1) followed by the
     * remaining top candidates in score order. Empty when nothing is eligible.
     */
    public List<Provider> selectProviders(String chain, Urgency urgency, Set<String> excluded) {
        List<ScoredProvider> ranked = rank(chain, excluded);
        if (ranked.isEmpty()) {
            return List.of();
        }
        if (urgency == Urgency.CRITICAL) {
            return List.of(ranked.get(0).provider());
        }
        List<ScoredProvider> top = ranked.subList(0, Math.min(WEIGHTED_POOL_SIZE, ranked.size()));
        int chosen = weightedIndex(top.size());
        List<Provider> ordered = new ArrayList<>(top.size());
        ordered.add(top.get(chosen).provider());
        for (int i = 0; i < top.size(); i++) {
            if (i != chosen) {
                ordered.add(top.get(i).provider());
            }
        }
        return ordered;
    }

    /**
     * Deterministic top provider for the chain.
     */
    public Optional<Provider> best(String chain) {
        List<ScoredProvider> ranked = rank(chain, Set.of());
        return ranked.isEmpty() ? Optional.empty() : Optional.of(ranked.get(0).provider());
    }

    public boolean isEligible(Provider provider) {
        String id = provider.getId();
        return provider.isActive()
                && !tracker.isBlacklisted(id)
                && tracker.isHealthy(id)
                && !tracker.isOverBudget(id);
    }

    static double score(Provider provider, ProviderMetricsSnapshot metrics) {
        return provider.getTier().weight() * 1000.0
                + provider.getPriority()
                + metrics.successRate() * 100.0
                - metrics.avgLatencyMs();
    }

    /**
     * Index i in [0, n) chosen with weight 2^(n-1-i).
     */
    int weightedIndex(int n) {
        if (n == 1) {
            return 0;
        }
        int total = (1 << n) - 1;
        double r = random.nextDouble() * total;
        double cumulative = 0;
        for (int i = 0; i < n; i++) {
            cumulative += 1 << (n - 1 - i);
            if (r < cumulative) {
                return i;
            }
        }
        return n - 1;
    }
}
