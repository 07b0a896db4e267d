package com.chainrouter.domain;

/**
 * Reliability/cost class of an RPC provider. The weight dominates provider scoring.
 */
public enum ProviderTier {
    PREMIUM(3),
    STANDARD(2),
    FALLBACK(1);

    private final int weight;

    ProviderTier(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
