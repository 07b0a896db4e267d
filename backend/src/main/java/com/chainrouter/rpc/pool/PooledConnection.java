package com.chainrouter.rpc.pool;

import lombok.Getter;

import java.time.Instant;

/**
 * Logical lease slot against one provider. State changes happen under the pool lock; getters may be
 * read from any thread.
 */
@Getter
public class PooledConnection {

    static final int MAX_HEALTH_SCORE = 100;
    static final int SUCCESS_BONUS = 10;
    static final int FAILURE_PENALTY = 25;

    private final String id;
    private final String providerId;
    private final Instant createdAt;
    private volatile Instant lastUsed;
    private volatile boolean busy;
    private volatile boolean active = true;
    /** Past max age while leased; destroyed on release. */
    private volatile boolean retired;
    private volatile long requestCount;
    private volatile int consecutiveErrors;
    private volatile double avgResponseTimeMs;
    private volatile int healthScore = MAX_HEALTH_SCORE;

    PooledConnection(String id, String providerId, Instant createdAt) {
        this.id = id;
        this.providerId = providerId;
        this.createdAt = createdAt;
        this.lastUsed = createdAt;
    }

    boolean isLeasable() {
        return !busy && active && !retired;
    }

    void lease(Instant now) {
        busy = true;
        lastUsed = now;
    }

    void unlease() {
        busy = false;
    }

    void completeLease(Instant now, Long latencyMs) {
        busy = false;
        lastUsed = now;
        requestCount++;
        if (latencyMs != null) {
            avgResponseTimeMs += (latencyMs - avgResponseTimeMs) / requestCount;
        }
    }

    /**
     * @return true when this outcome deactivated the connection
     */
    boolean recordOutcome(boolean success, int maxConsecutiveErrors) {
        if (success) {
            consecutiveErrors = 0;
            healthScore = Math.min(MAX_HEALTH_SCORE, healthScore + SUCCESS_BONUS);
            return false;
        }
        consecutiveErrors++;
        healthScore = Math.max(0, healthScore - FAILURE_PENALTY);
        if (active && consecutiveErrors >= maxConsecutiveErrors) {
            active = false;
            return true;
        }
        return false;
    }

    void retire() {
        retired = true;
    }

    @Override
    public String toString() {
        return "PooledConnection{" + id + " provider=" + providerId + " busy=" + busy + " active=" + active
                + " health=" + healthScore + "}";
    }
}
