package com.chainrouter.rpc.health;

/**
 * Outcome of one health probe.
 *
 * @param error null on success
 */
public record ProbeResult(String providerId, boolean healthy, long latencyMs, String error) {

    public static ProbeResult success(String providerId, long latencyMs) {
        return new ProbeResult(providerId, true, latencyMs, null);
    }

    public static ProbeResult failure(String providerId, long latencyMs, String error) {
        return new ProbeResult(providerId, false, latencyMs, error);
    }
}
