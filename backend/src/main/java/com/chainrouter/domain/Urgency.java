package com.chainrouter.domain;

/**
 * Caller-declared urgency. CRITICAL trades load spreading for a deterministic pick of the best provider.
 */
public enum Urgency {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
