package com.chainrouter.domain;

import java.time.Instant;

/**
 * One charged RPC call, retained within the cost-tracking window.
 */
public record CostEntry(Instant timestamp, String providerId, double cost) {}
