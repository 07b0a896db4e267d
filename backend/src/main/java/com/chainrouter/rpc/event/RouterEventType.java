package com.chainrouter.rpc.event;

public enum RouterEventType {
    PROVIDER_REGISTERED,
    PROVIDER_REMOVED,
    PROVIDER_STATUS_CHANGED,
    HEALTH_CHANGED,
    PROVIDER_BLACKLISTED,
    BUDGET_EXCEEDED,
    CONNECTION_CREATED,
    CONNECTION_EVICTED,
    POOL_SCALED_UP,
    POOL_SCALED_DOWN,
    PRIORITIES_OPTIMIZED
}
