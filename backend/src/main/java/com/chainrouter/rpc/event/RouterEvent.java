package com.chainrouter.rpc.event;

import java.time.Instant;
import java.util.Map;

/**
 * Notification emitted by the tracker, registry and pool.
 *
 * @param providerId null for router-wide events (e.g. optimisation passes)
 * @param attributes event-specific details such as {@code until}, {@code reason}, {@code costToday}
 */
public record RouterEvent(RouterEventType type, String providerId, Map<String, Object> attributes, Instant timestamp) {

    public RouterEvent {
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public Object attribute(String key) {
        return attributes.get(key);
    }
}
