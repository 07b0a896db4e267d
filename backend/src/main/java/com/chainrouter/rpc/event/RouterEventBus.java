package com.chainrouter.rpc.event;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous observer registry. Every event is logged; listener failures are logged and do not
 * reach the publisher.
 */
@Slf4j
public class RouterEventBus {

    private final List<RouterEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public RouterEventBus(Clock clock) {
        this(clock, List.of());
    }

    public RouterEventBus(Clock clock, List<RouterEventListener> initialListeners) {
        this.clock = clock;
        if (initialListeners != null) {
            listeners.addAll(initialListeners);
        }
    }

    public void subscribe(RouterEventListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(RouterEventListener listener) {
        listeners.remove(listener);
    }

    public void publish(RouterEventType type, String providerId, Map<String, Object> attributes) {
        RouterEvent event = new RouterEvent(type, providerId, attributes, clock.instant());
        logEvent(event);
        for (RouterEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Router event listener {} failed on {}: {}", listener, type, e.getMessage(), e);
            }
        }
    }

    private static void logEvent(RouterEvent event) {
        switch (event.type()) {
            case PROVIDER_BLACKLISTED, BUDGET_EXCEEDED ->
                    log.warn("Router event {} provider={} {}", event.type(), event.providerId(), event.attributes());
            case HEALTH_CHANGED, CONNECTION_EVICTED, POOL_SCALED_UP, POOL_SCALED_DOWN, PROVIDER_STATUS_CHANGED,
                    PROVIDER_REGISTERED, PROVIDER_REMOVED, PRIORITIES_OPTIMIZED ->
                    log.info("Router event {} provider={} {}", event.type(), event.providerId(), event.attributes());
            default -> log.debug("Router event {} provider={} {}", event.type(), event.providerId(), event.attributes());
        }
    }
}
