package com.chainrouter.rpc.event;

/**
 * Observer for {@link RouterEvent}s. Invoked synchronously on the publishing thread, so implementations
 * must be quick and must not call back into the pool or tracker while holding their own locks.
 */
@FunctionalInterface
public interface RouterEventListener {

    void onEvent(RouterEvent event);
}
