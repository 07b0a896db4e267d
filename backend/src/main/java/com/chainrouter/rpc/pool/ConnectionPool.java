package com.chainrouter.rpc.pool;

import com.chainrouter.domain.Provider;
import com.chainrouter.rpc.config.ConnectionPoolProperties;
import com.chainrouter.rpc.error.AcquireTimeoutException;
import com.chainrouter.rpc.error.PoolDrainingException;
import com.chainrouter.rpc.error.RpcException;
import com.chainrouter.rpc.event.RouterEventBus;
import com.chainrouter.rpc.event.RouterEventType;
import com.chainrouter.rpc.registry.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of logical provider connections with exclusive leases, a priority wait list, health
 * eviction and utilization-driven scaling.
 * <p>
 * A single lock guards connections and waiters. Probes run outside the lock. Events raised while the
 * lock is held are published after it is released.
 */
@Slf4j
public class ConnectionPool {

    private static final Comparator<Waiter> WAITER_ORDER = Comparator
            .comparingInt(Waiter::priority).reversed()
            .thenComparingLong(Waiter::sequence);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition released = lock.newCondition();
    private final Map<String, PooledConnection> connections = new LinkedHashMap<>();
    private final PriorityQueue<Waiter> waiters = new PriorityQueue<>(WAITER_ORDER);
    private final List<PendingEvent> pendingEvents = new ArrayList<>();
    private final AtomicLong connectionSeq = new AtomicLong();
    private long waiterSeq;
    private boolean draining;

    private final ProviderRegistry registry;
    private final RouterEventBus events;
    private final ConnectionSelectionStrategy strategy;
    private final ConnectionProbe probe;
    private final Clock clock;
    private final ConnectionPoolProperties properties;

    public ConnectionPool(ProviderRegistry registry, RouterEventBus events, ConnectionSelectionStrategy strategy,
                          ConnectionProbe probe, Clock clock, ConnectionPoolProperties properties) {
        if (properties.getMinConnections() < 0 || properties.getMaxConnections() < 1
                || properties.getMinConnections() > properties.getMaxConnections()) {
            throw new IllegalArgumentException("Invalid pool bounds: min=" + properties.getMinConnections()
                    + " max=" + properties.getMaxConnections());
        }
        this.registry = registry;
        this.events = events;
        this.strategy = strategy;
        this.probe = probe;
        this.clock = clock;
        this.properties = properties;
    }

    /**
     * Leases a connection to the provider, waiting up to the connection timeout. Waiters are served
     * by descending priority, then in arrival order.
     *
     * @throws AcquireTimeoutException when no connection became available in time
     * @throws PoolDrainingException   when the pool is draining
     */
    public PooledConnection acquire(String providerId, int priority) {
        Provider provider = registry.require(providerId);
        Waiter waiter;
        lock.lock();
        try {
            if (draining) {
                throw new PoolDrainingException("Pool is draining; rejected acquire for " + providerId);
            }
            PooledConnection leased = tryLease(provider);
            if (leased != null) {
                return leased;
            }
            waiter = new Waiter(providerId, priority, waiterSeq++, clock.instant(), new CompletableFuture<>());
            waiters.add(waiter);
            log.debug("Acquire for {} queued (priority {}, {} waiting)", providerId, priority, waiters.size());
        } finally {
            lock.unlock();
            flushEvents();
        }
        return await(waiter);
    }

    public void release(String connectionId) {
        release(connectionId, null, true);
    }

    /**
     * Returns a lease and hands the slot to the next eligible waiter. Connections that were retired
     * or deactivated while leased are destroyed here.
     */
    public void release(String connectionId, Long latencyMs, boolean success) {
        lock.lock();
        try {
            PooledConnection c = connections.get(connectionId);
            if (c == null) {
                log.debug("Release of unknown or destroyed connection {}", connectionId);
                return;
            }
            if (!c.isBusy()) {
                throw new IllegalStateException("Connection " + connectionId + " is not leased");
            }
            c.completeLease(clock.instant(), latencyMs);
            if (c.recordOutcome(success, properties.getMaxConsecutiveErrors())) {
                log.warn("Connection {} deactivated after {} consecutive errors", c.getId(), c.getConsecutiveErrors());
            }
            if (c.isRetired() || !c.isActive()) {
                destroyLocked(c, c.isRetired() ? "max-age" : "unhealthy");
            }
            released.signalAll();
            serveWaiters();
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /**
     * Removes the connection whatever its state; a waiting acquire may create a replacement.
     */
    public void destroy(String connectionId) {
        lock.lock();
        try {
            PooledConnection c = connections.get(connectionId);
            if (c != null) {
                destroyLocked(c, "destroyed");
                released.signalAll();
                serveWaiters();
            }
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /**
     * Closes a removed provider's connections (busy ones on release) and fails its waiters.
     *
     * @return number of connections destroyed or retired
     */
    public int evictProvider(String providerId) {
        lock.lock();
        try {
            int evicted = 0;
            for (PooledConnection c : new ArrayList<>(connections.values())) {
                if (!c.getProviderId().equals(providerId)) {
                    continue;
                }
                if (c.isBusy()) {
                    c.retire();
                } else {
                    destroyLocked(c, "provider-removed");
                }
                evicted++;
            }
            waiters.removeIf(w -> {
                if (w.providerId().equals(providerId)) {
                    w.future().completeExceptionally(new RpcException("Provider " + providerId + " was removed"));
                    return true;
                }
                return false;
            });
            return evicted;
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /**
     * Probes every idle connection. Busy connections are judged by their lease outcome instead.
     *
     * @return number of connections deactivated by this pass
     */
    public int runHealthChecks() {
        List<PooledConnection> targets = new ArrayList<>();
        lock.lock();
        try {
            for (PooledConnection c : connections.values()) {
                if (c.isLeasable()) {
                    targets.add(c);
                }
            }
        } finally {
            lock.unlock();
        }
        Map<PooledConnection, Boolean> results = new LinkedHashMap<>();
        for (PooledConnection c : targets) {
            results.put(c, probeSafely(c));
        }
        int deactivated = 0;
        lock.lock();
        try {
            for (Map.Entry<PooledConnection, Boolean> r : results.entrySet()) {
                PooledConnection c = r.getKey();
                if (connections.get(c.getId()) != c) {
                    continue;
                }
                if (c.recordOutcome(r.getValue(), properties.getMaxConsecutiveErrors())) {
                    deactivated++;
                    log.warn("Connection {} to {} marked inactive after {} failed probes",
                            c.getId(), c.getProviderId(), c.getConsecutiveErrors());
                }
            }
        } finally {
            lock.unlock();
        }
        return deactivated;
    }

    /**
     * One scaling step: +1 connection for the most loaded provider above the high-water mark, -1
     * longest-idle connection below the low-water mark.
     *
     * @return +1, -1 or 0
     */
    public int autoScale() {
        lock.lock();
        try {
            if (draining || connections.isEmpty()) {
                return 0;
            }
            double utilization = utilizationLocked();
            if (utilization > properties.getScaleUpThreshold()) {
                return scaleUpLocked(utilization);
            }
            if (utilization < properties.getScaleDownThreshold() && connections.size() > properties.getMinConnections()) {
                return scaleDownLocked(utilization);
            }
            return 0;
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /**
     * Destroys inactive connections, connections past max age (retiring busy ones) and idle
     * connections past the idle timeout while staying at or above the minimum.
     *
     * @return number of connections destroyed
     */
    public int cleanup() {
        lock.lock();
        try {
            Instant now = clock.instant();
            int destroyed = 0;
            for (PooledConnection c : new ArrayList<>(connections.values())) {
                if (!c.isActive() && !c.isBusy()) {
                    destroyLocked(c, "inactive");
                    destroyed++;
                } else if (Duration.between(c.getCreatedAt(), now).toMillis() >= properties.getMaxAgeMs()) {
                    if (c.isBusy()) {
                        c.retire();
                    } else {
                        destroyLocked(c, "max-age");
                        destroyed++;
                    }
                } else if (!c.isBusy()
                        && Duration.between(c.getLastUsed(), now).toMillis() >= properties.getIdleTimeoutMs()
                        && connections.size() > properties.getMinConnections()) {
                    destroyLocked(c, "idle");
                    destroyed++;
                }
            }
            if (destroyed > 0) {
                released.signalAll();
                serveWaiters();
            }
            return destroyed;
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    /**
     * Rejects queued waiters, refuses new acquires and blocks until every lease is returned, then
     * closes the remaining connections.
     *
     * @return false when leases were still outstanding at the timeout
     */
    public boolean drain(Duration timeout) {
        lock.lock();
        try {
            draining = true;
            Waiter w;
            while ((w = waiters.poll()) != null) {
                w.future().completeExceptionally(new PoolDrainingException("Pool drained while waiting for " + w.providerId()));
            }
            long remaining = timeout.toNanos();
            while (busyCountLocked() > 0) {
                if (remaining <= 0) {
                    log.warn("Pool drain timed out with {} connections still leased", busyCountLocked());
                    return false;
                }
                remaining = released.awaitNanos(remaining);
            }
            for (PooledConnection c : new ArrayList<>(connections.values())) {
                destroyLocked(c, "drain");
            }
            log.info("Connection pool drained");
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted while draining connection pool", e);
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    public PoolStats stats() {
        lock.lock();
        try {
            int busy = 0;
            int inactive = 0;
            long requests = 0;
            double latencySum = 0;
            double healthSum = 0;
            Map<String, Integer> byProvider = new TreeMap<>();
            for (PooledConnection c : connections.values()) {
                if (c.isBusy()) {
                    busy++;
                }
                if (!c.isActive()) {
                    inactive++;
                }
                requests += c.getRequestCount();
                latencySum += c.getAvgResponseTimeMs();
                healthSum += c.getHealthScore();
                byProvider.merge(c.getProviderId(), 1, Integer::sum);
            }
            int total = connections.size();
            return new PoolStats(total, busy, total - busy, inactive, waiters.size(), utilizationLocked(), requests,
                    total == 0 ? 0.0 : latencySum / total, total == 0 ? 0.0 : healthSum / total, byProvider, draining);
        } finally {
            lock.unlock();
        }
    }

    private PooledConnection await(Waiter waiter) {
        long timeoutMs = properties.getConnectionTimeoutMs();
        try {
            return waiter.future().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            lock.lock();
            try {
                if (waiters.remove(waiter)) {
                    log.warn("Acquire for {} timed out after {} ms (priority {})", waiter.providerId(), timeoutMs, waiter.priority());
                    throw new AcquireTimeoutException(waiter.providerId(), timeoutMs);
                }
            } finally {
                lock.unlock();
            }
            // handed off between the timeout and the lock
            return waiter.future().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(waiter);
            throw new RpcException("Interrupted while waiting for a connection to " + waiter.providerId(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RpcException rpc) {
                throw rpc;
            }
            throw new RpcException("Acquire for " + waiter.providerId() + " failed", e.getCause());
        }
    }

    private void abandon(Waiter waiter) {
        lock.lock();
        try {
            if (!waiters.remove(waiter) && waiter.future().isDone() && !waiter.future().isCompletedExceptionally()) {
                waiter.future().join().unlease();
                released.signalAll();
                serveWaiters();
            }
        } finally {
            lock.unlock();
            flushEvents();
        }
    }

    private PooledConnection tryLease(Provider provider) {
        List<PooledConnection> idle = new ArrayList<>();
        for (PooledConnection c : connections.values()) {
            if (c.getProviderId().equals(provider.getId()) && c.isLeasable()) {
                idle.add(c);
            }
        }
        PooledConnection chosen = idle.isEmpty() ? null : strategy.select(idle);
        if (chosen == null && canCreateLocked(provider)) {
            chosen = createLocked(provider, "demand");
        }
        if (chosen != null) {
            chosen.lease(clock.instant());
        }
        return chosen;
    }

    private void serveWaiters() {
        if (waiters.isEmpty()) {
            return;
        }
        List<Waiter> ordered = new ArrayList<>(waiters);
        ordered.sort(WAITER_ORDER);
        for (Waiter w : ordered) {
            Provider provider = registry.find(w.providerId()).orElse(null);
            if (provider == null) {
                waiters.remove(w);
                w.future().completeExceptionally(new RpcException("Provider " + w.providerId() + " was removed"));
                continue;
            }
            PooledConnection leased = tryLease(provider);
            if (leased != null) {
                waiters.remove(w);
                w.future().complete(leased);
            }
        }
    }

    private boolean canCreateLocked(Provider provider) {
        if (draining || connections.size() >= properties.getMaxConnections()) {
            return false;
        }
        return liveCountLocked(provider.getId()) < ceiling(provider);
    }

    private int ceiling(Provider provider) {
        return provider.getMaxConnections() != null ? provider.getMaxConnections() : properties.getMaxConnectionsPerProvider();
    }

    private int liveCountLocked(String providerId) {
        int count = 0;
        for (PooledConnection c : connections.values()) {
            if (c.getProviderId().equals(providerId) && c.isActive() && !c.isRetired()) {
                count++;
            }
        }
        return count;
    }

    private PooledConnection createLocked(Provider provider, String reason) {
        String id = "conn_" + provider.getId() + "_" + connectionSeq.incrementAndGet();
        PooledConnection c = new PooledConnection(id, provider.getId(), clock.instant());
        connections.put(id, c);
        pendingEvents.add(new PendingEvent(RouterEventType.CONNECTION_CREATED, provider.getId(),
                Map.of("connectionId", id, "reason", reason, "total", connections.size())));
        return c;
    }

    private void destroyLocked(PooledConnection c, String reason) {
        if (connections.remove(c.getId()) == null) {
            return;
        }
        pendingEvents.add(new PendingEvent(RouterEventType.CONNECTION_EVICTED, c.getProviderId(),
                Map.of("connectionId", c.getId(), "reason", reason, "total", connections.size())));
    }

    private int scaleUpLocked(double utilization) {
        Map<String, Integer> busyByProvider = new TreeMap<>();
        for (PooledConnection c : connections.values()) {
            if (c.isBusy()) {
                busyByProvider.merge(c.getProviderId(), 1, Integer::sum);
            }
        }
        for (Waiter w : waiters) {
            busyByProvider.merge(w.providerId(), 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> mostLoaded = new ArrayList<>(busyByProvider.entrySet());
        mostLoaded.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        for (Map.Entry<String, Integer> entry : mostLoaded) {
            Provider provider = registry.find(entry.getKey()).orElse(null);
            if (provider != null && canCreateLocked(provider)) {
                PooledConnection c = createLocked(provider, "scale-up");
                pendingEvents.add(new PendingEvent(RouterEventType.POOL_SCALED_UP, provider.getId(),
                        Map.of("connectionId", c.getId(), "utilization", utilization, "total", connections.size())));
                serveWaiters();
                return 1;
            }
        }
        log.debug("Pool utilization {} above threshold but every loaded provider is at its ceiling", utilization);
        return 0;
    }

    private int scaleDownLocked(double utilization) {
        PooledConnection longestIdle = null;
        for (PooledConnection c : connections.values()) {
            if (!c.isBusy() && (longestIdle == null || c.getLastUsed().isBefore(longestIdle.getLastUsed()))) {
                longestIdle = c;
            }
        }
        if (longestIdle == null) {
            return 0;
        }
        destroyLocked(longestIdle, "scale-down");
        pendingEvents.add(new PendingEvent(RouterEventType.POOL_SCALED_DOWN, longestIdle.getProviderId(),
                Map.of("connectionId", longestIdle.getId(), "utilization", utilization, "total", connections.size())));
        return -1;
    }

    private double utilizationLocked() {
        return connections.isEmpty() ? 0.0 : (double) busyCountLocked() / connections.size();
    }

    private int busyCountLocked() {
        int busy = 0;
        for (PooledConnection c : connections.values()) {
            if (c.isBusy()) {
                busy++;
            }
        }
        return busy;
    }

    private boolean probeSafely(PooledConnection c) {
        try {
            return probe.probe(c);
        } catch (RuntimeException e) {
            log.warn("Probe of connection {} to {} failed: {}", c.getId(), c.getProviderId(), e.getMessage());
            return false;
        }
    }

    private void flushEvents() {
        List<PendingEvent> batch;
        lock.lock();
        try {
            if (pendingEvents.isEmpty()) {
                return;
            }
            batch = new ArrayList<>(pendingEvents);
            pendingEvents.clear();
        } finally {
            lock.unlock();
        }
        for (PendingEvent e : batch) {
            events.publish(e.type(), e.providerId(), e.attributes());
        }
    }

    private record Waiter(String providerId, int priority, long sequence, Instant enqueuedAt,
                          CompletableFuture<PooledConnection> future) {
    }

    private record PendingEvent(RouterEventType type, String providerId, Map<String, Object> attributes) {
    }
}
