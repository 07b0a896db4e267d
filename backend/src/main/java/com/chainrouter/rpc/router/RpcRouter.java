package com.chainrouter.rpc.router;

import com.chainrouter.domain.Provider;
import com.chainrouter.domain.RpcRequest;
import com.chainrouter.domain.RpcResponse;
import com.chainrouter.domain.Urgency;
import com.chainrouter.rpc.dispatch.DispatchQueue;
import com.chainrouter.rpc.dispatch.QueuedCall;
import com.chainrouter.rpc.event.RouterEventBus;
import com.chainrouter.rpc.event.RouterEventType;
import com.chainrouter.rpc.execution.RequestExecutor;
import com.chainrouter.rpc.health.ProviderHealthTracker;
import com.chainrouter.rpc.health.ProviderMetricsSnapshot;
import com.chainrouter.rpc.pool.ConnectionPool;
import com.chainrouter.rpc.pool.PooledConnection;
import com.chainrouter.rpc.registry.ProviderDescriptor;
import com.chainrouter.rpc.registry.ProviderRegistry;
import com.chainrouter.rpc.selection.ProviderSelector;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Entry point for application code: synchronous, batched and queued calls, pooled connections,
 * provider administration and metrics. Each instance owns its own registry, tracker, queue and pool.
 */
@Slf4j
public class RpcRouter {

    static final int DEFAULT_ACQUIRE_PRIORITY = 0;

    private final ProviderRegistry registry;
    private final ProviderHealthTracker tracker;
    private final ProviderSelector selector;
    private final RequestExecutor executor;
    private final DispatchQueue dispatchQueue;
    private final ConnectionPool pool;
    private final RpcResponseCache cache;
    private final RouterEventBus events;
    private final Executor batchExecutor;
    private final Clock clock;
    private final int maxRetries;

    public RpcRouter(ProviderRegistry registry,
                     ProviderHealthTracker tracker,
                     ProviderSelector selector,
                     RequestExecutor executor,
                     DispatchQueue dispatchQueue,
                     ConnectionPool pool,
                     RpcResponseCache cache,
                     RouterEventBus events,
                     Executor batchExecutor,
                     Clock clock,
                     int maxRetries) {
        this.registry = registry;
        this.tracker = tracker;
        this.selector = selector;
        this.executor = executor;
        this.dispatchQueue = dispatchQueue;
        this.pool = pool;
        this.cache = cache;
        this.events = events;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
        this.maxRetries = maxRetries;
    }

    public RpcResponse call(String chain, String method, List<?> params) {
        return call(chain, method, params, Urgency.MEDIUM);
    }

    /**
     * Executes the call now. Cacheable read methods are answered from the response cache unless
     * the urgency is {@link Urgency#CRITICAL}.
     */
    public RpcResponse call(String chain, String method, List<?> params, Urgency urgency) {
        RpcRequest request = newRequest(chain, method, params, urgency);
        boolean useCache = request.getUrgency() != Urgency.CRITICAL;
        if (useCache) {
            RpcResponse cached = cache.get(request.getChain(), method, request.getParams()).orElse(null);
            if (cached != null) {
                log.debug("Cache hit for {} on {}", method, request.getChain());
                return cached.asCached(request.getId());
            }
        }
        RpcResponse response = executor.execute(request);
        cache.put(request.getChain(), method, request.getParams(), response);
        return response;
    }

    /**
     * Runs the calls concurrently and returns their responses in input order. The first failure is
     * rethrown once every call has settled.
     */
    public List<RpcResponse> batchCall(String chain, List<RpcCall> calls) {
        String normalized = registry.requireSupportedChain(chain);
        List<CompletableFuture<RpcResponse>> futures = new ArrayList<>(calls.size());
        for (RpcCall call : calls) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> call(normalized, call.method(), call.params(), call.urgency()), batchExecutor));
        }
        List<RpcResponse> responses = new ArrayList<>(futures.size());
        RuntimeException firstFailure = null;
        for (CompletableFuture<RpcResponse> future : futures) {
            try {
                responses.add(future.join());
            } catch (CompletionException e) {
                if (firstFailure == null) {
                    firstFailure = e.getCause() instanceof RuntimeException re ? re : e;
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        return responses;
    }

    public QueuedCall queueCall(String chain, String method, List<?> params) {
        return queueCall(chain, method, params, Urgency.MEDIUM);
    }

    public QueuedCall queueCall(String chain, String method, List<?> params, Urgency urgency) {
        return dispatchQueue.enqueue(newRequest(chain, method, params, urgency));
    }

    public PooledConnection acquireConnection(String providerId) {
        return acquireConnection(providerId, DEFAULT_ACQUIRE_PRIORITY);
    }

    public PooledConnection acquireConnection(String providerId, int priority) {
        return pool.acquire(providerId, priority);
    }

    public void release(PooledConnection connection) {
        pool.release(connection.getId());
    }

    public void release(PooledConnection connection, long latencyMs, boolean success) {
        pool.release(connection.getId(), latencyMs, success);
    }

    public Provider registerProvider(ProviderDescriptor descriptor) {
        Provider provider = registry.register(descriptor);
        events.publish(RouterEventType.PROVIDER_REGISTERED, provider.getId(),
                Map.of("chain", provider.getChain(), "tier", provider.getTier().name()));
        return provider;
    }

    public void deactivateProvider(String providerId) {
        setActive(providerId, false);
    }

    public void activateProvider(String providerId) {
        setActive(providerId, true);
    }

    /**
     * Unregisters the provider, drops its metrics and closes its pooled connections.
     */
    public void removeProvider(String providerId) {
        Provider provider = registry.require(providerId);
        registry.remove(providerId);
        tracker.forget(providerId);
        int evicted = pool.evictProvider(providerId);
        events.publish(RouterEventType.PROVIDER_REMOVED, providerId,
                Map.of("chain", provider.getChain(), "connectionsEvicted", evicted));
    }

    public void setProviderPriority(String providerId, int priority) {
        registry.setPriority(providerId, priority);
    }

    /**
     * Rewards cheap, reliable providers: priority = floor(successful / (costToday + 1) * 100).
     *
     * @return new priority per provider id
     */
    public Map<String, Integer> optimizeForCost() {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        for (Provider provider : registry.all()) {
            ProviderMetricsSnapshot m = tracker.snapshot(provider.getId());
            int priority = (int) Math.floor(m.successfulRequests() / (m.costToday() + 1) * 100);
            provider.setPriority(priority);
            priorities.put(provider.getId(), priority);
        }
        events.publish(RouterEventType.PRIORITIES_OPTIMIZED, null, Map.of("strategy", "cost", "priorities", priorities));
        return priorities;
    }

    /**
     * Rewards fast providers: priority = floor(1000 / (avgLatencyMs + 1)).
     *
     * @return new priority per provider id
     */
    public Map<String, Integer> optimizeForSpeed() {
        Map<String, Integer> priorities = new LinkedHashMap<>();
        for (Provider provider : registry.all()) {
            ProviderMetricsSnapshot m = tracker.snapshot(provider.getId());
            int priority = (int) Math.floor(1000 / (m.avgLatencyMs() + 1));
            provider.setPriority(priority);
            priorities.put(provider.getId(), priority);
        }
        events.publish(RouterEventType.PRIORITIES_OPTIMIZED, null, Map.of("strategy", "speed", "priorities", priorities));
        return priorities;
    }

    public RouterMetrics getMetrics() {
        Map<String, ProviderMetricsSnapshot> snapshots = tracker.snapshots();
        long total = 0;
        long successful = 0;
        long failed = 0;
        double latencySum = 0;
        int latencySamples = 0;
        int healthy = 0;
        int blacklisted = 0;
        for (ProviderMetricsSnapshot s : snapshots.values()) {
            total += s.totalRequests();
            successful += s.successfulRequests();
            failed += s.failedRequests();
            if (s.avgLatencyMs() > 0) {
                latencySum += s.avgLatencyMs();
                latencySamples++;
            }
            if (s.healthy()) {
                healthy++;
            }
            if (s.blacklisted()) {
                blacklisted++;
            }
        }
        return new RouterMetrics(
                total,
                successful,
                failed,
                total == 0 ? 1.0 : (double) successful / total,
                latencySamples == 0 ? 0.0 : latencySum / latencySamples,
                snapshots.size(),
                healthy,
                blacklisted,
                tracker.costSummary(),
                dispatchQueue.depths(),
                pool.stats(),
                cache.size(),
                snapshots,
                clock.instant());
    }

    public List<ProviderStatus> getProviderStatus() {
        return toStatus(registry.all());
    }

    public List<ProviderStatus> getProviderStatus(String chain) {
        return toStatus(registry.forChain(registry.requireSupportedChain(chain)));
    }

    /**
     * Fails queued calls and drains the pool.
     */
    public void shutdown() {
        log.info("RPC router shutting down");
        dispatchQueue.shutdown();
        pool.drain(Duration.ofSeconds(30));
    }

    private void setActive(String providerId, boolean active) {
        if (registry.setActive(providerId, active)) {
            events.publish(RouterEventType.PROVIDER_STATUS_CHANGED, providerId, Map.of("active", active));
        }
    }

    private RpcRequest newRequest(String chain, String method, List<?> params, Urgency urgency) {
        String normalized = registry.requireSupportedChain(chain);
        return RpcRequest.of(normalized, method, params, urgency, maxRetries, clock.instant());
    }

    private List<ProviderStatus> toStatus(List<Provider> providers) {
        List<ProviderStatus> out = new ArrayList<>(providers.size());
        for (Provider p : providers) {
            String id = p.getId();
            out.add(new ProviderStatus(
                    id,
                    p.getName(),
                    p.getChain(),
                    p.getTier(),
                    p.getUrl(),
                    p.getPriority(),
                    p.isActive(),
                    p.getRateLimit(),
                    p.getCostPer1000(),
                    tracker.dailyBudget(id),
                    tracker.isBlacklisted(id),
                    tracker.isOverBudget(id),
                    selector.isEligible(p),
                    tracker.snapshot(id)));
        }
        out.sort(Comparator.comparingInt(ProviderStatus::priority).reversed().thenComparing(ProviderStatus::id));
        return out;
    }
}
