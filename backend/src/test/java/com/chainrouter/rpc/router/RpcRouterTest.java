package com.chainrouter.rpc.router;

import com.chainrouter.common.RetryPolicy;
import com.chainrouter.domain.ProviderTier;
import com.chainrouter.domain.RpcResponse;
import com.chainrouter.domain.Urgency;
import com.chainrouter.rpc.config.ConnectionPoolProperties;
import com.chainrouter.rpc.config.DispatchProperties;
import com.chainrouter.rpc.config.ResponseCacheProperties;
import com.chainrouter.rpc.config.RpcRouterProperties;
import com.chainrouter.rpc.dispatch.DispatchQueue;
import com.chainrouter.rpc.dispatch.QueuedCall;
import com.chainrouter.rpc.error.ProviderErrorException;
import com.chainrouter.rpc.error.RpcException;
import com.chainrouter.rpc.event.RouterEvent;
import com.chainrouter.rpc.event.RouterEventBus;
import com.chainrouter.rpc.event.RouterEventType;
import com.chainrouter.rpc.execution.RequestExecutor;
import com.chainrouter.rpc.health.ProviderHealthTracker;
import com.chainrouter.rpc.pool.ConnectionPool;
import com.chainrouter.rpc.pool.PooledConnection;
import com.chainrouter.rpc.pool.RoundRobinStrategy;
import com.chainrouter.rpc.registry.ProviderConfigurationException;
import com.chainrouter.rpc.registry.ProviderRegistry;
import com.chainrouter.rpc.registry.UnknownProviderException;
import com.chainrouter.rpc.selection.ProviderSelector;
import com.chainrouter.rpc.transport.JsonRpcResponseParser;
import com.chainrouter.support.MutableClock;
import com.chainrouter.support.RecordingSleeper;
import com.chainrouter.support.StubRpcTransport;
import com.chainrouter.support.TestProviders;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import static com.chainrouter.support.TestProviders.descriptor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpcRouterTest {

    private MutableClock clock;
    private AtomicLong tickerNanos;
    private ProviderRegistry registry;
    private ProviderHealthTracker tracker;
    private StubRpcTransport transport;
    private DispatchQueue queue;
    private ConnectionPool pool;
    private List<RouterEvent> published;
    private ExecutorService batchPool;
    private List<Runnable> dispatched;
    private RpcRouter router;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        tickerNanos = new AtomicLong();
        registry = TestProviders.registry(
                descriptor("A", "ethereum", ProviderTier.PREMIUM),
                descriptor("B", "ethereum", ProviderTier.STANDARD),
                descriptor("P", "polygon", ProviderTier.FALLBACK));
        RpcRouterProperties props = TestProviders.properties();
        RouterEventBus events = new RouterEventBus(clock);
        published = new CopyOnWriteArrayList<>();
        events.subscribe(published::add);
        tracker = new ProviderHealthTracker(registry, events, clock, props);
        ProviderSelector selector = new ProviderSelector(registry, tracker, new Random(11));
        transport = new StubRpcTransport();
        echoMethod("A");
        echoMethod("B");
        echoMethod("P");
        RateLimiter limiter = RateLimiter.of("router-test", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(1_000_000)
                .timeoutDuration(Duration.ofMillis(1))
                .build());
        RetryPolicy retryPolicy = new RetryPolicy(10L, 0.0, props.getMaxRetries());
        RequestExecutor executor = new RequestExecutor(registry, selector, tracker, transport,
                new JsonRpcResponseParser(new ObjectMapper()), limiter, retryPolicy,
                new RecordingSleeper(), clock, props);
        dispatched = new ArrayList<>();
        queue = new DispatchQueue(selector, executor, dispatched::add, clock, new DispatchProperties());
        ConnectionPoolProperties poolProps = new ConnectionPoolProperties();
        poolProps.setConnectionTimeoutMs(100L);
        pool = new ConnectionPool(registry, events, new RoundRobinStrategy(), conn -> true, clock, poolProps);
        RpcResponseCache cache = new RpcResponseCache(new ResponseCacheProperties(), new ObjectMapper(), tickerNanos::get);
        batchPool = Executors.newFixedThreadPool(4);
        router = new RpcRouter(registry, tracker, selector, executor, queue, pool, cache, events, batchPool, clock,
                retryPolicy.getMaxRetries());
    }

    @AfterEach
    void tearDown() {
        batchPool.shutdownNow();
    }

    @Test
    void call_cacheableMethod_secondCallServedFromCache() {
        RpcResponse first = router.call("ethereum", "eth_blockNumber", List.of());
        RpcResponse second = router.call("ethereum", "eth_blockNumber", List.of());

        assertThat(transport.calls()).hasSize(1);
        assertThat(first.cached()).isFalse();
        assertThat(second.cached()).isTrue();
        assertThat(second.attempts()).isZero();
        assertThat(second.requestId()).isNotEqualTo(first.requestId());
        assertThat(second.result()).isEqualTo(first.result());

        tickerNanos.addAndGet(Duration.ofSeconds(1).toNanos());
        router.call("ethereum", "eth_blockNumber", List.of());
        assertThat(transport.calls()).hasSize(2);
    }

    @Test
    void call_critical_bypassesCache() {
        router.call("ethereum", "eth_gasPrice", List.of());
        RpcResponse critical = router.call("ethereum", "eth_gasPrice", List.of(), Urgency.CRITICAL);

        assertThat(critical.cached()).isFalse();
        assertThat(transport.calls()).hasSize(2);
    }

    @Test
    void call_nonCacheableMethod_alwaysHitsNetwork() {
        router.call("ethereum", "eth_chainId", List.of());
        router.call("ethereum", "eth_chainId", List.of());

        assertThat(transport.calls()).hasSize(2);
    }

    @Test
    void call_chainNameIsNormalized() {
        RpcResponse response = router.call("Polygon", "eth_chainId", List.of());

        assertThat(response.providerId()).isEqualTo("P");
    }

    @Test
    void call_unsupportedChain_isRejected() {
        assertThatThrownBy(() -> router.call("dogecoin", "eth_blockNumber", List.of()))
                .isInstanceOf(ProviderConfigurationException.class)
                .hasMessageContaining("dogecoin");
    }

    @Test
    void batchCall_returnsResponsesInInputOrder() {
        List<RpcResponse> responses = router.batchCall("ethereum", List.of(
                RpcCall.of("eth_chainId"),
                RpcCall.of("eth_gasPrice"),
                RpcCall.of("eth_getBalance", "0xaaa", "latest")));

        assertThat(responses).extracting(r -> r.result().asText())
                .containsExactly("eth_chainId", "eth_gasPrice", "eth_getBalance");
    }

    @Test
    void batchCall_anyFailure_surfacesFirstError() {
        transport.handle("A", RpcRouterTest::revertOnEstimate).handle("B", RpcRouterTest::revertOnEstimate);

        assertThatThrownBy(() -> router.batchCall("ethereum", List.of(
                RpcCall.of("eth_chainId"),
                RpcCall.of("eth_estimateGas", Map.of("to", "0xdead")))))
                .isInstanceOf(ProviderErrorException.class)
                .hasMessageContaining("execution reverted");
    }

    @Test
    void queueCall_waitsForDispatchTick() {
        QueuedCall call = router.queueCall("ethereum", "eth_chainId", List.of());

        assertThat(call).isNotDone();
        assertThat(router.getMetrics().queueDepths()).containsEntry("ethereum", 1);

        queue.drainOnce();
        dispatched.forEach(Runnable::run);

        assertThat(call.join().result().asText()).isEqualTo("eth_chainId");
        assertThat(queue.depth("ethereum")).isZero();
    }

    @Test
    void acquireAndRelease_goThroughThePool() {
        PooledConnection c = router.acquireConnection("A");
        assertThat(router.getMetrics().pool().busyConnections()).isEqualTo(1);

        router.release(c, 25L, true);

        assertThat(router.getMetrics().pool().busyConnections()).isZero();
        assertThat(c.getAvgResponseTimeMs()).isEqualTo(25.0);
    }

    @Test
    void registerProvider_emitsEventAndBecomesSelectable() {
        router.registerProvider(descriptor("S", "solana", ProviderTier.PREMIUM));
        echoMethod("S");

        assertThat(router.call("solana", "getSlot", List.of()).providerId()).isEqualTo("S");
        assertThat(published).anyMatch(e -> e.type() == RouterEventType.PROVIDER_REGISTERED && "S".equals(e.providerId()));
    }

    @Test
    void deactivateProvider_emitsEventOnlyOnChange() {
        router.deactivateProvider("A");
        router.deactivateProvider("A");

        assertThat(published).filteredOn(e -> e.type() == RouterEventType.PROVIDER_STATUS_CHANGED)
                .singleElement()
                .satisfies(e -> assertThat(e.attribute("active")).isEqualTo(false));
        assertThat(router.call("ethereum", "eth_chainId", List.of(), Urgency.CRITICAL).providerId()).isEqualTo("B");

        router.activateProvider("A");
        assertThat(router.getProviderStatus("ethereum")).filteredOn(s -> s.id().equals("A"))
                .singleElement().satisfies(s -> assertThat(s.eligible()).isTrue());
    }

    @Test
    void deactivateProvider_unknownId_throws() {
        assertThatThrownBy(() -> router.deactivateProvider("ghost")).isInstanceOf(UnknownProviderException.class);
    }

    @Test
    void removeProvider_dropsMetricsAndEvictsConnections() {
        router.call("ethereum", "eth_chainId", List.of(), Urgency.CRITICAL);
        PooledConnection held = router.acquireConnection("A");

        router.removeProvider("A");

        assertThat(registry.find("A")).isEmpty();
        assertThat(router.getMetrics().providers()).doesNotContainKey("A");
        assertThat(published).filteredOn(e -> e.type() == RouterEventType.PROVIDER_REMOVED)
                .singleElement()
                .satisfies(e -> assertThat(e.attribute("connectionsEvicted")).isEqualTo(1));
        router.release(held);
        assertThat(router.getMetrics().pool().totalConnections()).isZero();
        assertThat(router.call("ethereum", "eth_chainId", List.of()).providerId()).isEqualTo("B");
    }

    @Test
    void optimizeForCost_rewardsCheapReliableProviders() {
        for (int i = 0; i < 4; i++) {
            tracker.recordOutcome("A", true, 50L);
            tracker.recordCost("A", 0.001);
        }

        Map<String, Integer> priorities = router.optimizeForCost();

        assertThat(priorities).containsEntry("A", 398).containsEntry("B", 0).containsEntry("P", 0);
        assertThat(registry.require("A").getPriority()).isEqualTo(398);
        assertThat(published).anyMatch(e -> e.type() == RouterEventType.PRIORITIES_OPTIMIZED
                && "cost".equals(e.attribute("strategy")));
    }

    @Test
    void optimizeForSpeed_rewardsLowLatency() {
        tracker.recordOutcome("A", true, 99L);

        Map<String, Integer> priorities = router.optimizeForSpeed();

        assertThat(priorities).containsEntry("A", 10).containsEntry("B", 1000);
        assertThat(router.getProviderStatus("ethereum")).extracting(ProviderStatus::id).containsExactly("B", "A");
    }

    @Test
    void getProviderStatus_sortedByPriorityThenId() {
        router.setProviderPriority("P", 7);

        assertThat(router.getProviderStatus()).extracting(ProviderStatus::id).containsExactly("P", "A", "B");
    }

    @Test
    void getMetrics_aggregatesAcrossProviders() {
        router.call("ethereum", "eth_blockNumber", List.of(), Urgency.CRITICAL);
        transport.failTransport("P");
        assertThatThrownBy(() -> router.call("polygon", "eth_chainId", List.of()))
                .isInstanceOf(RpcException.class);

        RouterMetrics metrics = router.getMetrics();

        assertThat(metrics.totalProviders()).isEqualTo(3);
        assertThat(metrics.totalRequests()).isEqualTo(5);
        assertThat(metrics.successfulRequests()).isEqualTo(1);
        assertThat(metrics.failedRequests()).isEqualTo(4);
        assertThat(metrics.successRate()).isEqualTo(0.2);
        assertThat(metrics.cachedResponses()).isEqualTo(1);
        assertThat(metrics.costs().dailyTotal()).isPositive();
        assertThat(metrics.timestamp()).isEqualTo(clock.instant());
    }

    @Test
    void shutdown_failsQueuedCallsAndDrainsPool() {
        QueuedCall pending = router.queueCall("ethereum", "eth_chainId", List.of());

        router.shutdown();

        assertThat(pending).isCompletedExceptionally();
        assertThat(router.getMetrics().pool().draining()).isTrue();
    }

    private void echoMethod(String providerId) {
        transport.handle(providerId, method -> Mono.just(StubRpcTransport.envelope("\"" + method + "\"")));
    }

    private static Mono<String> revertOnEstimate(String method) {
        if (method.equals("eth_estimateGas")) {
            return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"error\":{\"code\":3,\"message\":\"execution reverted\"}}");
        }
        return Mono.just(StubRpcTransport.envelope("\"" + method + "\""));
    }
}
