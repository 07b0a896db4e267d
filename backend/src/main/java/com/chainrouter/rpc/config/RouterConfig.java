package com.chainrouter.rpc.config;

import com.chainrouter.common.RetryPolicy;
import com.chainrouter.common.Sleeper;
import com.chainrouter.config.AsyncConfig;
import com.chainrouter.rpc.dispatch.DispatchQueue;
import com.chainrouter.rpc.event.RouterEventBus;
import com.chainrouter.rpc.event.RouterEventListener;
import com.chainrouter.rpc.execution.RequestExecutor;
import com.chainrouter.rpc.health.HealthProbeService;
import com.chainrouter.rpc.health.ProviderHealthTracker;
import com.chainrouter.rpc.pool.ConnectionPool;
import com.chainrouter.rpc.pool.ConnectionProbe;
import com.chainrouter.rpc.registry.ProviderDescriptor;
import com.chainrouter.rpc.registry.ProviderRegistry;
import com.chainrouter.rpc.router.RpcResponseCache;
import com.chainrouter.rpc.router.RpcRouter;
import com.chainrouter.rpc.selection.ProviderSelector;
import com.chainrouter.rpc.transport.JsonRpcResponseParser;
import com.chainrouter.rpc.transport.RpcTransport;
import com.chainrouter.rpc.transport.WebClientRpcTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.Executor;

/**
 * Assembles one router instance from chainrouter.* properties. Providers listed under
 * chainrouter.rpc.providers are registered at startup; a malformed entry fails the context.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({ RpcRouterProperties.class, DispatchProperties.class, ConnectionPoolProperties.class, ResponseCacheProperties.class })
public class RouterConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RouterEventBus routerEventBus(Clock clock, ObjectProvider<RouterEventListener> listeners) {
        return new RouterEventBus(clock, listeners.orderedStream().toList());
    }

    @Bean
    public ProviderRegistry providerRegistry(RpcRouterProperties properties) {
        ProviderRegistry registry = new ProviderRegistry(properties.getSupportedChains());
        for (ProviderDescriptor descriptor : properties.getProviders()) {
            registry.register(descriptor);
        }
        log.info("RPC provider registry initialised with {} providers for chains {}", registry.size(), registry.chains());
        return registry;
    }

    @Bean
    public ProviderHealthTracker providerHealthTracker(ProviderRegistry registry, RouterEventBus events, Clock clock,
                                                       RpcRouterProperties properties) {
        return new ProviderHealthTracker(registry, events, clock, properties);
    }

    @Bean
    public ProviderSelector providerSelector(ProviderRegistry registry, ProviderHealthTracker tracker) {
        return new ProviderSelector(registry, tracker, new Random());
    }

    @Bean
    public RpcTransport rpcTransport(WebClient.Builder webClientBuilder) {
        return new WebClientRpcTransport(webClientBuilder);
    }

    @Bean
    public JsonRpcResponseParser jsonRpcResponseParser(ObjectMapper objectMapper) {
        return new JsonRpcResponseParser(objectMapper);
    }

    @Bean(name = "rpcLocalRateLimiter")
    public RateLimiter rpcLocalRateLimiter(RpcRouterProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLocalLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("rpc-local", config);
    }

    @Bean
    public RetryPolicy retryPolicy(RpcRouterProperties properties) {
        return new RetryPolicy(properties.getRetryDelayMs(), properties.getJitterFactor(), properties.getMaxRetries());
    }

    @Bean
    public RequestExecutor requestExecutor(ProviderRegistry registry,
                                           ProviderSelector selector,
                                           ProviderHealthTracker tracker,
                                           RpcTransport transport,
                                           JsonRpcResponseParser parser,
                                           @Qualifier("rpcLocalRateLimiter") RateLimiter rateLimiter,
                                           RetryPolicy retryPolicy,
                                           Clock clock,
                                           RpcRouterProperties properties) {
        return new RequestExecutor(registry, selector, tracker, transport, parser, rateLimiter, retryPolicy,
                Sleeper.threadSleep(), clock, properties);
    }

    @Bean
    public HealthProbeService healthProbeService(ProviderRegistry registry, ProviderHealthTracker tracker,
                                                 RpcTransport transport, JsonRpcResponseParser parser, Clock clock,
                                                 RpcRouterProperties properties) {
        return new HealthProbeService(registry, tracker, transport, parser, clock, properties);
    }

    @Bean(destroyMethod = "")
    public DispatchQueue dispatchQueue(ProviderSelector selector, RequestExecutor executor,
                                       @Qualifier(AsyncConfig.RPC_DISPATCH_EXECUTOR) Executor dispatchExecutor,
                                       Clock clock, DispatchProperties properties) {
        return new DispatchQueue(selector, executor, dispatchExecutor, clock, properties);
    }

    /**
     * Pooled connections are probed with the same canonical call as provider health checks.
     */
    @Bean(destroyMethod = "")
    public ConnectionPool connectionPool(ProviderRegistry registry, RouterEventBus events, HealthProbeService probeService,
                                         Clock clock, ConnectionPoolProperties properties) {
        ConnectionProbe probe = connection -> probeService.probe(connection.getProviderId()).healthy();
        return new ConnectionPool(registry, events, properties.getStrategy().create(new Random()), probe, clock, properties);
    }

    @Bean
    public RpcResponseCache rpcResponseCache(ResponseCacheProperties properties, ObjectMapper objectMapper) {
        return new RpcResponseCache(properties, objectMapper, Ticker.systemTicker());
    }

    @Bean(destroyMethod = "shutdown")
    public RpcRouter rpcRouter(ProviderRegistry registry,
                               ProviderHealthTracker tracker,
                               ProviderSelector selector,
                               RequestExecutor executor,
                               DispatchQueue dispatchQueue,
                               ConnectionPool pool,
                               RpcResponseCache cache,
                               RouterEventBus events,
                               @Qualifier(AsyncConfig.RPC_BATCH_EXECUTOR) Executor batchExecutor,
                               RetryPolicy retryPolicy,
                               Clock clock) {
        return new RpcRouter(registry, tracker, selector, executor, dispatchQueue, pool, cache, events, batchExecutor,
                clock, retryPolicy.getMaxRetries());
    }
}
