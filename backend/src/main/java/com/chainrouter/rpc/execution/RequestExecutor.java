package com.chainrouter.rpc.execution;

import com.chainrouter.common.RetryPolicy;
import com.chainrouter.common.Sleeper;
import com.chainrouter.domain.Provider;
import com.chainrouter.domain.RpcRequest;
import com.chainrouter.domain.RpcResponse;
import com.chainrouter.rpc.config.RpcRouterProperties;
import com.chainrouter.rpc.error.NoProviderAvailableException;
import com.chainrouter.rpc.error.ProviderErrorException;
import com.chainrouter.rpc.error.RetriesExhaustedException;
import com.chainrouter.rpc.error.RpcException;
import com.chainrouter.rpc.error.TransportException;
import com.chainrouter.rpc.health.ProviderHealthTracker;
import com.chainrouter.rpc.registry.ProviderRegistry;
import com.chainrouter.rpc.selection.ProviderSelector;
import com.chainrouter.rpc.selection.ScoredProvider;
import com.chainrouter.rpc.transport.JsonRpcResponseParser;
import com.chainrouter.rpc.transport.RpcTransport;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Executes one logical request with failover and exponential backoff.
 * <p>
 * Failover and retry stay orthogonal: every retry is a new attempt of the same request, and it
 * excludes the provider that just failed unless that provider is the only one left. Non-transient
 * JSON-RPC errors are the caller's problem and are surfaced on the first occurrence.
 */
@Slf4j
public class RequestExecutor {

    private final ProviderRegistry registry;
    private final ProviderSelector selector;
    private final ProviderHealthTracker tracker;
    private final RpcTransport transport;
    private final JsonRpcResponseParser parser;
    private final RateLimiter localLimiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final long defaultTimeoutMs;
    private final long limiterLogThresholdMs;

    public RequestExecutor(ProviderRegistry registry,
                           ProviderSelector selector,
                           ProviderHealthTracker tracker,
                           RpcTransport transport,
                           JsonRpcResponseParser parser,
                           RateLimiter localLimiter,
                           RetryPolicy retryPolicy,
                           Sleeper sleeper,
                           Clock clock,
                           RpcRouterProperties properties) {
        this.registry = registry;
        this.selector = selector;
        this.tracker = tracker;
        this.transport = transport;
        this.parser = parser;
        this.localLimiter = localLimiter;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.defaultTimeoutMs = properties.getRequestTimeoutMs();
        this.limiterLogThresholdMs = properties.getLocalLimiterLogThresholdMs();
    }

    /**
     * @throws NoProviderAvailableException when no provider is eligible for the first attempt
     * @throws ProviderErrorException       when a provider answers with a non-transient JSON-RPC error
     * @throws RetriesExhaustedException    after {@code maxRetries + 1} failed attempts
     */
    public RpcResponse execute(RpcRequest request) {
        List<String> attempted = new ArrayList<>();
        String lastFailed = null;
        RpcException lastError = null;
        int attempts = 0;
        while (true) {
            Optional<Provider> candidate = attempts == 0 ? firstCandidate(request) : retryCandidate(request, lastFailed);
            if (candidate.isEmpty()) {
                if (attempts == 0) {
                    throw new NoProviderAvailableException(request.getChain());
                }
                lastError = new NoProviderAvailableException(request.getChain());
                log.warn("No provider for retry {} of {}", request.getRetryCount(), request);
            } else {
                Provider provider = candidate.get();
                attempted.add(provider.getId());
                try {
                    return attempt(request, provider, attempts + 1);
                } catch (ProviderErrorException e) {
                    if (!e.isTransientError()) {
                        throw e;
                    }
                    lastError = e;
                } catch (TransportException e) {
                    lastError = e;
                }
                lastFailed = provider.getId();
                log.warn("RPC {} on {} failed via {} (attempt {}/{}): {}", request.getMethod(), request.getChain(),
                        provider.getId(), attempts + 1, request.getMaxRetries() + 1, messageOf(lastError));
            }
            attempts++;
            if (request.getRetryCount() >= request.getMaxRetries()) {
                throw new RetriesExhaustedException(request.getChain(), request.getMethod(), attempted, attempts, lastError);
            }
            int retry = request.incrementRetryCount();
            backoff(retryPolicy.delayMs(retry));
        }
    }

    private Optional<Provider> firstCandidate(RpcRequest request) {
        if (request.getPinnedProviderId() != null) {
            Optional<Provider> pinned = registry.find(request.getPinnedProviderId())
                    .filter(p -> p.getChain().equals(request.getChain()))
                    .filter(selector::isEligible);
            if (pinned.isPresent()) {
                return pinned;
            }
            log.debug("Pinned provider {} no longer eligible for {}, reselecting", request.getPinnedProviderId(), request);
        }
        return selector.selectProviders(request.getChain(), request.getUrgency()).stream().findFirst();
    }

    private Optional<Provider> retryCandidate(RpcRequest request, String lastFailed) {
        Set<String> excluded = lastFailed != null ? Set.of(lastFailed) : Set.of();
        Optional<Provider> next = selector.selectProviders(request.getChain(), request.getUrgency(), excluded)
                .stream().findFirst();
        if (next.isPresent() || lastFailed == null) {
            return next;
        }
        List<ScoredProvider> survivors = selector.rank(request.getChain(), Set.of());
        if (survivors.size() == 1 && survivors.get(0).provider().getId().equals(lastFailed)) {
            return Optional.of(survivors.get(0).provider());
        }
        return Optional.empty();
    }

    private RpcResponse attempt(RpcRequest request, Provider provider, int attemptNumber) {
        acquirePermit(request, provider);
        String id = provider.getId();
        Duration timeout = Duration.ofMillis(provider.getTimeoutMs() != null ? provider.getTimeoutMs() : defaultTimeoutMs);
        long start = clock.millis();
        try {
            String body = transport.call(provider, request.getId(), request.getMethod(), request.getParams(), timeout).block();
            JsonNode result = parser.parseResult(id, request.getMethod(), body);
            long latency = clock.millis() - start;
            tracker.recordOutcome(id, true, latency);
            tracker.recordCost(id, provider.costPerCall());
            log.debug("RPC {} on {} served by {} in {} ms", request.getMethod(), request.getChain(), id, latency);
            return new RpcResponse(request.getId(), result, id, latency, attemptNumber, false);
        } catch (ProviderErrorException e) {
            long latency = clock.millis() - start;
            if (e.isTransientError()) {
                tracker.recordOutcome(id, false, latency);
            } else {
                tracker.recordOutcome(id, true, latency);
                tracker.recordCost(id, provider.costPerCall());
            }
            throw e;
        } catch (TransportException e) {
            tracker.recordOutcome(id, false, null);
            throw e;
        } catch (RuntimeException e) {
            tracker.recordOutcome(id, false, null);
            throw new TransportException(id, request.getMethod() + " to " + id + " failed: " + messageOf(e), e);
        }
    }

    /**
     * Local limiter timeouts fail the attempt without counting against the provider.
     */
    private void acquirePermit(RpcRequest request, Provider provider) {
        long acquireStart = System.nanoTime();
        boolean permitted = localLimiter.acquirePermission();
        long waitedMs = (System.nanoTime() - acquireStart) / 1_000_000L;
        if (!permitted) {
            throw new TransportException(provider.getId(),
                    "Local limiter timeout before " + request.getMethod() + " on " + provider.getId());
        }
        if (waitedMs >= Math.max(1L, limiterLogThresholdMs)) {
            log.info("Local RPC limiter delayed {} ms before {} on {}", waitedMs, request.getMethod(), provider.getId());
        }
    }

    private void backoff(long delayMs) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted during retry backoff", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null || e.getMessage() == null || e.getMessage().isBlank()) {
            return "unknown";
        }
        return e.getMessage();
    }
}
