package com.chainrouter.rpc.health;

import com.chainrouter.domain.Provider;
import com.chainrouter.rpc.config.RpcRouterProperties;
import com.chainrouter.rpc.registry.ProviderRegistry;
import com.chainrouter.rpc.transport.JsonRpcResponseParser;
import com.chainrouter.rpc.transport.RpcTransport;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Issues one cheap canonical call against every registered provider concurrently and feeds the
 * results into the tracker.
 */
@Slf4j
public class HealthProbeService {

    static final String SOLANA = "solana";
    static final String SOLANA_PROBE_METHOD = "getHealth";
    static final String EVM_PROBE_METHOD = "eth_blockNumber";

    private final ProviderRegistry registry;
    private final ProviderHealthTracker tracker;
    private final RpcTransport transport;
    private final JsonRpcResponseParser parser;
    private final Clock clock;
    private final long defaultTimeoutMs;

    public HealthProbeService(ProviderRegistry registry, ProviderHealthTracker tracker, RpcTransport transport,
                              JsonRpcResponseParser parser, Clock clock, RpcRouterProperties properties) {
        this.registry = registry;
        this.tracker = tracker;
        this.transport = transport;
        this.parser = parser;
        this.clock = clock;
        this.defaultTimeoutMs = properties.getRequestTimeoutMs();
    }

    public List<ProbeResult> probeAll() {
        List<Provider> providers = registry.all();
        if (providers.isEmpty()) {
            return List.of();
        }
        List<ProbeResult> results = Flux.fromIterable(providers)
                .flatMap(this::probeMono)
                .collectList()
                .block();
        if (results == null) {
            return List.of();
        }
        for (ProbeResult result : results) {
            if (result.healthy()) {
                tracker.recordProbeSuccess(result.providerId(), result.latencyMs());
            } else {
                tracker.recordProbeFailure(result.providerId(), result.error());
            }
        }
        long healthy = results.stream().filter(ProbeResult::healthy).count();
        log.debug("Health probe round: {}/{} providers healthy", healthy, results.size());
        return results;
    }

    /**
     * Probes one provider without recording the result. Used by the connection pool's health checks.
     */
    public ProbeResult probe(String providerId) {
        Provider provider = registry.require(providerId);
        ProbeResult result = probeMono(provider).block();
        return result != null ? result : ProbeResult.failure(providerId, 0L, "no probe result");
    }

    static String probeMethod(String chain) {
        return SOLANA.equals(chain) ? SOLANA_PROBE_METHOD : EVM_PROBE_METHOD;
    }

    private Mono<ProbeResult> probeMono(Provider provider) {
        return Mono.defer(() -> {
            long start = clock.millis();
            String method = probeMethod(provider.getChain());
            Duration timeout = Duration.ofMillis(provider.getTimeoutMs() != null ? provider.getTimeoutMs() : defaultTimeoutMs);
            return transport.call(provider, "health_" + provider.getId(), method, List.of(), timeout)
                    .map(body -> {
                        parser.parseResult(provider.getId(), method, body);
                        return ProbeResult.success(provider.getId(), clock.millis() - start);
                    })
                    .switchIfEmpty(Mono.fromSupplier(() ->
                            ProbeResult.failure(provider.getId(), clock.millis() - start, method + " returned no body")))
                    .onErrorResume(e -> Mono.just(ProbeResult.failure(provider.getId(), clock.millis() - start, messageOf(e))));
        });
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
