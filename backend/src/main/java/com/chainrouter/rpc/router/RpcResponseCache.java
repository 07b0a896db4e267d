package com.chainrouter.rpc.router;

import com.chainrouter.domain.RpcResponse;
import com.chainrouter.rpc.config.ResponseCacheProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Short-lived results of read-only methods, keyed by chain, method and serialized params.
 * TTL depends on the method; anything not listed is never cached.
 */
@Slf4j
public class RpcResponseCache {

    static final Map<String, Duration> TTL_BY_METHOD = Map.of(
            "eth_blockNumber", Duration.ofSeconds(1),
            "eth_gasPrice", Duration.ofSeconds(5),
            "eth_getBalance", Duration.ofSeconds(10),
            "eth_getTransactionCount", Duration.ofSeconds(10),
            "eth_call", Duration.ofSeconds(30),
            "getHealth", Duration.ofSeconds(60));

    private final boolean enabled;
    private final ObjectMapper objectMapper;
    private final Cache<String, Entry> cache;

    public RpcResponseCache(ResponseCacheProperties properties, ObjectMapper objectMapper, Ticker ticker) {
        this.enabled = properties.isEnabled();
        this.objectMapper = objectMapper;
        this.cache = Caffeine.newBuilder()
                .maximumSize(properties.getMaxSize())
                .expireAfter(new PerMethodExpiry())
                .ticker(ticker)
                .build();
    }

    public static boolean isCacheable(String method) {
        return TTL_BY_METHOD.containsKey(method);
    }

    public Optional<RpcResponse> get(String chain, String method, List<?> params) {
        if (!enabled || !isCacheable(method)) {
            return Optional.empty();
        }
        String key = key(chain, method, params);
        if (key == null) {
            return Optional.empty();
        }
        Entry entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.response());
    }

    public void put(String chain, String method, List<?> params, RpcResponse response) {
        if (!enabled || !isCacheable(method)) {
            return;
        }
        String key = key(chain, method, params);
        if (key != null) {
            cache.put(key, new Entry(response, TTL_BY_METHOD.get(method)));
        }
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private String key(String chain, String method, List<?> params) {
        try {
            return chain + ":" + method + ":" + objectMapper.writeValueAsString(params != null ? params : List.of());
        } catch (JsonProcessingException e) {
            log.debug("Params of {} on {} not serializable, bypassing cache: {}", method, chain, e.getMessage());
            return null;
        }
    }

    private record Entry(RpcResponse response, Duration ttl) {
    }

    private static final class PerMethodExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return value.ttl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
