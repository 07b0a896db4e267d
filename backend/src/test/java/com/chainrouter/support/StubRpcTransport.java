package com.chainrouter.support;

import com.chainrouter.domain.Provider;
import com.chainrouter.rpc.error.TransportException;
import com.chainrouter.rpc.transport.RpcTransport;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Scripted transport: each provider answers through its own handler (method -> body). Records every call.
 */
public class StubRpcTransport implements RpcTransport {

    private final Map<String, Function<String, Mono<String>>> handlers = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    public StubRpcTransport succeed(String providerId, String resultJson) {
        handlers.put(providerId, method -> Mono.just(envelope(resultJson)));
        return this;
    }

    public StubRpcTransport failTransport(String providerId) {
        handlers.put(providerId, method -> Mono.error(new TransportException(providerId, "connection refused by " + providerId)));
        return this;
    }

    public StubRpcTransport rpcError(String providerId, int code, String message) {
        handlers.put(providerId, method -> Mono.just(
                "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"error\":{\"code\":" + code + ",\"message\":\"" + message + "\"}}"));
        return this;
    }

    public StubRpcTransport handle(String providerId, Function<String, Mono<String>> handler) {
        handlers.put(providerId, handler);
        return this;
    }

    @Override
    public Mono<String> call(Provider provider, String requestId, String method, List<Object> params, Duration timeout) {
        calls.add(provider.getId() + ":" + method);
        Function<String, Mono<String>> handler = handlers.get(provider.getId());
        if (handler == null) {
            return Mono.error(new TransportException(provider.getId(), "no stub for " + provider.getId()));
        }
        return handler.apply(method);
    }

    public List<String> calls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    public long callsTo(String providerId) {
        return calls().stream().filter(c -> c.startsWith(providerId + ":")).count();
    }

    public static String envelope(String resultJson) {
        return "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"result\":" + resultJson + "}";
    }
}
