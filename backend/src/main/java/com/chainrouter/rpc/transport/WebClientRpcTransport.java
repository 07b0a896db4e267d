package com.chainrouter.rpc.transport;

import com.chainrouter.domain.Provider;
import com.chainrouter.rpc.error.TransportException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * JSON-RPC client using WebClient. API keys are sent as a bearer token.
 */
public class WebClientRpcTransport implements RpcTransport {

    private final WebClient webClient;

    public WebClientRpcTransport(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> call(Provider provider, String requestId, String method, List<Object> params, Duration timeout) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jsonrpc", "2.0");
        body.put("id", requestId);
        body.put("method", method);
        body.put("params", params != null ? params : List.of());
        String providerId = provider.getId();
        return webClient.post()
                .uri(provider.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> {
                    if (provider.getApiKey() != null && !provider.getApiKey().isBlank()) {
                        h.set(HttpHeaders.AUTHORIZATION, "Bearer " + provider.getApiKey());
                    }
                })
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.class, e -> new TransportException(providerId,
                        "HTTP " + e.getStatusCode().value() + " from " + providerId + ": " + e.getStatusText(), e))
                .onErrorMap(WebClientRequestException.class, e -> new TransportException(providerId,
                        "Connection to " + providerId + " failed: " + e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new TransportException(providerId,
                        method + " to " + providerId + " timed out after " + timeout.toMillis() + " ms", e));
    }
}
