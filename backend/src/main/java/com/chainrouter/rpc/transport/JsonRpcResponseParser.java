package com.chainrouter.rpc.transport;

import com.chainrouter.rpc.error.ProviderErrorException;
import com.chainrouter.rpc.error.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Unwraps a JSON-RPC 2.0 response envelope. An {@code error} member wins over {@code result}.
 */
public class JsonRpcResponseParser {

    private final ObjectMapper objectMapper;

    public JsonRpcResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @return the {@code result} member; {@link NullNode} when the provider returned {@code "result": null}
     * @throws ProviderErrorException when the envelope carries an error object
     * @throws TransportException     when the body is empty or not a JSON-RPC envelope
     */
    public JsonNode parseResult(String providerId, String method, String body) {
        if (body == null || body.isBlank()) {
            throw new TransportException(providerId, method + " returned an empty body from " + providerId);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new TransportException(providerId, "Malformed JSON-RPC response from " + providerId + " for " + method, e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            int code = error.path("code").asInt(0);
            String message = error.path("message").asText(error.toString());
            throw new ProviderErrorException(providerId, code, message, TransientErrorClassifier.isTransient(code, message));
        }
        if (!root.has("result")) {
            throw new TransportException(providerId, method + " response from " + providerId + " has neither result nor error");
        }
        JsonNode result = root.get("result");
        return result != null ? result : NullNode.getInstance();
    }
}
