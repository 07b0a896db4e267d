package com.chainrouter.rpc.transport;

import com.chainrouter.rpc.error.ProviderErrorException;
import com.chainrouter.rpc.error.TransportException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonRpcResponseParserTest {

    private final JsonRpcResponseParser parser = new JsonRpcResponseParser(new ObjectMapper());

    @Test
    void parseResult_returnsResultMember() {
        JsonNode result = parser.parseResult("p1", "eth_blockNumber", "{\"jsonrpc\":\"2.0\",\"id\":\"r1\",\"result\":\"0x1b4\"}");

        assertThat(result.asText()).isEqualTo("0x1b4");
    }

    @Test
    void parseResult_nullResult_isNullNode() {
        JsonNode result = parser.parseResult("p1", "eth_getTransactionReceipt", "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}");

        assertThat(result.isNull()).isTrue();
    }

    @Test
    void parseResult_transientError_flaggedTransient() {
        assertThatThrownBy(() -> parser.parseResult("p1", "eth_call",
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":-32005,\"message\":\"limit exceeded\"}}"))
                .isInstanceOfSatisfying(ProviderErrorException.class, e -> {
                    assertThat(e.getCode()).isEqualTo(-32005);
                    assertThat(e.isTransientError()).isTrue();
                    assertThat(e.getProviderId()).isEqualTo("p1");
                });
    }

    @Test
    void parseResult_revert_notTransient() {
        assertThatThrownBy(() -> parser.parseResult("p1", "eth_call",
                "{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":3,\"message\":\"execution reverted\"}}"))
                .isInstanceOfSatisfying(ProviderErrorException.class, e -> {
                    assertThat(e.isTransientError()).isFalse();
                    assertThat(e.getRpcMessage()).isEqualTo("execution reverted");
                    assertThat(e.isRetryable()).isFalse();
                });
    }

    @Test
    void parseResult_malformedOrEmptyBody_isTransportFailure() {
        assertThatThrownBy(() -> parser.parseResult("p1", "eth_call", "<html>502</html>"))
                .isInstanceOf(TransportException.class);
        assertThatThrownBy(() -> parser.parseResult("p1", "eth_call", ""))
                .isInstanceOf(TransportException.class);
        assertThatThrownBy(() -> parser.parseResult("p1", "eth_call", "{\"jsonrpc\":\"2.0\",\"id\":1}"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("neither result nor error");
    }
}
