package com.chainrouter.rpc.transport;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TransientErrorClassifierTest {

    @ParameterizedTest
    @ValueSource(ints = {-32005, -32603, 19, 30, 429})
    void isTransient_knownCodes(int code) {
        assertThat(TransientErrorClassifier.isTransient(code, "whatever")).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Rate limit reached", "Too Many Requests", "request timed out", "please try again",
            "503 Service Unavailable", "daily limit exceeded"})
    void isTransient_knownMessages(String message) {
        assertThat(TransientErrorClassifier.isTransient(-32000, message)).isTrue();
    }

    @Test
    void isTransient_revertOrBadParams_false() {
        assertThat(TransientErrorClassifier.isTransient(3, "execution reverted")).isFalse();
        assertThat(TransientErrorClassifier.isTransient(-32602, "invalid argument 0")).isFalse();
        assertThat(TransientErrorClassifier.isTransient(-32601, null)).isFalse();
    }
}
