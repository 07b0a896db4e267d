package com.chainrouter.rpc.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Short-lived cache for read-only RPC methods (eth_blockNumber, eth_gasPrice, eth_call, ...).
 */
@ConfigurationProperties(prefix = "chainrouter.cache")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ResponseCacheProperties {

    private boolean enabled = true;

    @Positive
    private long maxSize = 10_000L;
}
