package com.chainrouter.rpc.config;

import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Rate-limited dispatch queue settings.
 */
@ConfigurationProperties(prefix = "chainrouter.dispatch")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class DispatchProperties {

    /** Drain interval; a provider releases rateLimit * tickIntervalMs / 1000 calls per tick. */
    @Positive
    private long tickIntervalMs = 1_000L;

    /** Per-chain queue ceiling; enqueue beyond it fails with QueueSaturatedException. */
    @Positive
    private int maxQueueDepth = 1_000;

    /** Worker threads executing drained calls. */
    @Positive
    private int executorThreads = 8;
}
