package com.chainrouter.rpc.config;

import com.chainrouter.rpc.pool.LoadBalancingStrategy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection pool sizing, lifecycle and auto-scaling settings.
 */
@ConfigurationProperties(prefix = "chainrouter.pool")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ConnectionPoolProperties {

    /** Scale-down and idle eviction never go below this many connections in total. */
    @PositiveOrZero
    private int minConnections = 1;

    /** Global ceiling across all providers. */
    @Positive
    private int maxConnections = 50;

    /** Ceiling per provider unless the provider sets maxConnections. */
    @Positive
    private int maxConnectionsPerProvider = 10;

    /** Maximum time an acquire waits in the wait list. */
    @Positive
    private long connectionTimeoutMs = 5_000L;

    private long idleTimeoutMs = 300_000L;

    private long maxAgeMs = 3_600_000L;

    private long healthCheckIntervalMs = 30_000L;

    /** Consecutive probe/lease failures after which a connection is retired. */
    @Positive
    private int maxConsecutiveErrors = 5;

    /** Utilization (busy/total) above which one connection is added per scaling pass. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double scaleUpThreshold = 0.8;

    /** Utilization below which the longest-idle connection is removed per scaling pass. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double scaleDownThreshold = 0.2;

    private long scalingIntervalMs = 10_000L;

    private long cleanupIntervalMs = 60_000L;

    @NotNull
    private LoadBalancingStrategy strategy = LoadBalancingStrategy.ROUND_ROBIN;
}
