package com.chainrouter.rpc.config;

import com.chainrouter.rpc.registry.ProviderDescriptor;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Provider catalog, retry/failover, health-check and budget settings. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "chainrouter.rpc")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class RpcRouterProperties {

    /** Chains a provider may be registered for. Registration for any other chain fails fast. */
    @NotEmpty
    private List<String> supportedChains = new ArrayList<>(List.of(
            "ethereum", "bsc", "polygon", "arbitrum", "optimism", "base", "avalanche", "solana"));

    private List<ProviderDescriptor> providers = new ArrayList<>();

    /** Retries after the first attempt; total attempts = maxRetries + 1. */
    @PositiveOrZero
    private int maxRetries = 3;

    /** Base delay; the n-th retry waits retryDelayMs * 2^n. */
    @PositiveOrZero
    private long retryDelayMs = 1_000L;

    /** Jitter factor 0..1 applied to the backoff delay. 0 = deterministic. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterFactor = 0.0;

    /** Default per-call timeout when the provider does not set its own. */
    @Positive
    private long requestTimeoutMs = 10_000L;

    @Positive
    private long healthCheckIntervalMs = 60_000L;

    /** How long a provider whose health probe failed stays out of selection. */
    private long blacklistDurationMs = 300_000L;

    /** Default daily spend ceiling per provider, in cost units. */
    @PositiveOrZero
    private double dailyBudget = 100.0;

    /** Cost ledger retention window. */
    @Min(1)
    private int costTrackingWindowHours = 24;

    /** Outcomes needed before the success ratio may mark a provider unhealthy. */
    private int minSamplesForHealth = 5;

    /** A provider is healthy while successful/total stays above this ratio. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double healthySuccessRate = 0.8;

    /** Instance-wide outgoing budget enforced by the local limiter (requests per second). */
    @Positive
    private int maxRequestsPerSecond = 1_200;

    /** How long the local limiter may wait for a permit before failing the attempt. */
    private long localLimiterTimeoutMs = 2_000L;

    /** Limiter waits at or above this are logged at info. */
    private long localLimiterLogThresholdMs = 200L;

    /** Interval of the aggregate metrics log line. */
    private long metricsSummaryIntervalMs = 300_000L;

    public void setProviders(List<ProviderDescriptor> providers) {
        this.providers = providers != null ? providers : new ArrayList<>();
    }
}
