package com.chainrouter.rpc.registry;

import com.chainrouter.domain.ProviderTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Provider entry as configured under {@code chainrouter.rpc.providers[n]} or passed to
 * {@code RpcRouter.registerProvider}. Validated and turned into a {@link com.chainrouter.domain.Provider} by the registry.
 */
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Getter
@Setter
public class ProviderDescriptor {

    private String id;
    private String name;
    private String chain;
    private ProviderTier tier;
    private String url;
    private String wsUrl;
    private String apiKey;
    /** Requests per second. */
    @Builder.Default
    private int rateLimit = 10;
    @Builder.Default
    private double costPer1000 = 0.0;
    @Builder.Default
    private int priority = 0;
    @Builder.Default
    private boolean active = true;
    private Long timeoutMs;
    private Integer maxConnections;
    private Double dailyBudget;
}
