package com.chainrouter.rpc.job;

import com.chainrouter.rpc.health.HealthProbeService;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic provider health probe. A failed probe blacklists the provider.
 */
@Component
@RequiredArgsConstructor
public class HealthProbeJob {

    private final HealthProbeService healthProbeService;

    @Scheduled(
            fixedDelayString = "${chainrouter.rpc.health-check-interval-ms:60000}",
            initialDelayString = "${chainrouter.rpc.health-check-interval-ms:60000}")
    public void runScheduled() {
        healthProbeService.probeAll();
    }
}
