package com.chainrouter.rpc.job;

import com.chainrouter.rpc.router.RouterMetrics;
import com.chainrouter.rpc.router.RpcRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Logs an aggregate router summary every 5 minutes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsSummaryJob {

    private final RpcRouter rpcRouter;

    @Scheduled(
            fixedRateString = "${chainrouter.rpc.metrics-summary-interval-ms:300000}",
            initialDelayString = "${chainrouter.rpc.metrics-summary-interval-ms:300000}")
    public void runScheduled() {
        RouterMetrics m = rpcRouter.getMetrics();
        log.info("RPC summary: requests={} successRate={} avgLatencyMs={} costToday={} healthy={}/{} blacklisted={} queued={} pool={}/{} busy",
                m.totalRequests(),
                String.format("%.3f", m.successRate()),
                String.format("%.1f", m.avgLatencyMs()),
                String.format("%.4f", m.costs().dailyTotal()),
                m.healthyProviders(),
                m.totalProviders(),
                m.blacklistedProviders(),
                m.queueDepths().values().stream().mapToInt(Integer::intValue).sum(),
                m.pool().busyConnections(),
                m.pool().totalConnections());
    }
}
