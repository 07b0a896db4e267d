package com.chainrouter.rpc.job;

import com.chainrouter.rpc.pool.ConnectionPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Connection health checks, auto-scaling and cleanup, each on its own interval.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoolMaintenanceJob {

    private final ConnectionPool connectionPool;

    @Scheduled(
            fixedDelayString = "${chainrouter.pool.health-check-interval-ms:30000}",
            initialDelayString = "${chainrouter.pool.health-check-interval-ms:30000}")
    public void runHealthChecks() {
        int deactivated = connectionPool.runHealthChecks();
        if (deactivated > 0) {
            log.info("Pool health check deactivated {} connections", deactivated);
        }
    }

    @Scheduled(fixedDelayString = "${chainrouter.pool.scaling-interval-ms:10000}")
    public void autoScale() {
        connectionPool.autoScale();
    }

    @Scheduled(fixedDelayString = "${chainrouter.pool.cleanup-interval-ms:60000}")
    public void cleanup() {
        int destroyed = connectionPool.cleanup();
        if (destroyed > 0) {
            log.info("Pool cleanup destroyed {} connections", destroyed);
        }
    }
}
