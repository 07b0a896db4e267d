package com.chainrouter.rpc.health;

import com.chainrouter.domain.ProviderTier;
import com.chainrouter.rpc.config.RpcRouterProperties;
import com.chainrouter.rpc.event.RouterEvent;
import com.chainrouter.rpc.event.RouterEventBus;
import com.chainrouter.rpc.event.RouterEventType;
import com.chainrouter.rpc.registry.ProviderDescriptor;
import com.chainrouter.rpc.registry.ProviderRegistry;
import com.chainrouter.support.MutableClock;
import com.chainrouter.support.TestProviders;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.chainrouter.support.TestProviders.descriptor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ProviderHealthTrackerTest {

    private MutableClock clock;
    private List<RouterEvent> events;
    private ProviderHealthTracker tracker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-01T10:00:00Z");
        events = new ArrayList<>();
        RouterEventBus bus = new RouterEventBus(clock);
        bus.subscribe(events::add);
        ProviderDescriptor budgeted = descriptor("budgeted", "ethereum", ProviderTier.STANDARD);
        budgeted.setDailyBudget(1.0);
        ProviderRegistry registry = TestProviders.registry(
                descriptor("p1", "ethereum", ProviderTier.PREMIUM),
                budgeted);
        RpcRouterProperties props = TestProviders.properties();
        tracker = new ProviderHealthTracker(registry, bus, clock, props);
    }

    @Test
    @DisplayName("failures below the warm-up count keep the provider healthy")
    void recordOutcome_belowMinSamples_staysHealthy() {
        for (int i = 0; i < 4; i++) {
            tracker.recordOutcome("p1", false, null);
        }
        assertThat(tracker.isHealthy("p1")).isTrue();

        tracker.recordOutcome("p1", false, null);

        assertThat(tracker.isHealthy("p1")).isFalse();
        assertThat(events).filteredOn(e -> e.type() == RouterEventType.HEALTH_CHANGED).hasSize(1);
    }

    @Test
    void recordOutcome_successRateMustExceedThreshold() {
        for (int i = 0; i < 4; i++) {
            tracker.recordOutcome("p1", true, 50L);
        }
        tracker.recordOutcome("p1", false, null);
        assertThat(tracker.isHealthy("p1")).as("4/5 = 0.8 is not above 0.8").isFalse();

        tracker.recordOutcome("p1", true, 50L);
        assertThat(tracker.isHealthy("p1")).as("5/6 > 0.8").isTrue();
        assertThat(events).filteredOn(e -> e.type() == RouterEventType.HEALTH_CHANGED).hasSize(2);
    }

    @Test
    void recordOutcome_latencyIsExponentialAverageSeededByFirstSample() {
        tracker.recordOutcome("p1", true, 100L);
        assertThat(tracker.snapshot("p1").avgLatencyMs()).isEqualTo(100.0);

        tracker.recordOutcome("p1", true, 200L);
        assertThat(tracker.snapshot("p1").avgLatencyMs()).isCloseTo(110.0, within(1e-9));

        tracker.recordOutcome("p1", false, null);
        assertThat(tracker.snapshot("p1").avgLatencyMs()).isCloseTo(110.0, within(1e-9));
    }

    @Test
    void snapshot_beforeAnySample_reportsFullSuccessRate() {
        ProviderMetricsSnapshot s = tracker.snapshot("p1");

        assertThat(s.totalRequests()).isZero();
        assertThat(s.successRate()).isEqualTo(1.0);
        assertThat(s.healthy()).isTrue();
        assertThat(s.blacklisted()).isFalse();
    }

    @Test
    @DisplayName("budget exceeded is announced once per UTC day and lifts at midnight")
    void recordCost_budgetGateAndDailyReset() {
        tracker.recordCost("budgeted", 0.6);
        assertThat(tracker.isOverBudget("budgeted")).isFalse();

        tracker.recordCost("budgeted", 0.6);
        tracker.recordCost("budgeted", 0.6);

        assertThat(tracker.isOverBudget("budgeted")).isTrue();
        assertThat(tracker.costToday("budgeted")).isCloseTo(1.8, within(1e-9));
        assertThat(events).filteredOn(e -> e.type() == RouterEventType.BUDGET_EXCEEDED).hasSize(1);

        clock.set(Instant.parse("2026-03-02T00:00:00Z"));

        assertThat(tracker.isOverBudget("budgeted")).isFalse();
        assertThat(tracker.costToday("budgeted")).isZero();

        tracker.recordCost("budgeted", 1.0);
        assertThat(events).filteredOn(e -> e.type() == RouterEventType.BUDGET_EXCEEDED).hasSize(2);
    }

    @Test
    void recordCost_zeroBudget_admitsFreeCallsUntilFirstPaidOne() {
        ProviderDescriptor free = descriptor("free", "ethereum", ProviderTier.FALLBACK);
        free.setDailyBudget(0.0);
        RouterEventBus bus = new RouterEventBus(clock);
        bus.subscribe(events::add);
        ProviderHealthTracker zeroTracker = new ProviderHealthTracker(
                TestProviders.registry(free), bus, clock, TestProviders.properties());

        zeroTracker.recordCost("free", 0.0);
        assertThat(zeroTracker.isOverBudget("free")).isFalse();

        zeroTracker.recordCost("free", 0.001);
        assertThat(zeroTracker.isOverBudget("free")).isTrue();
        assertThat(events).filteredOn(e -> e.type() == RouterEventType.BUDGET_EXCEEDED).hasSize(1);
    }

    @Test
    void dailyBudget_fallsBackToGlobalBudget() {
        assertThat(tracker.dailyBudget("p1")).isEqualTo(100.0);
        assertThat(tracker.dailyBudget("budgeted")).isEqualTo(1.0);
    }

    @Test
    void blacklist_expiresWithoutExplicitReset() {
        tracker.blacklist("p1", Duration.ofMinutes(5));
        assertThat(tracker.isBlacklisted("p1")).isTrue();

        clock.advance(Duration.ofMinutes(5).minusMillis(1));
        assertThat(tracker.isBlacklisted("p1")).isTrue();

        clock.advanceMillis(2);
        assertThat(tracker.isBlacklisted("p1")).isFalse();
        assertThat(events).filteredOn(e -> e.type() == RouterEventType.PROVIDER_BLACKLISTED).hasSize(1);
    }

    @Test
    void recordProbeFailure_marksUnhealthyAndBlacklistsForConfiguredDuration() {
        tracker.recordProbeFailure("p1", "connection refused");

        ProviderMetricsSnapshot s = tracker.snapshot("p1");
        assertThat(s.healthy()).isFalse();
        assertThat(s.lastHealthCheck()).isEqualTo(clock.instant());
        assertThat(s.blacklistedUntil()).isEqualTo(clock.instant().plusMillis(300_000));
    }

    @Test
    void recordProbeFailure_healthReturnsWhenBlacklistLapses() {
        tracker.recordProbeFailure("p1", "connection refused");

        clock.advance(Duration.ofMillis(299_999));
        assertThat(tracker.isHealthy("p1")).isFalse();

        clock.advanceMillis(2);
        assertThat(tracker.isBlacklisted("p1")).isFalse();
        assertThat(tracker.isHealthy("p1")).isTrue();
        assertThat(tracker.snapshot("p1").healthy()).isTrue();
        assertThat(events).filteredOn(e -> e.type() == RouterEventType.HEALTH_CHANGED).hasSize(1);
    }

    @Test
    void recordProbeFailure_afterLapseSuccessRateStillGoverns() {
        for (int i = 0; i < 5; i++) {
            tracker.recordOutcome("p1", false, null);
        }
        tracker.recordProbeFailure("p1", "timeout");
        clock.advance(Duration.ofMillis(300_001));

        assertThat(tracker.isHealthy("p1")).isFalse();
    }

    @Test
    void recordProbeSuccess_restoresHealthButNotBlacklist() {
        tracker.recordProbeFailure("p1", "timeout");
        clock.advance(Duration.ofSeconds(60));

        tracker.recordProbeSuccess("p1", 40L);

        assertThat(tracker.isHealthy("p1")).isTrue();
        assertThat(tracker.isBlacklisted("p1")).isTrue();
        assertThat(tracker.snapshot("p1").avgLatencyMs()).isEqualTo(40.0);
    }

    @Test
    void costSummary_sumsDailyAndWindowTotals() {
        tracker.recordCost("p1", 0.25);
        clock.set(Instant.parse("2026-03-02T09:00:00Z"));
        tracker.recordCost("p1", 0.5);
        tracker.recordCost("budgeted", 0.1);

        CostSummary summary = tracker.costSummary();

        assertThat(summary.dailyTotal()).isCloseTo(0.6, within(1e-9));
        assertThat(summary.windowTotal()).isCloseTo(0.85, within(1e-9));
        assertThat(summary.dailyByProvider()).containsEntry("p1", 0.5);
        assertThat(summary.window()).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void forget_dropsMetricsAndLedger() {
        tracker.recordOutcome("p1", true, 10L);
        tracker.recordCost("p1", 0.5);

        tracker.forget("p1");

        assertThat(tracker.snapshot("p1").totalRequests()).isZero();
        assertThat(tracker.costToday("p1")).isZero();
        assertThat(tracker.ledger().size("p1")).isZero();
    }
}
