package com.chainrouter.rpc.pool;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.List;
import java.util.Random;
import java.util.random.RandomGenerator;

import static org.assertj.core.api.Assertions.assertThat;

class LoadBalancingStrategyTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @ParameterizedTest
    @EnumSource(LoadBalancingStrategy.class)
    void create_everyStrategyPicksFromCandidates(LoadBalancingStrategy type) {
        List<PooledConnection> candidates = List.of(connection("c1"), connection("c2"));

        ConnectionSelectionStrategy strategy = type.create(new Random(7));

        assertThat(candidates).contains(strategy.select(candidates));
    }

    @Test
    void roundRobin_cyclesThroughCandidates() {
        List<PooledConnection> candidates = List.of(connection("c1"), connection("c2"), connection("c3"));
        RoundRobinStrategy strategy = new RoundRobinStrategy();

        assertThat(List.of(strategy.select(candidates), strategy.select(candidates),
                strategy.select(candidates), strategy.select(candidates)))
                .extracting(PooledConnection::getId)
                .containsExactly("c1", "c2", "c3", "c1");
    }

    @Test
    void leastRequests_prefersLeastUsedThenOldest() {
        PooledConnection busyOne = connection("c1");
        busyOne.completeLease(T0, 10L);
        busyOne.completeLease(T0, 10L);
        PooledConnection fresh = connection("c2");
        PooledConnection alsoFresh = connection("c3");

        assertThat(new LeastRequestsStrategy().select(List.of(busyOne, fresh, alsoFresh))).isSameAs(fresh);
    }

    @Test
    void latencyBiased_prefersFastestAverage() {
        PooledConnection slow = connection("slow");
        slow.completeLease(T0, 300L);
        PooledConnection fast = connection("fast");
        fast.completeLease(T0, 30L);

        assertThat(new LatencyBiasedStrategy().select(List.of(slow, fast))).isSameAs(fast);
    }

    @Test
    void weighted_followsHealthScore() {
        PooledConnection healthy = connection("healthy");
        PooledConnection degraded = connection("degraded");
        for (int i = 0; i < 3; i++) {
            degraded.recordOutcome(false, 10);
        }
        assertThat(degraded.getHealthScore()).isEqualTo(25);

        assertThat(new WeightedStrategy(fixed(0.79)).select(List.of(healthy, degraded))).isSameAs(healthy);
        assertThat(new WeightedStrategy(fixed(0.81)).select(List.of(healthy, degraded))).isSameAs(degraded);
    }

    @Test
    void weighted_allScoresZero_fallsBackToFirst() {
        PooledConnection a = connection("a");
        PooledConnection b = connection("b");
        for (int i = 0; i < 4; i++) {
            a.recordOutcome(false, 10);
            b.recordOutcome(false, 10);
        }

        assertThat(new WeightedStrategy(fixed(0.5)).select(List.of(a, b))).isSameAs(a);
    }

    private static PooledConnection connection(String id) {
        return new PooledConnection(id, "A", T0);
    }

    private static RandomGenerator fixed(double value) {
        return new RandomGenerator() {
            @Override
            public long nextLong() {
                return 0L;
            }

            @Override
            public double nextDouble() {
                return value;
            }
        };
    }
}
