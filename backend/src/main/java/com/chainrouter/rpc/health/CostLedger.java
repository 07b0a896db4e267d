package com.chainrouter.rpc.health;

import com.chainrouter.domain.CostEntry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-provider spend history bounded by a retention window. Entries older than the window are
 * purged lazily on write and skipped on read.
 */
public class CostLedger {

    private final Map<String, Deque<CostEntry>> entriesByProvider = new ConcurrentHashMap<>();
    private final Duration window;
    private final Clock clock;

    public CostLedger(Duration window, Clock clock) {
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Cost tracking window must be positive");
        }
        this.window = window;
        this.clock = clock;
    }

    public void append(String providerId, double cost) {
        Instant now = clock.instant();
        Deque<CostEntry> entries = entriesByProvider.computeIfAbsent(providerId, k -> new ArrayDeque<>());
        synchronized (entries) {
            entries.addLast(new CostEntry(now, providerId, cost));
            Instant cutoff = now.minus(window);
            while (!entries.isEmpty() && entries.peekFirst().timestamp().isBefore(cutoff)) {
                entries.pollFirst();
            }
        }
    }

    /**
     * Spend recorded at or after {@code since}, limited to the retention window.
     */
    public double costSince(String providerId, Instant since) {
        Deque<CostEntry> entries = entriesByProvider.get(providerId);
        if (entries == null) {
            return 0.0;
        }
        Instant from = latest(since, clock.instant().minus(window));
        double total = 0.0;
        synchronized (entries) {
            for (CostEntry entry : entries) {
                if (!entry.timestamp().isBefore(from)) {
                    total += entry.cost();
                }
            }
        }
        return total;
    }

    public double windowTotal() {
        Instant from = clock.instant().minus(window);
        double total = 0.0;
        for (String providerId : entriesByProvider.keySet()) {
            total += costSince(providerId, from);
        }
        return total;
    }

    public int size(String providerId) {
        Deque<CostEntry> entries = entriesByProvider.get(providerId);
        if (entries == null) {
            return 0;
        }
        synchronized (entries) {
            return entries.size();
        }
    }

    public void forget(String providerId) {
        entriesByProvider.remove(providerId);
    }

    public Duration getWindow() {
        return window;
    }

    private static Instant latest(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
