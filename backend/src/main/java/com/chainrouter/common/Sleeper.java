package com.chainrouter.common;

/**
 * Blocking delay primitive used for retry backoff. Swapped for a recording no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;

    static Sleeper threadSleep() {
        return millis -> {
            if (millis > 0) {
                Thread.sleep(millis);
            }
        };
    }
}
