package com.fundradar.common;

/**
 * Pause abstraction for backoff and rate-limit delays, so tests can run without real sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = millis -> {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting " + millis + " ms", e);
        }
    };

    Sleeper NONE = millis -> { };

    void sleep(long millis);
}
