package com.sashkomusic.catalogreconciler.domain.service;

/**
 * Fixed pause between consecutive catalog requests of one batch. The first request goes out
 * immediately. Not thread-safe; each batch owns its own instance.
 */
public class RequestThrottle {

    private final long delayMs;
    private final Sleeper sleeper;
    private boolean firstRequest = true;

    public RequestThrottle(long delayMs, Sleeper sleeper) {
        this.delayMs = Math.max(0, delayMs);
        this.sleeper = sleeper;
    }

    public void awaitTurn() throws InterruptedException {
        if (!firstRequest && delayMs > 0) {
            sleeper.sleep(delayMs);
        }
        firstRequest = false;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
