package com.boxofficeintel.daily.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Spaces out requests to the reporting source.
 *
 * The gap is measured from the end of the previous request (successful or not) to the start of
 * the next one, so retries are throttled exactly like first attempts. Callers are sequential;
 * the methods are synchronized only so that a stray manual trigger cannot interleave.
 */
@Slf4j
public class RequestThrottle {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final long minDelayNanos;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;

    private long lastFinishedNanos;
    private boolean anyRequestFinished;

    public RequestThrottle(Duration minDelay) {
        this(minDelay, System::nanoTime, Thread::sleep);
    }

    public RequestThrottle(Duration minDelay, LongSupplier nanoClock, Sleeper sleeper) {
        this.minDelayNanos = Math.max(0L, minDelay.toNanos());
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until the minimum delay since the last finished request has elapsed.
     *
     * @throws CollectionInterruptedException when the calling thread is or becomes interrupted;
     *         the interrupt flag stays set
     */
    public synchronized void awaitTurn() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CollectionInterruptedException("Interrupted before next request");
        }
        if (!anyRequestFinished) return;
        long waitNanos = lastFinishedNanos + minDelayNanos - nanoClock.getAsLong();
        if (waitNanos <= 0) return;
        long waitMs = Math.max(1L, waitNanos / 1_000_000L);
        log.debug("Throttling next request for {} ms", waitMs);
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CollectionInterruptedException("Interrupted while throttling", ie);
        }
    }

    public synchronized void requestFinished() {
        lastFinishedNanos = nanoClock.getAsLong();
        anyRequestFinished = true;
    }
}
