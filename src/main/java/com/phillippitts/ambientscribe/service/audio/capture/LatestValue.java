package com.phillippitts.ambientscribe.service.audio.capture;

import java.time.Duration;
import java.util.Optional;

/**
 * Single-slot "latest value wins" channel.
 *
 * <p>Publishing never blocks and replaces the previous value. A slow reader skips intermediate
 * values and only ever sees the most recent one. Each publish bumps a version so readers can wait
 * for something newer than what they last saw.
 *
 * @param <T> value type
 */
public final class LatestValue<T> {

    private T value;
    private long version;

    public synchronized void publish(T newValue) {
        value = newValue;
        version++;
        notifyAll();
    }

    public synchronized Optional<T> current() {
        return Optional.ofNullable(value);
    }

    /** Number of values published so far. */
    public synchronized long version() {
        return version;
    }

    /**
     * Waits until a value newer than {@code seenVersion} is published.
     *
     * @param seenVersion version the caller already observed
     * @param timeout     maximum wait
     * @return the latest value, or empty on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public synchronized Optional<T> awaitNewerThan(long seenVersion, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (version <= seenVersion) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                return Optional.empty();
            }
            wait(remainingMillis);
        }
        return Optional.ofNullable(value);
    }
}
