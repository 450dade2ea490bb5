package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.service.audio.AudioFormat;

import java.util.Optional;

/**
 * Classifies chunk arrival timing as underrun or overrun and proposes chunk-size changes.
 *
 * <p>The expected interval for a chunk is its playback duration at the canonical byte rate.
 * An arrival later than {@value #UNDERRUN_FACTOR}x expected is an underrun, earlier than
 * {@value #OVERRUN_FACTOR}x expected an overrun; anything between breaks both streaks.
 * Three underruns in a row grow the proposed chunk by 1.5x, three overruns in a row shrink it
 * by 0.75x, clamped to half the initial size. At most {@value #MAX_ADJUSTMENTS_PER_SESSION}
 * adjustments are proposed per session.
 *
 * <p>The live source is never resized. Proposals take effect when {@link #beginSession()} is
 * next called.
 *
 * <p>Thread-safe: the capture thread feeds it while other threads read snapshots.
 */
final class BufferAutotuner {

    static final double UNDERRUN_FACTOR = 1.5;
    static final double OVERRUN_FACTOR = 0.5;
    static final int STREAK_THRESHOLD = 3;
    static final int MAX_ADJUSTMENTS_PER_SESSION = 5;
    static final double GROW_FACTOR = 1.5;
    static final double SHRINK_FACTOR = 0.75;

    private final int initialChunkBytes;
    private int activeChunkBytes;
    private int proposedChunkBytes;
    private int consecutiveUnderruns;
    private int consecutiveOverruns;
    private int adjustmentCount;
    private long totalUnderruns;
    private long totalOverruns;
    private long lastArrivalNanos;
    private boolean hasArrival;

    BufferAutotuner(int initialChunkBytes) {
        if (initialChunkBytes < AudioFormat.REQUIRED_BLOCK_ALIGN) {
            throw new IllegalArgumentException("initialChunkBytes too small: " + initialChunkBytes);
        }
        this.initialChunkBytes = align(initialChunkBytes);
        this.activeChunkBytes = this.initialChunkBytes;
        this.proposedChunkBytes = this.initialChunkBytes;
    }

    /**
     * Adopts the proposed chunk size and clears all per-session counters.
     *
     * @return chunk size the new session should read with
     */
    synchronized int beginSession() {
        activeChunkBytes = proposedChunkBytes;
        consecutiveUnderruns = 0;
        consecutiveOverruns = 0;
        adjustmentCount = 0;
        totalUnderruns = 0;
        totalOverruns = 0;
        hasArrival = false;
        return activeChunkBytes;
    }

    /**
     * Records one chunk arrival.
     *
     * @param nowNanos  monotonic arrival time
     * @param bytesRead bytes delivered by this read
     * @return an adjustment when a streak completed, otherwise empty
     */
    synchronized Optional<BufferAdjustment> onChunk(long nowNanos, int bytesRead) {
        if (!hasArrival) {
            hasArrival = true;
            lastArrivalNanos = nowNanos;
            return Optional.empty();
        }
        long interval = nowNanos - lastArrivalNanos;
        lastArrivalNanos = nowNanos;
        double expected = expectedIntervalNanos(bytesRead);
        if (expected <= 0) {
            return Optional.empty();
        }

        if (interval > expected * UNDERRUN_FACTOR) {
            totalUnderruns++;
            consecutiveUnderruns++;
            consecutiveOverruns = 0;
            if (consecutiveUnderruns >= STREAK_THRESHOLD) {
                int streak = consecutiveUnderruns;
                consecutiveUnderruns = 0;
                if (adjustmentCount < MAX_ADJUSTMENTS_PER_SESSION) {
                    return Optional.of(propose(align((int) (proposedChunkBytes * GROW_FACTOR)),
                            BufferAdjustment.REASON_UNDERRUN, streak));
                }
            }
        } else if (interval < expected * OVERRUN_FACTOR) {
            totalOverruns++;
            consecutiveOverruns++;
            consecutiveUnderruns = 0;
            if (consecutiveOverruns >= STREAK_THRESHOLD) {
                int streak = consecutiveOverruns;
                consecutiveOverruns = 0;
                int shrunk = Math.max(align((int) (proposedChunkBytes * SHRINK_FACTOR)), minChunkBytes());
                if (adjustmentCount < MAX_ADJUSTMENTS_PER_SESSION && shrunk < proposedChunkBytes) {
                    return Optional.of(propose(shrunk, BufferAdjustment.REASON_OVERRUN, streak));
                }
            }
        } else {
            consecutiveUnderruns = 0;
            consecutiveOverruns = 0;
        }
        return Optional.empty();
    }

    private BufferAdjustment propose(int newSize, String reason, int streak) {
        BufferAdjustment adjustment = new BufferAdjustment(proposedChunkBytes, newSize, reason, streak);
        proposedChunkBytes = newSize;
        adjustmentCount++;
        return adjustment;
    }

    synchronized BufferTuningSnapshot snapshot() {
        return new BufferTuningSnapshot(activeChunkBytes, proposedChunkBytes, consecutiveUnderruns,
                consecutiveOverruns, adjustmentCount, totalUnderruns, totalOverruns);
    }

    int initialChunkBytes() {
        return initialChunkBytes;
    }

    /** Smallest size a shrink may propose: half the initial chunk. */
    int minChunkBytes() {
        return Math.max(align(initialChunkBytes / 2), AudioFormat.REQUIRED_BLOCK_ALIGN);
    }

    static double expectedIntervalNanos(int bytes) {
        return (double) bytes / AudioFormat.BYTES_PER_SAMPLE / AudioFormat.REQUIRED_SAMPLE_RATE * 1_000_000_000.0;
    }

    private static int align(int bytes) {
        return bytes - (bytes % AudioFormat.REQUIRED_BLOCK_ALIGN);
    }
}
