package com.phillippitts.ambientscribe.service.audio;

import com.phillippitts.ambientscribe.domain.AudioFrame;

import java.util.function.Consumer;

import static com.phillippitts.ambientscribe.service.audio.AudioFormat.MAX_SAMPLE_MAGNITUDE;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;

/**
 * Slices a PCM16LE mono byte stream into fixed-duration VAD frames.
 *
 * <p>Samples are buffered until one frame duration has accumulated; the frame's RMS energy is
 * normalized by {@link AudioFormat#MAX_SAMPLE_MAGNITUDE} and compared against the VAD threshold.
 * A chunk ending on an odd byte carries that byte into the next chunk, so sample alignment is
 * never lost across reads.
 *
 * <p>Frame timestamps are derived from the sample count, not from the wall clock: frame
 * {@code n} starts at {@code origin + n * frameMillis}, which keeps them monotonic even when
 * reads arrive in bursts.
 *
 * <p>Not thread-safe. Owned by the capture thread.
 */
public final class FrameAccumulator {

    private final int samplesPerFrame;
    private final double vadThreshold;
    private final short[] pending;
    private int pendingCount;
    private int carryByte = -1;
    private long originMillis;
    private long samplesEmitted;

    /**
     * @param frameMillis  frame duration in milliseconds (must be positive)
     * @param vadThreshold normalized energy above which a frame is voice-active
     */
    public FrameAccumulator(int frameMillis, double vadThreshold) {
        if (frameMillis <= 0) {
            throw new IllegalArgumentException("frameMillis must be positive: " + frameMillis);
        }
        this.samplesPerFrame = (REQUIRED_SAMPLE_RATE * frameMillis) / 1000;
        this.vadThreshold = vadThreshold;
        this.pending = new short[samplesPerFrame];
    }

    /**
     * Clears partial state and sets the timestamp of the next frame's first sample.
     *
     * @param originMillis epoch millis of the first sample that will be accepted
     */
    public void reset(long originMillis) {
        this.originMillis = originMillis;
        this.samplesEmitted = 0;
        this.pendingCount = 0;
        this.carryByte = -1;
    }

    /**
     * Consumes a chunk of little-endian PCM bytes, emitting every completed frame.
     *
     * @param src  source bytes
     * @param off  offset of the first byte
     * @param len  number of bytes
     * @param sink receives completed frames in order
     * @return number of frames emitted
     */
    public int accept(byte[] src, int off, int len, Consumer<AudioFrame> sink) {
        int emitted = 0;
        int i = off;
        int end = off + len;
        if (carryByte >= 0 && i < end) {
            emitted += push((short) (carryByte | (src[i] << 8)), sink);
            carryByte = -1;
            i++;
        }
        for (; i + 1 < end; i += 2) {
            emitted += push((short) ((src[i] & 0xFF) | (src[i + 1] << 8)), sink);
        }
        if (i < end) {
            carryByte = src[i] & 0xFF;
        }
        return emitted;
    }

    public int samplesPerFrame() {
        return samplesPerFrame;
    }

    /** Samples buffered toward the next frame. */
    int pendingSamples() {
        return pendingCount;
    }

    private int push(short sample, Consumer<AudioFrame> sink) {
        pending[pendingCount++] = sample;
        if (pendingCount < samplesPerFrame) {
            return 0;
        }
        float energy = rmsEnergy(pending, samplesPerFrame);
        long timestamp = originMillis + (samplesEmitted * 1000L) / REQUIRED_SAMPLE_RATE;
        sink.accept(new AudioFrame(pending, timestamp, energy, energy > vadThreshold));
        samplesEmitted += samplesPerFrame;
        pendingCount = 0;
        return 1;
    }

    /**
     * RMS of the first {@code count} samples normalized into [0,1].
     */
    static float rmsEnergy(short[] samples, int count) {
        if (count == 0) {
            return 0f;
        }
        double sumSquares = 0;
        for (int i = 0; i < count; i++) {
            double normalized = samples[i] / MAX_SAMPLE_MAGNITUDE;
            sumSquares += normalized * normalized;
        }
        return (float) Math.min(1.0, Math.sqrt(sumSquares / count));
    }
}
