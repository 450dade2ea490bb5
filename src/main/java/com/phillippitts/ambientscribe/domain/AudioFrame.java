package com.phillippitts.ambientscribe.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable VAD frame: one fixed-duration window of mono 16-bit samples with its energy.
 *
 * <p>Produced once per frame window by the capture thread and handed to every frame consumer
 * (diarization, ASR). The sample array is copied on construction and on access, so no consumer
 * can mutate what another consumer sees.
 *
 * @param samples         signed 16-bit samples of the window
 * @param timestampMillis capture time of the first sample (epoch millis, monotonic within a session)
 * @param energy          RMS energy normalized by the maximum sample magnitude, in [0,1]
 * @param voiceActive     whether {@code energy} exceeded the VAD threshold
 */
public record AudioFrame(
        short[] samples,
        long timestampMillis,
        float energy,
        boolean voiceActive
) {

    /**
     * @throws NullPointerException     if samples is null
     * @throws IllegalArgumentException if energy is outside [0,1]
     */
    public AudioFrame {
        Objects.requireNonNull(samples, "samples must not be null");
        if (energy < 0f || energy > 1f || Float.isNaN(energy)) {
            throw new IllegalArgumentException("Energy must be between 0.0 and 1.0, got: " + energy);
        }
        samples = samples.clone();
    }

    /**
     * Creates a sample-less frame carrying only energy data (synthetic streams, tests).
     */
    public static AudioFrame ofEnergy(long timestampMillis, float energy, boolean voiceActive) {
        return new AudioFrame(new short[0], timestampMillis, energy, voiceActive);
    }

    @Override
    public short[] samples() {
        return samples.clone();
    }

    /** Number of samples in this frame. */
    public int sampleCount() {
        return samples.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioFrame other)) {
            return false;
        }
        return timestampMillis == other.timestampMillis
                && Float.compare(energy, other.energy) == 0
                && voiceActive == other.voiceActive
                && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(samples);
        result = 31 * result + Long.hashCode(timestampMillis);
        result = 31 * result + Float.hashCode(energy);
        result = 31 * result + Boolean.hashCode(voiceActive);
        return result;
    }

    @Override
    public String toString() {
        return "AudioFrame[samples=" + samples.length + ", timestampMillis=" + timestampMillis
                + ", energy=" + energy + ", voiceActive=" + voiceActive + ']';
    }
}
