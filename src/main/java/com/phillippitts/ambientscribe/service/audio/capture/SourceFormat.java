package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.service.audio.AudioFormat;

/**
 * PCM format a {@link MicrophoneSource} actually delivers.
 *
 * @param sampleRate    samples per second
 * @param bitsPerSample bits per sample (16 for every source in this application)
 * @param channels      channel count
 * @param bigEndian     byte order of each sample
 */
public record SourceFormat(int sampleRate, int bitsPerSample, int channels, boolean bigEndian) {

    public SourceFormat {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
    }

    /** The canonical capture format: 16 kHz, 16-bit, mono, little-endian. */
    public static SourceFormat canonical() {
        return pcm16Mono(AudioFormat.REQUIRED_SAMPLE_RATE);
    }

    /** 16-bit mono little-endian at the given rate. */
    public static SourceFormat pcm16Mono(int sampleRate) {
        return new SourceFormat(sampleRate, AudioFormat.REQUIRED_BITS_PER_SAMPLE,
                AudioFormat.REQUIRED_CHANNELS, AudioFormat.REQUIRED_BIG_ENDIAN);
    }

    public boolean isCanonical() {
        return equals(canonical());
    }
}
