package com.phillippitts.ambientscribe.service.audio;

/**
 * Single source of truth for the canonical capture format.
 * Required: 16 kHz, 16-bit signed PCM, mono, little-endian.
 *
 * <p>Sources that cannot deliver this rate are normalized upstream by
 * {@link com.phillippitts.ambientscribe.service.audio.capture.ResamplingMicrophoneSource}.
 */
public final class AudioFormat {

    /** Canonical sample rate in Hz. */
    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    /** Canonical bits per sample. */
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    /** Canonical number of channels (mono). */
    public static final int REQUIRED_CHANNELS = 1;

    /** Signed PCM flag for Java Sound. */
    public static final boolean REQUIRED_SIGNED = true;
    /** Endian flag for Java Sound (false = little-endian). */
    public static final boolean REQUIRED_BIG_ENDIAN = false;

    /** Bytes per sample for a single channel. */
    public static final int BYTES_PER_SAMPLE = REQUIRED_BITS_PER_SAMPLE / 8;                       // 2 bytes
    /** Bytes per PCM frame (sample for all channels). */
    public static final int REQUIRED_BLOCK_ALIGN = BYTES_PER_SAMPLE * REQUIRED_CHANNELS;          // 2 bytes
    /** Bytes per second at the canonical format. */
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;     // 32,000

    /** Largest magnitude of a signed 16-bit sample, used to normalize energy into [0,1]. */
    public static final double MAX_SAMPLE_MAGNITUDE = 32_768.0;

    /**
     * Sample rates tried, in order, when the device refuses {@link #REQUIRED_SAMPLE_RATE}.
     */
    public static final int[] FALLBACK_SAMPLE_RATES = {48_000, 44_100, 32_000, 22_050, 8_000};

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_CHUNK_SIZE_OFFSET = 4;           // 4 bytes (LE)
    public static final int WAV_AUDIO_FORMAT_OFFSET = 20;        // 2 bytes (LE)
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BYTE_RATE_OFFSET = 28;           // 4 bytes (LE)
    public static final int WAV_BLOCK_ALIGN_OFFSET = 32;         // 2 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)
    public static final int WAV_DATA_SIZE_OFFSET = 40;           // 4 bytes (LE)
    public static final int WAV_AUDIO_FORMAT_PCM = 1;

    private AudioFormat() {}

    /**
     * Converts a duration to a byte count at the canonical format, aligned to whole samples.
     *
     * @param millis duration in milliseconds
     * @return byte count (always even)
     */
    public static int bytesForMillis(long millis) {
        long samples = (REQUIRED_SAMPLE_RATE * millis) / 1000L;
        return (int) (samples * REQUIRED_BLOCK_ALIGN);
    }
}
