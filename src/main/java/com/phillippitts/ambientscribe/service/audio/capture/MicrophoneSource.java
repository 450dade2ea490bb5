package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException;

/**
 * Platform audio input consumed by the capture engine.
 *
 * <p>Implementations deliver 16-bit mono little-endian PCM. Only the sample rate may differ from
 * the canonical format; a non-canonical source is wrapped in {@link ResamplingMicrophoneSource}
 * before it reaches the engine.
 *
 * <p>The engine runs its read loop on a dedicated thread at elevated priority; implementations
 * must tolerate {@link #stop()} being called from that same thread after the last read.
 */
public interface MicrophoneSource {

    /**
     * Opens and starts the device.
     *
     * @throws AudioSourceUnavailableException if the device cannot be opened, access is denied,
     *                                         or no supported format exists
     */
    void start();

    /**
     * Blocks until up to {@code len} bytes are available and copies them into {@code buffer}.
     *
     * @return bytes read (0 when nothing was available), or a negative value on a read error
     */
    int read(byte[] buffer, int off, int len);

    /** Stops and releases the device. Safe to call when not started. */
    void stop();

    /** Format of the bytes returned by {@link #read}; meaningful after {@link #start()}. */
    SourceFormat reportedFormat();
}
