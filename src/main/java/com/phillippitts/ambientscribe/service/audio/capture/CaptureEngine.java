package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.domain.VadState;

import java.util.Optional;
import java.util.UUID;

/**
 * Streaming microphone capture with a retained trailing window.
 *
 * Contract:
 * - One active session at a time
 * - Retained audio and frames are canonical PCM (16kHz, 16-bit, mono, little-endian)
 * - Retained audio survives a session end until purged (or auto-purged on stop)
 */
public interface CaptureEngine {

    /**
     * Opens the source and starts the capture thread.
     *
     * @throws com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException if the source cannot start
     * @throws IllegalStateException if another session is active
     */
    UUID startSession();

    /** Stops the active session. No-op if already stopped; safe to call repeatedly. */
    void stopSession();

    boolean isCapturing();

    Optional<UUID> currentSessionId();

    /**
     * Subscribes to the frames of the running session, or of the next session when idle.
     * The subscription finishes when that session ends.
     */
    FrameSubscription subscribeFrames();

    /** Latest voice-activity state; a slow reader only sees the newest. */
    LatestValue<VadState> vadStates();

    /** Retained bytes, oldest first. */
    byte[] snapshotRetainedAudio();

    /**
     * Zero-fills the retained window.
     *
     * @return bytes that were retained before the purge
     */
    int purgeRetainedAudio();

    boolean isRetainedAudioEmpty();

    /** Number of bytes currently retained. */
    int retainedBytes();

    /** Retained audio wrapped in a 44-byte WAV header. */
    byte[] exportRetainedAudioAsWav();

    /** Current autotuner state. */
    BufferTuningSnapshot tuningState();
}
