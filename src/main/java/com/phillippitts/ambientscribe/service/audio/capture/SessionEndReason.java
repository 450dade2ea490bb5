package com.phillippitts.ambientscribe.service.audio.capture;

/**
 * Why a capture session ended.
 */
public enum SessionEndReason {
    /** {@code stopSession()} was called. */
    STOPPED,
    /** The source returned an error mid-session; retained audio is kept. */
    READ_ERROR,
    /** The engine was shut down with the application context. */
    SHUTDOWN
}
