package com.phillippitts.ambientscribe.util;

import java.time.Duration;

/**
 * Timeout values for capture thread and consumer lifecycle management.
 *
 * <p>Nothing in the capture core performs network or disk I/O; these bound only thread joins
 * and consumer polling.
 *
 * @see com.phillippitts.ambientscribe.service.audio.capture.StreamingCaptureEngine
 * @since 1.0
 */
public final class CaptureTimeouts {

    /**
     * Timeout for the capture thread to terminate during a normal stop.
     *
     * <p>The loop checks its running flag after every read, so one chunk duration
     * (at most 200ms) plus source teardown is the expected worst case.
     */
    public static final Duration CAPTURE_THREAD_STOP_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Timeout for the capture thread during application shutdown (best-effort).
     */
    public static final Duration CAPTURE_THREAD_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * How long a frame consumer blocks before re-checking for session end or interruption.
     */
    public static final Duration FRAME_POLL_INTERVAL = Duration.ofMillis(50);

    private CaptureTimeouts() {
        // Utility class - prevent instantiation
    }
}
