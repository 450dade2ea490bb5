package com.phillippitts.ambientscribe.service.audio.capture.event;

import java.time.Instant;

/**
 * Published when microphone capture fails (permissions, device errors, read errors).
 *
 * <p>Payload contains a short reason and timestamp. Avoids any PII.
 */
public record CaptureErrorEvent(String reason, Instant at) {

    public static final String READ_ERROR = "READ_ERROR";
    public static final String CAPTURE_ERROR = "CAPTURE_ERROR";
}
