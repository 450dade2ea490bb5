package com.phillippitts.ambientscribe.exception;

/**
 * Thrown when the microphone cannot be opened or started: missing device, denied permission,
 * or no supported sample rate after all fallback rates were tried.
 *
 * <p>Capture never starts when this is thrown; no retained audio is touched.
 */
public class AudioSourceUnavailableException extends AmbientScribeException {

    /** Machine-readable cause, also used as the {@code CaptureErrorEvent} reason. */
    public enum Reason {
        MIC_UNAVAILABLE,
        MIC_PERMISSION_DENIED,
        UNSUPPORTED_FORMAT
    }

    private final Reason reason;

    public AudioSourceUnavailableException(Reason reason, String message) {
        super("Audio source unavailable (" + reason + "): " + message);
        this.reason = reason;
    }

    public AudioSourceUnavailableException(Reason reason, String message, Throwable cause) {
        super("Audio source unavailable (" + reason + "): " + message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
