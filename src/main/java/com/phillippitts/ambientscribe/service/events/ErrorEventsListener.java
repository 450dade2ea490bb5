package com.phillippitts.ambientscribe.service.events;

import com.phillippitts.ambientscribe.service.audio.capture.event.CaptureErrorEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for capture error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);
    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    // Package-private for tests
    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onCaptureError(CaptureErrorEvent e) {
        String key = "capture-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Capture error: reason={}. {}", e.reason(), hintFor(e.reason()));
        }
    }

    static String hintFor(String reason) {
        return switch (reason) {
            case "MIC_PERMISSION_DENIED" -> "Grant microphone access to the Java process and restart capture.";
            case "MIC_UNAVAILABLE" -> "Check that an input device is connected and not in use.";
            case "UNSUPPORTED_FORMAT" -> "The device accepts none of the supported 16-bit mono sample rates.";
            case "READ_ERROR" -> "Session ended; retained audio is kept until purged.";
            default -> "Check microphone device & permissions.";
        };
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
