package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts one capture session once the application is ready, when
 * {@code audio.capture.auto-start=true}. The engine's own shutdown hook stops it.
 */
@Component
class CaptureAutoStarter {

    private static final Logger LOG = LogManager.getLogger(CaptureAutoStarter.class);

    private final AudioCaptureProperties props;
    private final CaptureEngine engine;

    CaptureAutoStarter(AudioCaptureProperties props, CaptureEngine engine) {
        this.props = props;
        this.engine = engine;
    }

    @EventListener(ApplicationReadyEvent.class)
    void onReady() {
        if (!props.isAutoStart()) {
            LOG.debug("Capture auto-start disabled");
            return;
        }
        try {
            engine.startSession();
        } catch (AudioSourceUnavailableException e) {
            // already published as a CaptureErrorEvent; the application stays up without capture
            LOG.warn("Capture auto-start failed: reason={}", e.getReason());
        }
    }
}
