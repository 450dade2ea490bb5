package com.phillippitts.ambientscribe.service.health;

import com.phillippitts.ambientscribe.service.audio.capture.BufferTuningSnapshot;
import com.phillippitts.ambientscribe.service.audio.capture.CaptureEngine;
import com.phillippitts.ambientscribe.service.diarization.DiarizationMetrics;
import com.phillippitts.ambientscribe.service.diarization.SpeakerDiarizer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for capture and diarization.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: capture idle, or capturing with automatic diarization</li>
 *   <li>DEGRADED: capturing while diarization is in single-speaker fallback mode</li>
 * </ul>
 *
 * <p>Neither condition is fatal, so this indicator never reports DOWN.
 */
@Component
public class CaptureEngineHealthIndicator implements HealthIndicator {

    private final CaptureEngine engine;
    private final SpeakerDiarizer diarizer;

    public CaptureEngineHealthIndicator(CaptureEngine engine, SpeakerDiarizer diarizer) {
        this.engine = engine;
        this.diarizer = diarizer;
    }

    @Override
    public Health health() {
        boolean capturing = engine.isCapturing();
        DiarizationMetrics metrics = diarizer.metrics();
        BufferTuningSnapshot tuning = engine.tuningState();

        Health.Builder builder = new Health.Builder();
        if (capturing && metrics.fallbackMode()) {
            builder.status("DEGRADED").withDetail("status", "Single-speaker fallback mode");
        } else {
            builder.up().withDetail("status", capturing ? "Capturing" : "Idle");
        }
        return builder
                .withDetail("capturing", capturing)
                .withDetail("retainedBytes", engine.retainedBytes())
                .withDetail("chunkBytes", tuning.activeChunkBytes())
                .withDetail("proposedChunkBytes", tuning.proposedChunkBytes())
                .withDetail("speaker", diarizer.currentSpeaker().name())
                .withDetail("quality", metrics.quality().name())
                .withDetail("der", metrics.der())
                .withDetail("fallbackMode", metrics.fallbackMode())
                .build();
    }
}
