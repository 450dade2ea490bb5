package com.phillippitts.ambientscribe.service.metrics;

import com.phillippitts.ambientscribe.domain.QualityLevel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralized metrics for audio capture and diarization.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Capture sessions, bytes, frames and frame drops</li>
 *   <li>Chunk timing underruns/overruns and autotune proposals</li>
 *   <li>Retained audio purges by trigger</li>
 *   <li>Speaker changes, quality band and fallback mode</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class CaptureMetrics {

    static final String CAPTURE_PREFIX = "ambientscribe.capture";
    static final String DIARIZATION_PREFIX = "ambientscribe.diarization";

    private final MeterRegistry registry;
    private final AtomicInteger qualityLevel = new AtomicInteger(QualityLevel.UNKNOWN.ordinal());
    private final AtomicInteger fallbackActive = new AtomicInteger(0);

    public CaptureMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(DIARIZATION_PREFIX + ".quality", qualityLevel, AtomicInteger::get)
                .description("Diarization quality band (0=unknown, 1=good, 2=moderate, 3=poor)")
                .register(registry);
        Gauge.builder(DIARIZATION_PREFIX + ".fallback.active", fallbackActive, AtomicInteger::get)
                .description("1 while single-speaker fallback mode is engaged")
                .register(registry);
    }

    public void incrementSessionsStarted() {
        Counter.builder(CAPTURE_PREFIX + ".sessions")
                .description("Number of capture sessions started")
                .register(registry)
                .increment();
    }

    /**
     * Records the totals of a finished session.
     *
     * @param endReason why the session ended (STOPPED, READ_ERROR, SHUTDOWN)
     */
    public void recordSessionEnded(String endReason, long bytes, long frames, long dropped,
                                   long underruns, long overruns) {
        Counter.builder(CAPTURE_PREFIX + ".sessions.ended")
                .description("Number of capture sessions ended")
                .tag("reason", endReason)
                .register(registry)
                .increment();
        Counter.builder(CAPTURE_PREFIX + ".bytes")
                .description("PCM bytes captured")
                .baseUnit("bytes")
                .register(registry)
                .increment(bytes);
        Counter.builder(CAPTURE_PREFIX + ".frames")
                .description("VAD frames emitted")
                .register(registry)
                .increment(frames);
        Counter.builder(CAPTURE_PREFIX + ".frames.dropped")
                .description("Frames dropped by slow consumers")
                .register(registry)
                .increment(dropped);
        Counter.builder(CAPTURE_PREFIX + ".timing")
                .description("Chunk arrivals outside the expected cadence")
                .tag("kind", "underrun")
                .register(registry)
                .increment(underruns);
        Counter.builder(CAPTURE_PREFIX + ".timing")
                .description("Chunk arrivals outside the expected cadence")
                .tag("kind", "overrun")
                .register(registry)
                .increment(overruns);
    }

    /**
     * Records a chunk-size proposal.
     *
     * @param reason "underrun" or "overrun"
     */
    public void recordAutotune(String reason, int newChunkBytes) {
        Counter.builder(CAPTURE_PREFIX + ".autotune")
                .description("Chunk-size adjustments proposed")
                .tag("reason", reason)
                .register(registry)
                .increment();
        DistributionSummary.builder(CAPTURE_PREFIX + ".autotune.chunk")
                .description("Proposed chunk sizes")
                .baseUnit("bytes")
                .register(registry)
                .record(newChunkBytes);
    }

    /**
     * @param trigger MANUAL, AUTOMATIC_ON_STOP or SHUTDOWN
     */
    public void recordPurge(String trigger, int bytes) {
        Counter.builder(CAPTURE_PREFIX + ".purges")
                .description("Retained audio purges")
                .tag("trigger", trigger)
                .register(registry)
                .increment();
        Counter.builder(CAPTURE_PREFIX + ".purged.bytes")
                .description("Retained bytes purged")
                .baseUnit("bytes")
                .tag("trigger", trigger)
                .register(registry)
                .increment(bytes);
    }

    public void incrementCaptureError(String reason) {
        Counter.builder(CAPTURE_PREFIX + ".errors")
                .description("Capture failures by reason")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSpeakerChange(boolean manual) {
        Counter.builder(DIARIZATION_PREFIX + ".speaker.changes")
                .description("Speaker changes")
                .tag("manual", Boolean.toString(manual))
                .register(registry)
                .increment();
    }

    public void recordQuality(QualityLevel level) {
        qualityLevel.set(level.ordinal());
        Counter.builder(DIARIZATION_PREFIX + ".quality.transitions")
                .description("Quality band transitions")
                .tag("quality", level.name())
                .register(registry)
                .increment();
    }

    public void recordFallback(boolean active, String reason) {
        fallbackActive.set(active ? 1 : 0);
        Counter.builder(DIARIZATION_PREFIX + ".fallback")
                .description("Fallback mode transitions")
                .tag("active", Boolean.toString(active))
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
