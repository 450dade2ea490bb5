package com.phillippitts.ambientscribe.service.events;

import com.phillippitts.ambientscribe.service.audio.capture.event.BufferAutotuneEvent;
import com.phillippitts.ambientscribe.service.audio.capture.event.CaptureErrorEvent;
import com.phillippitts.ambientscribe.service.audio.capture.event.CaptureSessionEndedEvent;
import com.phillippitts.ambientscribe.service.audio.capture.event.CaptureSessionStartedEvent;
import com.phillippitts.ambientscribe.service.audio.capture.event.RetainedAudioPurgedEvent;
import com.phillippitts.ambientscribe.service.diarization.event.DiarizationFallbackEvent;
import com.phillippitts.ambientscribe.service.diarization.event.DiarizationQualityChangedEvent;
import com.phillippitts.ambientscribe.service.diarization.event.SpeakerChangedEvent;
import com.phillippitts.ambientscribe.service.metrics.CaptureMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Forwards capture and diarization events to {@link CaptureMetrics} and the audit log.
 *
 * <p>Runs on the event executor so the capture thread never waits on metrics delivery.
 * Audit lines carry counts, reasons and ids only; never audio content.
 */
@Component
class CaptureEventsListener {
    private static final Logger AUDIT = LogManager.getLogger("ambientscribe.audit");

    private final CaptureMetrics metrics;

    CaptureEventsListener(CaptureMetrics metrics) {
        this.metrics = metrics;
    }

    @Async("eventExecutor")
    @EventListener
    public void onSessionStarted(CaptureSessionStartedEvent e) {
        metrics.incrementSessionsStarted();
        AUDIT.info("capture.session.started id={} chunkBytes={} sourceRate={}",
                e.sessionId(), e.chunkBytes(), e.sourceFormat().sampleRate());
    }

    @Async("eventExecutor")
    @EventListener
    public void onSessionEnded(CaptureSessionEndedEvent e) {
        metrics.recordSessionEnded(e.reason().name(), e.bytesCaptured(), e.framesEmitted(),
                e.framesDropped(), e.underruns(), e.overruns());
        AUDIT.info("capture.session.ended id={} reason={} bytes={} frames={} dropped={} underruns={} overruns={}",
                e.sessionId(), e.reason(), e.bytesCaptured(), e.framesEmitted(), e.framesDropped(),
                e.underruns(), e.overruns());
    }

    @Async("eventExecutor")
    @EventListener
    public void onAutotune(BufferAutotuneEvent e) {
        metrics.recordAutotune(e.reason(), e.newChunkBytes());
        AUDIT.info("capture.autotune session={} old={} new={} reason={} consecutive={}",
                e.sessionId(), e.oldChunkBytes(), e.newChunkBytes(), e.reason(), e.consecutiveCount());
    }

    @Async("eventExecutor")
    @EventListener
    public void onPurge(RetainedAudioPurgedEvent e) {
        metrics.recordPurge(e.trigger().name(), e.bytesPurged());
        AUDIT.info("capture.purge bytes={} trigger={}", e.bytesPurged(), e.trigger());
    }

    @Async("eventExecutor")
    @EventListener
    public void onCaptureError(CaptureErrorEvent e) {
        metrics.incrementCaptureError(e.reason());
    }

    @Async("eventExecutor")
    @EventListener
    public void onSpeakerChanged(SpeakerChangedEvent e) {
        metrics.incrementSpeakerChange(e.manual());
    }

    @Async("eventExecutor")
    @EventListener
    public void onQualityChanged(DiarizationQualityChangedEvent e) {
        metrics.recordQuality(e.current());
        AUDIT.info("diarization.quality {} -> {} der={} swapAccuracy={}",
                e.previous(), e.current(), e.der(), e.swapAccuracy());
    }

    @Async("eventExecutor")
    @EventListener
    public void onFallback(DiarizationFallbackEvent e) {
        metrics.recordFallback(e.active(), e.reason());
        AUDIT.info("diarization.fallback active={} reason={} der={} swapAccuracy={}",
                e.active(), e.reason(), e.der(), e.swapAccuracy());
    }
}
