package com.phillippitts.ambientscribe.service.diarization;

import com.phillippitts.ambientscribe.domain.AudioFrame;
import com.phillippitts.ambientscribe.service.audio.capture.CaptureEngine;
import com.phillippitts.ambientscribe.service.audio.capture.FrameSubscription;
import com.phillippitts.ambientscribe.service.audio.capture.event.CaptureSessionStartedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Feeds each capture session's frames to the {@link SpeakerDiarizer} off the capture thread.
 *
 * <p>Runs synchronously inside {@code startSession()} (the started event is published before the
 * first read), resets the diarizer, subscribes to frames and hands the drain loop to the
 * diarization executor. The loop ends when the session ends.
 */
@Component
public class DiarizationWorker {

    private static final Logger LOG = LogManager.getLogger(DiarizationWorker.class);

    private final CaptureEngine engine;
    private final SpeakerDiarizer diarizer;
    private final Executor executor;

    public DiarizationWorker(CaptureEngine engine,
                             SpeakerDiarizer diarizer,
                             @Qualifier("diarizationExecutor") Executor executor) {
        this.engine = engine;
        this.diarizer = diarizer;
        this.executor = executor;
    }

    @EventListener
    public void onSessionStarted(CaptureSessionStartedEvent event) {
        diarizer.reset();
        FrameSubscription subscription = engine.subscribeFrames();
        try {
            executor.execute(() -> drain(event.sessionId(), subscription));
        } catch (RejectedExecutionException e) {
            LOG.error("Diarization executor saturated; session {} runs without diarization", event.sessionId(), e);
            subscription.close();
        }
    }

    private void drain(UUID sessionId, FrameSubscription subscription) {
        ThreadContext.put("sessionId", sessionId.toString());
        long frames = 0;
        long assignments = 0;
        try (subscription) {
            for (AudioFrame frame : subscription) {
                frames++;
                if (diarizer.process(frame).isPresent()) {
                    assignments++;
                }
            }
            LOG.info("Diarization finished: frames={}, assignments={}, dropped={}, endReason={}, metrics={}",
                    frames, assignments, subscription.droppedFrames(),
                    subscription.endReason().map(Enum::name).orElse("CLOSED"), diarizer.metrics());
        } finally {
            ThreadContext.remove("sessionId");
        }
    }
}
