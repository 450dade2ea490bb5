package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.ambientscribe.domain.AudioFrame;
import com.phillippitts.ambientscribe.domain.VadState;
import com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException;
import com.phillippitts.ambientscribe.service.audio.AudioFormat;
import com.phillippitts.ambientscribe.service.audio.FrameAccumulator;
import com.phillippitts.ambientscribe.service.audio.WavWriter;
import com.phillippitts.ambientscribe.service.audio.capture.event.BufferAutotuneEvent;
import com.phillippitts.ambientscribe.service.audio.capture.event.CaptureErrorEvent;
import com.phillippitts.ambientscribe.service.audio.capture.event.CaptureSessionEndedEvent;
import com.phillippitts.ambientscribe.service.audio.capture.event.CaptureSessionStartedEvent;
import com.phillippitts.ambientscribe.service.audio.capture.event.RetainedAudioPurgedEvent;
import com.phillippitts.ambientscribe.util.CaptureTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Capture engine that runs a blocking read loop on a dedicated high-priority thread.
 *
 * <p>Each chunk read from the {@link MicrophoneSource} is timed by the {@link BufferAutotuner},
 * written to the retained {@link PcmRingBuffer}, and sliced into VAD frames by a
 * {@link FrameAccumulator}. Frames go to every {@link FrameSubscription} without blocking; the
 * newest {@link VadState} goes to a {@link LatestValue} channel.
 *
 * <p>The ring buffer is created once with the engine and spans sessions. It is emptied only by a
 * purge: manual, automatic on stop when {@code audio.capture.auto-purge-on-stop} is set, or on
 * shutdown. A read error ends the session but leaves retained audio in place.
 *
 * <p>Thread-safe for a single active session. Test configurations can provide alternative
 * {@link MicrophoneSource} beans by marking them as @Primary.
 */
@Service
public class StreamingCaptureEngine implements CaptureEngine {

    private static final Logger LOG = LogManager.getLogger(StreamingCaptureEngine.class);
    static final String MDC_SESSION_ID = "sessionId";

    private final AudioCaptureProperties props;
    private final MicrophoneSource source;
    private final ApplicationEventPublisher publisher;
    private final LongSupplier nanoClock;
    private final Clock clock;

    private final PcmRingBuffer ringBuffer;
    private final BufferAutotuner autotuner;
    private final LatestValue<VadState> vadStates = new LatestValue<>();
    private final List<FrameSubscription> pendingSubscribers = new CopyOnWriteArrayList<>();

    private final Object lock = new Object();
    private Session current;

    @Autowired
    public StreamingCaptureEngine(AudioCaptureProperties props,
                                  MicrophoneSource source,
                                  ApplicationEventPublisher publisher) {
        this(props, source, publisher, System::nanoTime, Clock.systemUTC());
    }

    // Package-private for tests
    StreamingCaptureEngine(AudioCaptureProperties props,
                           MicrophoneSource source,
                           ApplicationEventPublisher publisher,
                           LongSupplier nanoClock,
                           Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.source = Objects.requireNonNull(source);
        this.publisher = Objects.requireNonNull(publisher);
        this.nanoClock = Objects.requireNonNull(nanoClock);
        this.clock = Objects.requireNonNull(clock);
        this.ringBuffer = new PcmRingBuffer(AudioFormat.bytesForMillis(props.getRetentionSeconds() * 1000L));
        this.autotuner = new BufferAutotuner(AudioFormat.bytesForMillis(props.getChunkMillis()));
    }

    @PostConstruct
    public void logConfiguration() {
        LOG.info("Capture engine initialized: retention={}s ({} bytes), chunk={}ms ({} bytes), frame={}ms, "
                        + "vadThreshold={}, autoPurgeOnStop={}",
                props.getRetentionSeconds(), ringBuffer.capacity(), props.getChunkMillis(),
                autotuner.initialChunkBytes(), props.getFrameMillis(), props.getVadThreshold(),
                props.isAutoPurgeOnStop());
    }

    @Override
    public UUID startSession() {
        synchronized (lock) {
            if (current != null && current.running.get()) {
                throw new IllegalStateException("Another capture session is already active");
            }
            try {
                source.start();
            } catch (AudioSourceUnavailableException e) {
                LOG.warn("Microphone unavailable: {}", e.getMessage());
                publisher.publishEvent(new CaptureErrorEvent(e.getReason().name(), clock.instant()));
                throw e;
            }

            UUID id = UUID.randomUUID();
            Session s = new Session(id, autotuner.beginSession(), clock.millis());
            s.subscribers.addAll(pendingSubscribers);
            pendingSubscribers.clear();
            s.running.set(true);
            current = s;

            try {
                publisher.publishEvent(new CaptureSessionStartedEvent(id, s.chunkBytes,
                        sourceFormatOf(source), clock.instant()));
            } catch (RuntimeException e) {
                s.running.set(false);
                current = null;
                stopSource();
                throw e;
            }

            Thread t = new Thread(() -> runCaptureLoop(s), "audio-capture");
            t.setDaemon(true);
            t.setPriority(Thread.MAX_PRIORITY);
            s.thread = t;
            t.start();
            LOG.info("Capture session {} started (chunk={} bytes)", id, s.chunkBytes);
            return id;
        }
    }

    @Override
    public void stopSession() {
        if (stopCurrent(SessionEndReason.STOPPED, CaptureTimeouts.CAPTURE_THREAD_STOP_TIMEOUT)
                && props.isAutoPurgeOnStop()) {
            purge(PurgeTrigger.AUTOMATIC_ON_STOP);
        }
    }

    @PreDestroy
    public void shutdown() {
        stopCurrent(SessionEndReason.SHUTDOWN, CaptureTimeouts.CAPTURE_THREAD_SHUTDOWN_TIMEOUT);
        for (FrameSubscription sub : pendingSubscribers) {
            sub.complete(SessionEndReason.SHUTDOWN);
        }
        pendingSubscribers.clear();
        purge(PurgeTrigger.SHUTDOWN);
    }

    /**
     * Flips the running flag of the current session and waits for its thread.
     *
     * @return true if this call ended a running session
     */
    private boolean stopCurrent(SessionEndReason reason, Duration joinTimeout) {
        Session s;
        synchronized (lock) {
            s = current;
            current = null;
        }
        if (s == null) {
            return false;
        }
        s.stopReason = reason;
        boolean stoppedByUs;
        synchronized (s.writeGate) {
            stoppedByUs = s.running.compareAndSet(true, false);
        }
        if (stoppedByUs) {
            // unblocks a pending read; no chunk reaches the ring buffer after this point
            stopSource();
        }
        // Join thread outside lock to avoid deadlock with listeners
        joinThread(s.thread, joinTimeout.toMillis());
        if (stoppedByUs) {
            LOG.info("Capture session {} stopped", s.id);
        }
        return stoppedByUs;
    }

    private void runCaptureLoop(Session s) {
        ThreadContext.put(MDC_SESSION_ID, s.id.toString());
        SessionEndReason endReason = null;
        FrameAccumulator accumulator = new FrameAccumulator(props.getFrameMillis(), props.getVadThreshold());
        accumulator.reset(s.startedAtMillis);
        byte[] buf = new byte[s.chunkBytes];
        try {
            while (s.running.get()) {
                int n = source.read(buf, 0, buf.length);
                if (!s.running.get()) {
                    break;
                }
                if (n < 0) {
                    LOG.warn("Microphone read returned {}; ending session", n);
                    endReason = SessionEndReason.READ_ERROR;
                    publisher.publishEvent(new CaptureErrorEvent(CaptureErrorEvent.READ_ERROR, clock.instant()));
                    break;
                }
                if (n == 0) {
                    continue;
                }
                autotuner.onChunk(nanoClock.getAsLong(), n).ifPresent(adj -> onAdjustment(s, adj));
                synchronized (s.writeGate) {
                    if (!s.running.get()) {
                        LOG.debug("Dropping {} bytes read after stop", n);
                        break;
                    }
                    ringBuffer.write(buf, 0, n);
                }
                s.bytesCaptured += n;
                s.framesEmitted += accumulator.accept(buf, 0, n, frame -> dispatch(s, frame));
                LOG.debug("Audio capture: read {} bytes, total {} bytes", n, s.bytesCaptured);
            }
        } catch (RuntimeException e) {
            LOG.warn("Capture failed: {}", e.toString());
            endReason = SessionEndReason.READ_ERROR;
            publisher.publishEvent(new CaptureErrorEvent(CaptureErrorEvent.CAPTURE_ERROR, clock.instant()));
        } finally {
            boolean endedHere;
            synchronized (s.writeGate) {
                endedHere = s.running.getAndSet(false);
            }
            if (endedHere) {
                stopSource();
            }
            finishSession(s, endReason != null ? endReason : s.stopReason);
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    private void dispatch(Session s, AudioFrame frame) {
        for (FrameSubscription sub : s.subscribers) {
            sub.offer(frame);
        }
        vadStates.publish(VadState.of(frame));
    }

    private void onAdjustment(Session s, BufferAdjustment adj) {
        LOG.info("Buffer autotune: {} -> {} bytes after {} consecutive {}s (applies next session)",
                adj.oldChunkBytes(), adj.newChunkBytes(), adj.consecutiveCount(), adj.reason());
        publisher.publishEvent(new BufferAutotuneEvent(s.id, adj.oldChunkBytes(), adj.newChunkBytes(),
                adj.reason(), adj.consecutiveCount(), clock.instant()));
    }

    private void stopSource() {
        try {
            source.stop();
        } catch (RuntimeException e) {
            LOG.warn("Failed to stop microphone cleanly: {}", e.toString());
        }
    }

    private void finishSession(Session s, SessionEndReason reason) {
        long dropped = 0;
        for (FrameSubscription sub : s.subscribers) {
            sub.complete(reason);
            dropped += sub.droppedFrames();
        }
        s.subscribers.clear();
        BufferTuningSnapshot tuning = autotuner.snapshot();
        LOG.info("Capture session {} ended: reason={}, bytes={}, frames={}, dropped={}, underruns={}, overruns={}",
                s.id, reason, s.bytesCaptured, s.framesEmitted, dropped,
                tuning.totalUnderruns(), tuning.totalOverruns());
        publisher.publishEvent(new CaptureSessionEndedEvent(s.id, reason, s.bytesCaptured, s.framesEmitted,
                dropped, tuning.totalUnderruns(), tuning.totalOverruns(), clock.instant()));
    }

    @Override
    public boolean isCapturing() {
        synchronized (lock) {
            return current != null && current.running.get();
        }
    }

    @Override
    public Optional<UUID> currentSessionId() {
        synchronized (lock) {
            return current != null && current.running.get() ? Optional.of(current.id) : Optional.empty();
        }
    }

    @Override
    public FrameSubscription subscribeFrames() {
        synchronized (lock) {
            List<FrameSubscription> target = current != null && current.running.get()
                    ? current.subscribers
                    : pendingSubscribers;
            FrameSubscription subscription = new FrameSubscription(props.getFrameQueueCapacity(), target::remove);
            target.add(subscription);
            return subscription;
        }
    }

    @Override
    public LatestValue<VadState> vadStates() {
        return vadStates;
    }

    @Override
    public byte[] snapshotRetainedAudio() {
        return ringBuffer.snapshot();
    }

    @Override
    public int purgeRetainedAudio() {
        return purge(PurgeTrigger.MANUAL);
    }

    private int purge(PurgeTrigger trigger) {
        int purged = ringBuffer.purge();
        LOG.info("Retained audio purged: {} bytes (trigger={})", purged, trigger);
        publisher.publishEvent(new RetainedAudioPurgedEvent(purged, trigger, clock.instant()));
        return purged;
    }

    @Override
    public boolean isRetainedAudioEmpty() {
        return ringBuffer.isEmpty();
    }

    @Override
    public int retainedBytes() {
        return ringBuffer.bytesBuffered();
    }

    @Override
    public byte[] exportRetainedAudioAsWav() {
        return WavWriter.toWav(ringBuffer.snapshot());
    }

    @Override
    public BufferTuningSnapshot tuningState() {
        return autotuner.snapshot();
    }

    /** Retained window capacity in bytes. */
    public int retentionCapacityBytes() {
        return ringBuffer.capacity();
    }

    private static SourceFormat sourceFormatOf(MicrophoneSource source) {
        if (source instanceof ResamplingMicrophoneSource resampling) {
            return resampling.sourceFormat();
        }
        return source.reportedFormat();
    }

    private void joinThread(Thread thread, long timeoutMs) {
        if (thread == null || !thread.isAlive() || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeoutMs);
            if (thread.isAlive()) {
                LOG.warn("Capture thread did not terminate within {}ms", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for capture thread to terminate");
        }
    }

    private static final class Session {
        final UUID id;
        final int chunkBytes;
        final long startedAtMillis;
        final AtomicBoolean running = new AtomicBoolean(false);
        // orders ring buffer writes against the stop transition
        final Object writeGate = new Object();
        final List<FrameSubscription> subscribers = new CopyOnWriteArrayList<>();
        volatile Thread thread;
        volatile SessionEndReason stopReason = SessionEndReason.STOPPED;
        // written only by the capture thread
        long bytesCaptured;
        long framesEmitted;

        Session(UUID id, int chunkBytes, long startedAtMillis) {
            this.id = id;
            this.chunkBytes = chunkBytes;
            this.startedAtMillis = startedAtMillis;
        }
    }
}
