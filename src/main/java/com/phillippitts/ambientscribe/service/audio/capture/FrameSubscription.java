package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.domain.AudioFrame;
import com.phillippitts.ambientscribe.util.CaptureTimeouts;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One consumer's view of a capture session's frame stream.
 *
 * <p>Frames are handed over through a bounded queue. The producer never blocks: when the queue is
 * full the oldest frame is discarded and counted in {@link #droppedFrames()}. The sequence is
 * finite; iteration ends once the session ends and the queue has drained, or when the consumer
 * {@link #close() closes} the subscription or is interrupted.
 *
 * <p>Iterate from a single consumer thread. Subscribe again for the next session.
 */
public final class FrameSubscription implements Iterable<AudioFrame>, AutoCloseable {

    private final BlockingQueue<AudioFrame> queue;
    private final AtomicLong dropped = new AtomicLong();
    private final Consumer<FrameSubscription> onClose;
    private volatile boolean completed;
    private volatile boolean closed;
    private volatile SessionEndReason endReason;

    FrameSubscription(int capacity, Consumer<FrameSubscription> onClose) {
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.onClose = onClose;
    }

    /** Producer side. Never blocks. */
    void offer(AudioFrame frame) {
        if (completed) {
            return;
        }
        while (!queue.offer(frame)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    /** Producer side. Marks the end of the session's stream. */
    void complete(SessionEndReason reason) {
        this.endReason = reason;
        this.completed = true;
    }

    /**
     * Waits up to {@code timeout} for the next frame.
     *
     * @return the next frame, or empty on timeout or when the stream is finished
     * @throws InterruptedException if interrupted while waiting
     */
    public Optional<AudioFrame> poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (closed) {
            return Optional.empty();
        }
        return Optional.ofNullable(queue.poll(timeout, unit));
    }

    /** True once no further frames can arrive and the queue is empty. */
    public boolean isFinished() {
        return closed || (completed && queue.isEmpty());
    }

    public long droppedFrames() {
        return dropped.get();
    }

    /** Why the underlying session ended; empty while it is still running. */
    public Optional<SessionEndReason> endReason() {
        return Optional.ofNullable(endReason);
    }

    @Override
    public Iterator<AudioFrame> iterator() {
        return new Iterator<>() {
            private AudioFrame next;

            @Override
            public boolean hasNext() {
                while (next == null) {
                    if (isFinished()) {
                        return false;
                    }
                    try {
                        next = queue.poll(CaptureTimeouts.FRAME_POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                    if (closed) {
                        next = null;
                        return false;
                    }
                }
                return true;
            }

            @Override
            public AudioFrame next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                AudioFrame frame = next;
                next = null;
                return frame;
            }
        };
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        completed = true;
        queue.clear();
        onClose.accept(this);
    }
}
