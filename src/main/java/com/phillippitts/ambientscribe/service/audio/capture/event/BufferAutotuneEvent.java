package com.phillippitts.ambientscribe.service.audio.capture.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when the autotuner proposes a chunk-size change for the next session.
 *
 * @param sessionId        session during which the streak was observed
 * @param oldChunkBytes    chunk size before the proposal
 * @param newChunkBytes    proposed chunk size
 * @param reason           "underrun" or "overrun"
 * @param consecutiveCount streak length that triggered the proposal
 * @param at               proposal time
 */
public record BufferAutotuneEvent(
        UUID sessionId,
        int oldChunkBytes,
        int newChunkBytes,
        String reason,
        int consecutiveCount,
        Instant at
) { }
