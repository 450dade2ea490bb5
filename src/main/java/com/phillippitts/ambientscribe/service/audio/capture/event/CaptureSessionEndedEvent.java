package com.phillippitts.ambientscribe.service.audio.capture.event;

import com.phillippitts.ambientscribe.service.audio.capture.SessionEndReason;

import java.time.Instant;
import java.util.UUID;

/**
 * Published from the capture thread once its loop has exited.
 *
 * @param sessionId     session id
 * @param reason        why the session ended
 * @param bytesCaptured PCM bytes read from the source
 * @param framesEmitted VAD frames produced
 * @param framesDropped frames discarded across all subscriber queues
 * @param underruns     late chunk arrivals observed
 * @param overruns      early chunk arrivals observed
 * @param at            end time
 */
public record CaptureSessionEndedEvent(
        UUID sessionId,
        SessionEndReason reason,
        long bytesCaptured,
        long framesEmitted,
        long framesDropped,
        long underruns,
        long overruns,
        Instant at
) { }
