package com.phillippitts.ambientscribe.service.audio.capture.event;

import com.phillippitts.ambientscribe.service.audio.capture.SourceFormat;

import java.time.Instant;
import java.util.UUID;

/**
 * Published synchronously by {@code startSession()} before the capture thread reads its first
 * chunk, so listeners can subscribe to frames without missing any.
 *
 * @param sessionId    new session id
 * @param chunkBytes   read chunk size chosen for this session
 * @param sourceFormat format the device actually delivers (before resampling)
 * @param at           start time
 */
public record CaptureSessionStartedEvent(UUID sessionId, int chunkBytes, SourceFormat sourceFormat, Instant at) { }
