/**
 * Streaming capture core: microphone sources, the retained ring buffer, chunk-timing autotune
 * and the frame hand-off channels.
 *
 * <p>Threading: {@link com.phillippitts.ambientscribe.service.audio.capture.StreamingCaptureEngine}
 * owns one elevated-priority thread per session. All ring buffer writes and frame emission happen
 * there; consumers read through {@link com.phillippitts.ambientscribe.service.audio.capture.FrameSubscription}
 * (bounded, drop-oldest) and {@link com.phillippitts.ambientscribe.service.audio.capture.LatestValue}
 * (latest wins), so the capture thread never waits on a consumer.
 *
 * @since 1.0
 */
package com.phillippitts.ambientscribe.service.audio.capture;
