package com.phillippitts.ambientscribe.service.audio.capture;

/**
 * A proposed chunk-size change. Applied at the next session start, never mid-session.
 *
 * @param oldChunkBytes    chunk size before the adjustment
 * @param newChunkBytes    proposed chunk size
 * @param reason           {@link #REASON_UNDERRUN} or {@link #REASON_OVERRUN}
 * @param consecutiveCount length of the streak that triggered it
 */
public record BufferAdjustment(int oldChunkBytes, int newChunkBytes, String reason, int consecutiveCount) {

    public static final String REASON_UNDERRUN = "underrun";
    public static final String REASON_OVERRUN = "overrun";
}
