package com.phillippitts.ambientscribe.service.audio.capture;

/**
 * Point-in-time view of the autotuner.
 *
 * @param activeChunkBytes     chunk size the running (or last) session reads with
 * @param proposedChunkBytes   chunk size the next session will use
 * @param consecutiveUnderruns current underrun streak
 * @param consecutiveOverruns  current overrun streak
 * @param adjustmentCount      adjustments proposed this session
 * @param totalUnderruns       underruns observed this session
 * @param totalOverruns        overruns observed this session
 */
public record BufferTuningSnapshot(
        int activeChunkBytes,
        int proposedChunkBytes,
        int consecutiveUnderruns,
        int consecutiveOverruns,
        int adjustmentCount,
        long totalUnderruns,
        long totalOverruns
) { }
