package com.phillippitts.ambientscribe.service.diarization;

import com.phillippitts.ambientscribe.domain.QualityLevel;

/**
 * Snapshot of the quality evaluator for reporting.
 *
 * @param der               latest DER estimate in [0,1]
 * @param swapAccuracy      latest swap-correction accuracy in [0,1]
 * @param quality           quality band derived from {@code der}
 * @param fallbackMode      whether automatic switching is suspended
 * @param fallbackRemaining assignments left before fallback ends
 * @param sampleCount       assignments currently in the history
 */
public record DiarizationMetrics(
        double der,
        double swapAccuracy,
        QualityLevel quality,
        boolean fallbackMode,
        int fallbackRemaining,
        int sampleCount
) { }
