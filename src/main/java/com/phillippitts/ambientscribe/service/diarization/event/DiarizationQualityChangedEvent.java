package com.phillippitts.ambientscribe.service.diarization.event;

import com.phillippitts.ambientscribe.domain.QualityLevel;

import java.time.Instant;

/**
 * Published on every quality band transition.
 */
public record DiarizationQualityChangedEvent(
        QualityLevel previous,
        QualityLevel current,
        double der,
        double swapAccuracy,
        Instant at
) { }
