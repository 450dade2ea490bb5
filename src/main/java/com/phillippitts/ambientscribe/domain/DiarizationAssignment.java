package com.phillippitts.ambientscribe.domain;

import java.util.Objects;

/**
 * Speaker decision for one qualifying frame or utterance boundary.
 *
 * @param speaker          assigned role
 * @param label            human-readable role label (e.g. "Doctor")
 * @param energy           energy the decision was based on, in [0,1]
 * @param confidence       decision confidence in [0,1]
 * @param timestampMillis  frame timestamp (or wall-clock time for manual changes)
 * @param manualOverride   true when the role came from a manual assignment or swap
 */
public record DiarizationAssignment(
        SpeakerRole speaker,
        String label,
        float energy,
        float confidence,
        long timestampMillis,
        boolean manualOverride
) {

    public DiarizationAssignment {
        Objects.requireNonNull(speaker, "speaker must not be null");
        Objects.requireNonNull(label, "label must not be null");
        if (confidence < 0f || confidence > 1f) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }
}
