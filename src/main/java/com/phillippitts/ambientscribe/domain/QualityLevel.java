package com.phillippitts.ambientscribe.domain;

/**
 * Diarization quality bands derived from the rolling DER estimate.
 */
public enum QualityLevel {
    /** Not enough samples to evaluate. */
    UNKNOWN,
    /** DER at or below the good threshold (default 18%). */
    GOOD,
    /** DER at or below the moderate threshold (default 30%). */
    MODERATE,
    /** DER above the moderate threshold. */
    POOR
}
