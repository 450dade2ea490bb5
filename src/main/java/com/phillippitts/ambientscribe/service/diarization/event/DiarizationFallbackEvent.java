package com.phillippitts.ambientscribe.service.diarization.event;

import java.time.Instant;

/**
 * Published when single-speaker fallback mode is entered or left.
 *
 * @param active       true on entry, false on exit
 * @param reason       {@link #REASON_HIGH_DER}, {@link #REASON_LOW_SWAP_ACCURACY} or {@link #REASON_COUNTDOWN_ELAPSED}
 * @param der          DER estimate at the transition
 * @param swapAccuracy swap accuracy at the transition
 * @param at           transition time
 */
public record DiarizationFallbackEvent(boolean active, String reason, double der, double swapAccuracy, Instant at) {

    public static final String REASON_HIGH_DER = "high_der";
    public static final String REASON_LOW_SWAP_ACCURACY = "low_swap_accuracy";
    public static final String REASON_COUNTDOWN_ELAPSED = "countdown_elapsed";
}
