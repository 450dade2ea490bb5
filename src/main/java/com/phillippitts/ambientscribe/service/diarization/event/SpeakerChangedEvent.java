package com.phillippitts.ambientscribe.service.diarization.event;

import com.phillippitts.ambientscribe.domain.SpeakerRole;

import java.time.Instant;

/**
 * Published when the diarizer's current speaker changes, automatically or by manual override.
 *
 * @param from            previous role
 * @param to              new role
 * @param label           label of the new role
 * @param manual          true for setCurrentSpeaker/swapRoles
 * @param timestampMillis frame or wall-clock time of the change
 * @param at              publish time
 */
public record SpeakerChangedEvent(
        SpeakerRole from,
        SpeakerRole to,
        String label,
        boolean manual,
        long timestampMillis,
        Instant at
) { }
