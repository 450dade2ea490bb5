package com.phillippitts.ambientscribe.service.audio.capture.event;

import com.phillippitts.ambientscribe.service.audio.capture.PurgeTrigger;

import java.time.Instant;

/**
 * Audit record of a retained-audio purge. Carries no audio content.
 *
 * @param bytesPurged bytes that were buffered before the purge
 * @param trigger     what caused it
 * @param at          purge time
 */
public record RetainedAudioPurgedEvent(int bytesPurged, PurgeTrigger trigger, Instant at) { }
