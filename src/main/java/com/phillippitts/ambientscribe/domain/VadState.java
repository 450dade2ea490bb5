package com.phillippitts.ambientscribe.domain;

/**
 * Latest voice-activity state observed by the capture loop.
 *
 * @param voiceActive     whether the most recent frame was voice-active
 * @param energy          energy of that frame, in [0,1]
 * @param timestampMillis timestamp of that frame
 */
public record VadState(boolean voiceActive, float energy, long timestampMillis) {

    public static VadState of(AudioFrame frame) {
        return new VadState(frame.voiceActive(), frame.energy(), frame.timestampMillis());
    }
}
