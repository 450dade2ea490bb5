package com.phillippitts.ambientscribe.service.diarization;

import com.phillippitts.ambientscribe.config.properties.DiarizationProperties;
import com.phillippitts.ambientscribe.config.properties.DiarizationQualityProperties;
import com.phillippitts.ambientscribe.domain.AudioFrame;
import com.phillippitts.ambientscribe.domain.DiarizationAssignment;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared fixtures for diarization tests: 30 ms synthetic energy frames.
 */
final class DiarizationTestSupport {

    static final long FRAME_MS = 30;
    static final float SILENCE = 0.001f;

    private DiarizationTestSupport() {}

    /** Short timings so scenarios stay small: 150 ms utterances, 500 ms hysteresis, 300 ms silence. */
    static DiarizationProperties fastProps() {
        DiarizationProperties props = new DiarizationProperties();
        props.setMinUtteranceDurationMs(150);
        props.setSwitchHysteresisMs(500);
        props.setSilenceThresholdMs(300);
        return props;
    }

    /** Quality settings that never evaluate DER or swap accuracy. */
    static DiarizationQualityProperties inertQuality() {
        DiarizationQualityProperties q = new DiarizationQualityProperties();
        q.setMinSamples(10_000);
        q.setHistorySize(10_000);
        q.setMinSwapEvents(10_000);
        return q;
    }

    /**
     * Feeds {@code count} frames starting at frame index {@code startIndex}.
     *
     * @return assignments produced, in order
     */
    static List<DiarizationAssignment> feed(SpeakerDiarizer diarizer, int startIndex, int count,
                                            float energy, boolean voiceActive) {
        List<DiarizationAssignment> out = new ArrayList<>();
        for (int i = startIndex; i < startIndex + count; i++) {
            diarizer.process(AudioFrame.ofEnergy(i * FRAME_MS, energy, voiceActive)).ifPresent(out::add);
        }
        return out;
    }

    static List<DiarizationAssignment> speech(SpeakerDiarizer diarizer, int startIndex, int count, float energy) {
        return feed(diarizer, startIndex, count, energy, true);
    }

    static List<DiarizationAssignment> silence(SpeakerDiarizer diarizer, int startIndex, int count) {
        return feed(diarizer, startIndex, count, SILENCE, false);
    }
}
