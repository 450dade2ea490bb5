package com.phillippitts.ambientscribe.service.diarization;

import com.phillippitts.ambientscribe.config.properties.DiarizationQualityProperties;
import com.phillippitts.ambientscribe.domain.DiarizationAssignment;
import com.phillippitts.ambientscribe.domain.QualityLevel;
import com.phillippitts.ambientscribe.domain.SpeakerRole;
import com.phillippitts.ambientscribe.service.diarization.event.DiarizationFallbackEvent;
import com.phillippitts.ambientscribe.service.diarization.event.DiarizationQualityChangedEvent;
import com.phillippitts.ambientscribe.testutil.EventCapturingPublisher;
import com.phillippitts.ambientscribe.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import static com.phillippitts.ambientscribe.domain.SpeakerRole.ROLE_A;
import static com.phillippitts.ambientscribe.domain.SpeakerRole.ROLE_B;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class DiarizationQualityEvaluatorTest {

    private final EventCapturingPublisher publisher = new EventCapturingPublisher();

    private DiarizationQualityEvaluator evaluator(DiarizationQualityProperties props) {
        return new DiarizationQualityEvaluator(props, publisher, new MutableClock(0L));
    }

    private static DiarizationAssignment auto(SpeakerRole role, long ts, float energy) {
        return new DiarizationAssignment(role, role.name(), energy, 0.8f, ts, false);
    }

    /** Speakers alternating every 30 ms frame, equal energy. */
    private static void recordAlternating(DiarizationQualityEvaluator e, int from, int to) {
        for (int i = from; i < to; i++) {
            e.record(auto(i % 2 == 0 ? ROLE_A : ROLE_B, i * 30L, 0.5f));
        }
    }

    @Test
    void derIsNotEstimatedBeforeMinimumSamples() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        recordAlternating(e, 0, 19);

        assertThat(e.quality()).isEqualTo(QualityLevel.UNKNOWN);
        assertThat(e.metrics().der()).isZero();
        assertThat(e.metrics().sampleCount()).isEqualTo(19);
        assertThat(publisher.all()).isEmpty();
    }

    @Test
    void consistentSpeakerIsGood() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        for (int i = 0; i < 20; i++) {
            e.record(auto(ROLE_A, i * 30L, 0.5f));
        }

        assertThat(e.quality()).isEqualTo(QualityLevel.GOOD);
        assertThat(e.metrics().der()).isZero();
        assertThat(publisher.eventsOfType(DiarizationQualityChangedEvent.class))
                .singleElement()
                .satisfies(ev -> {
                    assertThat(ev.previous()).isEqualTo(QualityLevel.UNKNOWN);
                    assertThat(ev.current()).isEqualTo(QualityLevel.GOOD);
                });
    }

    @Test
    void alternatingSpeakersArePoorAndEnterFallback() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        recordAlternating(e, 0, 20);

        // window [0,500): 9 A vs 8 B -> 8 errors; window [500,1000): B,A,B -> 1 error
        assertThat(e.metrics().der()).isCloseTo(9.0 / 20.0, within(1e-9));
        assertThat(e.quality()).isEqualTo(QualityLevel.POOR);
        assertThat(e.isFallbackActive()).isTrue();
        assertThat(e.metrics().fallbackRemaining()).isEqualTo(50);

        DiarizationFallbackEvent fallback = publisher.firstOfType(DiarizationFallbackEvent.class).orElseThrow();
        assertThat(fallback.active()).isTrue();
        assertThat(fallback.reason()).isEqualTo(DiarizationFallbackEvent.REASON_HIGH_DER);
    }

    @Test
    void fallbackEndsAfterConfiguredNumberOfSamples() {
        DiarizationQualityProperties props = new DiarizationQualityProperties();
        props.setFallbackDurationSamples(5);
        DiarizationQualityEvaluator e = evaluator(props);
        recordAlternating(e, 0, 20);
        assertThat(e.isFallbackActive()).isTrue();

        recordAlternating(e, 20, 24);
        assertThat(e.isFallbackActive()).isTrue();
        assertThat(e.metrics().fallbackRemaining()).isEqualTo(1);

        recordAlternating(e, 24, 25);
        assertThat(e.isFallbackActive()).isFalse();
        assertThat(publisher.eventsOfType(DiarizationFallbackEvent.class))
                .extracting(DiarizationFallbackEvent::active, DiarizationFallbackEvent::reason)
                .containsExactly(
                        tuple(true, DiarizationFallbackEvent.REASON_HIGH_DER),
                        tuple(false, DiarizationFallbackEvent.REASON_COUNTDOWN_ELAPSED));
    }

    @Test
    void manualAssignmentDefinesWindowReference() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        e.record(new DiarizationAssignment(ROLE_B, "B", 0f, 1.0f, 0L, true));
        for (int i = 1; i < 20; i++) {
            e.record(auto(ROLE_A, i * 10L, 0.9f));
        }

        assertThat(e.metrics().der()).isCloseTo(19.0 / 20.0, within(1e-9));
        assertThat(e.quality()).isEqualTo(QualityLevel.POOR);
    }

    @Test
    void singleAssignmentWindowsAreIgnored() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        for (int i = 0; i < 25; i++) {
            e.record(auto(i % 2 == 0 ? ROLE_A : ROLE_B, i * 500L, 0.5f));
        }

        assertThat(e.quality()).isEqualTo(QualityLevel.UNKNOWN);
        assertThat(e.isFallbackActive()).isFalse();
    }

    @Test
    void moderateBandBetweenThresholds() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        // one window of 20: 15 A, 5 B -> DER 0.25
        for (int i = 0; i < 20; i++) {
            e.record(auto(i < 15 ? ROLE_A : ROLE_B, i * 10L, 0.5f));
        }

        assertThat(e.metrics().der()).isCloseTo(0.25, within(1e-9));
        assertThat(e.quality()).isEqualTo(QualityLevel.MODERATE);
        assertThat(e.isFallbackActive()).isFalse();
    }

    @Test
    void reversedSwapsLowerAccuracyAndEnterFallback() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        e.recordSwap(ROLE_A, ROLE_B, true, 0);
        e.recordSwap(ROLE_B, ROLE_A, false, 2_000);
        e.recordSwap(ROLE_B, ROLE_A, true, 10_000);
        e.recordSwap(ROLE_A, ROLE_B, true, 20_000);
        e.recordSwap(ROLE_B, ROLE_A, true, 30_000);

        assertThat(e.metrics().swapAccuracy()).isCloseTo(0.75, within(1e-9));
        assertThat(e.isFallbackActive()).isTrue();
        assertThat(publisher.firstOfType(DiarizationFallbackEvent.class).orElseThrow().reason())
                .isEqualTo(DiarizationFallbackEvent.REASON_LOW_SWAP_ACCURACY);
    }

    @Test
    void lateCorrectionIsNotCounted() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        e.recordSwap(ROLE_A, ROLE_B, true, 0);
        e.recordSwap(ROLE_B, ROLE_A, false, 6_000);
        e.recordSwap(ROLE_B, ROLE_A, true, 10_000);
        e.recordSwap(ROLE_A, ROLE_B, true, 20_000);
        e.recordSwap(ROLE_B, ROLE_A, true, 30_000);

        assertThat(e.metrics().swapAccuracy()).isEqualTo(1.0);
        assertThat(e.isFallbackActive()).isFalse();
    }

    @Test
    void sameDirectionManualSwapIsNotACorrection() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());

        e.recordSwap(ROLE_A, ROLE_B, true, 0);
        e.recordSwap(ROLE_A, ROLE_B, false, 1_000);
        e.recordSwap(ROLE_B, ROLE_A, true, 10_000);
        e.recordSwap(ROLE_A, ROLE_B, true, 20_000);
        e.recordSwap(ROLE_B, ROLE_A, true, 30_000);

        assertThat(e.metrics().swapAccuracy()).isEqualTo(1.0);
    }

    @Test
    void resetRestoresInitialState() {
        DiarizationQualityEvaluator e = evaluator(new DiarizationQualityProperties());
        recordAlternating(e, 0, 20);

        e.reset();

        DiarizationMetrics m = e.metrics();
        assertThat(m.der()).isZero();
        assertThat(m.swapAccuracy()).isEqualTo(1.0);
        assertThat(m.quality()).isEqualTo(QualityLevel.UNKNOWN);
        assertThat(m.fallbackMode()).isFalse();
        assertThat(m.sampleCount()).isZero();
    }
}
