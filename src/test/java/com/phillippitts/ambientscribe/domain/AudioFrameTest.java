package com.phillippitts.ambientscribe.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioFrameTest {

    @Test
    void shouldCreateValidFrame() {
        AudioFrame frame = new AudioFrame(new short[]{1, 2, 3}, 1000L, 0.5f, true);

        assertThat(frame.sampleCount()).isEqualTo(3);
        assertThat(frame.timestampMillis()).isEqualTo(1000L);
        assertThat(frame.voiceActive()).isTrue();
    }

    @Test
    void shouldRejectNullSamples() {
        assertThatThrownBy(() -> new AudioFrame(null, 0L, 0.1f, false))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("samples");
    }

    @Test
    void shouldRejectEnergyOutOfRange() {
        assertThatThrownBy(() -> AudioFrame.ofEnergy(0L, 1.5f, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Energy must be between 0.0 and 1.0");
        assertThatThrownBy(() -> AudioFrame.ofEnergy(0L, -0.1f, false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AudioFrame.ofEnergy(0L, Float.NaN, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void samplesCannotBeMutatedThroughFrame() {
        short[] source = {10, 20};
        AudioFrame frame = new AudioFrame(source, 0L, 0.1f, true);

        source[0] = 99;
        frame.samples()[1] = 99;

        assertThat(frame.samples()).containsExactly((short) 10, (short) 20);
    }

    @Test
    void equalityComparesSampleContent() {
        AudioFrame a = new AudioFrame(new short[]{1, 2}, 5L, 0.2f, true);
        AudioFrame b = new AudioFrame(new short[]{1, 2}, 5L, 0.2f, true);

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(new AudioFrame(new short[]{1, 3}, 5L, 0.2f, true));
    }

    @Test
    void vadStateMirrorsFrame() {
        VadState state = VadState.of(AudioFrame.ofEnergy(42L, 0.3f, true));

        assertThat(state).isEqualTo(new VadState(true, 0.3f, 42L));
    }
}
