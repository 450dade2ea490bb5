package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.testutil.FakeMicrophoneSource;
import com.phillippitts.ambientscribe.testutil.Pcm;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResamplingMicrophoneSourceTest {

    @Test
    void canonicalSourcePassesThrough() {
        byte[] chunk = Pcm.ramp(320, 0, 7);
        FakeMicrophoneSource fake = new FakeMicrophoneSource().enqueue(chunk);
        ResamplingMicrophoneSource src = new ResamplingMicrophoneSource(fake);
        src.start();

        byte[] out = new byte[640];
        int n = src.read(out, 0, out.length);

        assertThat(src.isPassThrough()).isTrue();
        assertThat(n).isEqualTo(640);
        assertThat(out).isEqualTo(chunk);
        assertThat(src.inputSamples()).isEqualTo(320);
        assertThat(src.outputSamples()).isEqualTo(320);
    }

    @Test
    void downsamplesFortyEightKilohertzByThree() {
        FakeMicrophoneSource fake = new FakeMicrophoneSource(SourceFormat.pcm16Mono(48_000));
        for (int i = 0; i < 3; i++) {
            fake.enqueue(Pcm.constant(960, 1000));
        }
        ResamplingMicrophoneSource src = new ResamplingMicrophoneSource(fake);
        src.start();

        byte[] out = new byte[640];
        for (int read = 0; read < 3; read++) {
            int n = src.read(out, 0, out.length);
            assertThat(n).as("read %d", read).isEqualTo(640);
            for (int i = 0; i < 320; i++) {
                assertThat(Pcm.sampleAt(out, i)).isEqualTo((short) 1000);
            }
        }

        assertThat(src.isPassThrough()).isFalse();
        assertThat(src.inputSamples()).isEqualTo(2880);
        assertThat(src.outputSamples()).isEqualTo(960);
        assertThat(src.reportedFormat()).isEqualTo(SourceFormat.canonical());
        assertThat(src.sourceFormat().sampleRate()).isEqualTo(48_000);
    }

    @Test
    void upsamplingInterpolatesBetweenNeighbours() {
        FakeMicrophoneSource fake = new FakeMicrophoneSource(SourceFormat.pcm16Mono(8_000));
        fake.enqueue(Pcm.ramp(160, 0, 100));
        ResamplingMicrophoneSource src = new ResamplingMicrophoneSource(fake);
        src.start();

        byte[] out = new byte[640];
        int n = src.read(out, 0, out.length);

        // the last source sample has no right neighbour yet
        assertThat(n).isEqualTo(318 * 2);
        assertThat(Pcm.sampleAt(out, 0)).isEqualTo((short) 0);
        assertThat(Pcm.sampleAt(out, 1)).isEqualTo((short) 50);
        assertThat(Pcm.sampleAt(out, 2)).isEqualTo((short) 100);
        assertThat(Pcm.sampleAt(out, 3)).isEqualTo((short) 150);
        assertThat(Pcm.sampleAt(out, 317)).isEqualTo((short) 15850);
    }

    @Test
    void phaseCarriesAcrossReads() {
        FakeMicrophoneSource fake = new FakeMicrophoneSource(SourceFormat.pcm16Mono(8_000));
        fake.enqueue(Pcm.ramp(4, 0, 100)).enqueue(Pcm.ramp(4, 400, 100));
        ResamplingMicrophoneSource src = new ResamplingMicrophoneSource(fake);
        src.start();

        byte[] first = new byte[16];
        byte[] second = new byte[16];
        int n1 = src.read(first, 0, first.length);
        int n2 = src.read(second, 0, second.length);

        // 0,50,...,250 from the first chunk; 300,...,650 continue without a gap
        assertThat(n1).isEqualTo(12);
        assertThat(n2).isEqualTo(16);
        assertThat(Pcm.sampleAt(first, 5)).isEqualTo((short) 250);
        assertThat(Pcm.sampleAt(second, 0)).isEqualTo((short) 300);
        assertThat(Pcm.sampleAt(second, 1)).isEqualTo((short) 350);
        assertThat(Pcm.sampleAt(second, 3)).isEqualTo((short) 450);
    }

    @Test
    void readErrorIsPropagated() {
        FakeMicrophoneSource fake = new FakeMicrophoneSource(SourceFormat.pcm16Mono(48_000)).enqueueReadError();
        ResamplingMicrophoneSource src = new ResamplingMicrophoneSource(fake);
        src.start();

        assertThat(src.read(new byte[64], 0, 64)).isEqualTo(-1);
    }
}
