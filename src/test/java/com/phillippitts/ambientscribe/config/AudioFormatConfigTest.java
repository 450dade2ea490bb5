package com.phillippitts.ambientscribe.config;

import com.phillippitts.ambientscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.ambientscribe.service.audio.AudioFormat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AudioFormatConfigTest {

    private static AudioCaptureProperties props(int chunkMillis, int retentionSeconds, int frameMillis) {
        return new AudioCaptureProperties(chunkMillis, retentionSeconds, frameMillis, 0.02, 64, true, false, null);
    }

    @Test
    void acceptsDefaultGeometry() {
        AudioFormatConfig config = new AudioFormatConfig(props(40, 30, 30));

        assertThatCode(config::validateCaptureGeometry).doesNotThrowAnyException();
    }

    @Test
    void acceptsLargestChunkWithSmallestWindow() {
        AudioFormatConfig config = new AudioFormatConfig(props(200, 1, 100));

        assertThatCode(config::validateCaptureGeometry).doesNotThrowAnyException();
    }

    @Test
    void rejectsFrameWithoutWholeSample() {
        AudioFormatConfig config = new AudioFormatConfig(props(40, 30, 0));

        assertThatThrownBy(config::validateCaptureGeometry)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frame-millis=0");
    }

    @Test
    void rejectsChunkWithoutWholeSample() {
        AudioFormatConfig config = new AudioFormatConfig(props(0, 30, 30));

        assertThatThrownBy(config::validateCaptureGeometry)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("chunk-millis=0");
    }

    @Test
    void rejectsWindowSmallerThanOneChunk() {
        AudioFormatConfig config = new AudioFormatConfig(props(40, 0, 30));

        assertThatThrownBy(config::validateCaptureGeometry)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("retention-seconds=0")
                .hasMessageContaining("1280 bytes");
    }

    @Test
    void convertsMillisToAlignedBytes() {
        assertThat(AudioFormat.bytesForMillis(40)).isEqualTo(1280);
        assertThat(AudioFormat.bytesForMillis(30)).isEqualTo(960);
        assertThat(AudioFormat.bytesForMillis(30_000)).isEqualTo(960_000);
        assertThat(AudioFormat.REQUIRED_BYTE_RATE).isEqualTo(32_000);
    }

    @Test
    void fallbackRatesExcludeCanonicalRate() {
        assertThat(AudioFormat.FALLBACK_SAMPLE_RATES)
                .containsExactly(48_000, 44_100, 32_000, 22_050, 8_000)
                .doesNotContain(AudioFormat.REQUIRED_SAMPLE_RATE);
    }
}
