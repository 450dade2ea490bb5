package com.phillippitts.ambientscribe.service.audio;

import com.phillippitts.ambientscribe.testutil.Pcm;
import org.junit.jupiter.api.Test;

import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_AUDIO_FORMAT_OFFSET;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_AUDIO_FORMAT_PCM;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_BITS_PER_SAMPLE_OFFSET;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_BLOCK_ALIGN_OFFSET;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_BYTE_RATE_OFFSET;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_CHANNELS_OFFSET;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_CHUNK_SIZE_OFFSET;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_DATA_SIZE_OFFSET;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_HEADER_SIZE;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_SAMPLE_RATE_OFFSET;
import static org.assertj.core.api.Assertions.assertThat;

class WavWriterTest {

    @Test
    void headerDescribesCanonicalFormat() {
        byte[] pcm = new byte[REQUIRED_BYTE_RATE];

        byte[] all = WavWriter.toWav(pcm);

        assertThat(all.length).isEqualTo(WAV_HEADER_SIZE + pcm.length);
        assertThat(new String(all, 0, 4)).isEqualTo("RIFF");
        assertThat(new String(all, 8, 4)).isEqualTo("WAVE");
        assertThat(new String(all, 12, 4)).isEqualTo("fmt ");
        assertThat(new String(all, 36, 4)).isEqualTo("data");
        assertThat(le32(all, 16)).isEqualTo(16);
        assertThat(le16(all, WAV_AUDIO_FORMAT_OFFSET)).isEqualTo(WAV_AUDIO_FORMAT_PCM);
        assertThat(le16(all, WAV_CHANNELS_OFFSET)).isEqualTo(REQUIRED_CHANNELS);
        assertThat(le32(all, WAV_SAMPLE_RATE_OFFSET)).isEqualTo(REQUIRED_SAMPLE_RATE);
        assertThat(le32(all, WAV_BYTE_RATE_OFFSET)).isEqualTo(REQUIRED_BYTE_RATE);
        assertThat(le16(all, WAV_BLOCK_ALIGN_OFFSET)).isEqualTo(REQUIRED_BLOCK_ALIGN);
        assertThat(le16(all, WAV_BITS_PER_SAMPLE_OFFSET)).isEqualTo(REQUIRED_BITS_PER_SAMPLE);
        assertThat(le32(all, WAV_DATA_SIZE_OFFSET)).isEqualTo(pcm.length);
        assertThat(le32(all, WAV_CHUNK_SIZE_OFFSET)).isEqualTo(36 + pcm.length);
    }

    @Test
    void payloadFollowsHeaderUnchanged() {
        byte[] pcm = Pcm.ramp(100, -50, 3);

        byte[] all = WavWriter.toWav(pcm);

        byte[] payload = new byte[pcm.length];
        System.arraycopy(all, WAV_HEADER_SIZE, payload, 0, payload.length);
        assertThat(payload).isEqualTo(pcm);
    }

    @Test
    void emptyPcmProducesHeaderOnly() {
        assertThat(WavWriter.toWav(new byte[0])).hasSize(WAV_HEADER_SIZE);
    }

    private static int le16(byte[] b, int off) {
        return (b[off] & 0xFF) | ((b[off + 1] & 0xFF) << 8);
    }

    private static int le32(byte[] b, int off) {
        return (b[off] & 0xFF) | ((b[off + 1] & 0xFF) << 8)
                | ((b[off + 2] & 0xFF) << 16) | ((b[off + 3] & 0xFF) << 24);
    }
}
