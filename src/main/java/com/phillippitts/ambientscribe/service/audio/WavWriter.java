package com.phillippitts.ambientscribe.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_BITS_PER_SAMPLE;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_BLOCK_ALIGN;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_BYTE_RATE;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_CHANNELS;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.REQUIRED_SAMPLE_RATE;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_AUDIO_FORMAT_PCM;
import static com.phillippitts.ambientscribe.service.audio.AudioFormat.WAV_HEADER_SIZE;

/**
 * Wraps retained PCM in a minimal WAV container using the canonical capture format.
 *
 * <p>Format: 16 kHz, 16-bit signed PCM, mono, little-endian, 44-byte RIFF header.
 * This utility only supports this fixed format to avoid bugs and ambiguity.
 */
public final class WavWriter {

    private WavWriter() {}

    /**
     * Returns a WAV image of the given raw PCM16LE mono 16 kHz payload.
     *
     * @param pcm raw PCM16LE mono audio at 16 kHz
     * @return 44-byte header followed by {@code pcm}
     */
    public static byte[] toWav(byte[] pcm) {
        Objects.requireNonNull(pcm, "pcm must not be null");
        ByteArrayOutputStream out = new ByteArrayOutputStream(WAV_HEADER_SIZE + pcm.length);
        try {
            writeTo(pcm, out);
        } catch (IOException e) {
            // ByteArrayOutputStream does not throw
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private static void writeTo(byte[] pcm, OutputStream os) throws IOException {
        int dataSize = pcm.length;

        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        writeLEInt(os, 36 + dataSize);
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, 16);
        writeLEShort(os, (short) WAV_AUDIO_FORMAT_PCM);
        writeLEShort(os, (short) REQUIRED_CHANNELS);
        writeLEInt(os, REQUIRED_SAMPLE_RATE);
        writeLEInt(os, REQUIRED_BYTE_RATE);
        writeLEShort(os, (short) REQUIRED_BLOCK_ALIGN);
        writeLEShort(os, (short) REQUIRED_BITS_PER_SAMPLE);

        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, dataSize);

        os.write(pcm);
        os.flush();
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }
}
