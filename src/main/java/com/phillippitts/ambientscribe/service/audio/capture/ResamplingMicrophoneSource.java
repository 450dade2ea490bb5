package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * {@link MicrophoneSource} decorator that linearly resamples a non-canonical source rate to
 * {@link AudioFormat#REQUIRED_SAMPLE_RATE}.
 *
 * <p>When the delegate already delivers 16 kHz, reads pass straight through. Otherwise each read
 * pulls roughly the matching number of source samples and interpolates between neighbours. The
 * interpolation phase and the last source sample carry across reads, so chunk boundaries do not
 * introduce clicks. Output samples that do not fit the caller's buffer are held back for the next
 * read rather than dropped.
 *
 * <p>Not thread-safe beyond the single reader the engine guarantees.
 */
public class ResamplingMicrophoneSource implements MicrophoneSource {

    private static final Logger LOG = LogManager.getLogger(ResamplingMicrophoneSource.class);
    private static final int TARGET_RATE = AudioFormat.REQUIRED_SAMPLE_RATE;

    private final MicrophoneSource delegate;

    private boolean passThrough = true;
    private double step = 1.0;
    private byte[] inputBytes = new byte[0];
    private short[] spill = new short[0];
    private int spillCount;
    private short previous;
    private boolean havePrevious;
    private double phase;
    private long inputSamples;
    private long outputSamples;

    public ResamplingMicrophoneSource(MicrophoneSource delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void start() {
        delegate.start();
        SourceFormat sourceFormat = delegate.reportedFormat();
        passThrough = sourceFormat.sampleRate() == TARGET_RATE;
        step = (double) sourceFormat.sampleRate() / TARGET_RATE;
        spillCount = 0;
        havePrevious = false;
        phase = 0.0;
        inputSamples = 0;
        outputSamples = 0;
        if (!passThrough) {
            LOG.info("Resampling microphone input {} Hz -> {} Hz", sourceFormat.sampleRate(), TARGET_RATE);
        }
    }

    @Override
    public int read(byte[] buffer, int off, int len) {
        if (passThrough) {
            int n = delegate.read(buffer, off, len);
            if (n > 0) {
                inputSamples += n / AudioFormat.BYTES_PER_SAMPLE;
                outputSamples += n / AudioFormat.BYTES_PER_SAMPLE;
            }
            return n;
        }
        int wantSamples = len / AudioFormat.BYTES_PER_SAMPLE;
        if (wantSamples == 0) {
            return 0;
        }
        int written = drainSpill(buffer, off, wantSamples);
        if (written == wantSamples) {
            return written * AudioFormat.BYTES_PER_SAMPLE;
        }

        int needSamples = Math.max(1, (int) Math.round((wantSamples - written) * step));
        int needBytes = needSamples * AudioFormat.BYTES_PER_SAMPLE;
        if (inputBytes.length < needBytes) {
            inputBytes = new byte[needBytes];
        }
        int n = delegate.read(inputBytes, 0, needBytes);
        if (n < 0) {
            return written > 0 ? written * AudioFormat.BYTES_PER_SAMPLE : n;
        }
        int got = n / AudioFormat.BYTES_PER_SAMPLE;
        inputSamples += got;
        short[] produced = interpolate(inputBytes, got);
        int fit = Math.min(produced.length, wantSamples - written);
        for (int i = 0; i < fit; i++) {
            writeSample(buffer, off, written + i, produced[i]);
        }
        written += fit;
        holdBack(produced, fit);
        return written * AudioFormat.BYTES_PER_SAMPLE;
    }

    private short[] interpolate(byte[] src, int count) {
        if (count == 0) {
            return new short[0];
        }
        // extended sequence: [previous, src...] when a previous sample exists
        int offset = havePrevious ? 1 : 0;
        int extendedLength = count + offset;
        short[] extended = new short[extendedLength];
        if (havePrevious) {
            extended[0] = previous;
        }
        for (int i = 0; i < count; i++) {
            extended[i + offset] = (short) ((src[2 * i] & 0xFF) | (src[2 * i + 1] << 8));
        }
        int last = extendedLength - 1;
        int capacity = (int) Math.ceil((last - phase) / step) + 2;
        short[] out = new short[Math.max(capacity, 0)];
        int produced = 0;
        while (phase < last && produced < out.length) {
            int idx = (int) phase;
            double frac = phase - idx;
            double a = extended[idx];
            double b = extended[idx + 1];
            out[produced++] = (short) Math.round(a + frac * (b - a));
            phase += step;
        }
        phase -= last;
        previous = extended[last];
        havePrevious = true;
        outputSamples += produced;
        if (produced == out.length) {
            return out;
        }
        short[] trimmed = new short[produced];
        System.arraycopy(out, 0, trimmed, 0, produced);
        return trimmed;
    }

    private int drainSpill(byte[] buffer, int off, int wantSamples) {
        int take = Math.min(spillCount, wantSamples);
        for (int i = 0; i < take; i++) {
            writeSample(buffer, off, i, spill[i]);
        }
        if (take > 0) {
            System.arraycopy(spill, take, spill, 0, spillCount - take);
            spillCount -= take;
        }
        return take;
    }

    private void holdBack(short[] produced, int from) {
        int extra = produced.length - from;
        if (extra <= 0) {
            return;
        }
        if (spill.length < spillCount + extra) {
            short[] grown = new short[spillCount + extra];
            System.arraycopy(spill, 0, grown, 0, spillCount);
            spill = grown;
        }
        System.arraycopy(produced, from, spill, spillCount, extra);
        spillCount += extra;
    }

    private static void writeSample(byte[] buffer, int off, int sampleIndex, short sample) {
        int pos = off + sampleIndex * AudioFormat.BYTES_PER_SAMPLE;
        buffer[pos] = (byte) (sample & 0xFF);
        buffer[pos + 1] = (byte) ((sample >> 8) & 0xFF);
    }

    @Override
    public void stop() {
        delegate.stop();
    }

    /** Always the canonical format once started. */
    @Override
    public SourceFormat reportedFormat() {
        return SourceFormat.canonical();
    }

    /** Format delivered by the wrapped device. */
    public SourceFormat sourceFormat() {
        return delegate.reportedFormat();
    }

    public boolean isPassThrough() {
        return passThrough;
    }

    public long inputSamples() {
        return inputSamples;
    }

    public long outputSamples() {
        return outputSamples;
    }
}
