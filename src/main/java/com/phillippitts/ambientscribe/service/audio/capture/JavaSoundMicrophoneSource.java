package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException;
import com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException.Reason;
import com.phillippitts.ambientscribe.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound microphone that delivers PCM16LE mono.
 *
 * <p>On {@link #start()} the canonical 16 kHz rate is tried first, then each of
 * {@link AudioFormat#FALLBACK_SAMPLE_RATES} in order. The first rate the device accepts becomes
 * the {@link #reportedFormat()}; callers wrap this source in {@link ResamplingMicrophoneSource}
 * to normalize it.
 */
public class JavaSoundMicrophoneSource implements MicrophoneSource {

    private static final Logger LOG = LogManager.getLogger(JavaSoundMicrophoneSource.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final DataLineProvider provider;

    private volatile TargetDataLine line;
    private volatile SourceFormat format = SourceFormat.canonical();

    public JavaSoundMicrophoneSource(AudioCaptureProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundMicrophoneSource(AudioCaptureProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            Mixer.Info[] mixers = AudioSystem.getMixerInfo();
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : mixers) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    /** Candidate rates in probing order: canonical first, then the fallbacks. */
    static List<Integer> candidateRates() {
        List<Integer> rates = new ArrayList<>();
        rates.add(AudioFormat.REQUIRED_SAMPLE_RATE);
        for (int rate : AudioFormat.FALLBACK_SAMPLE_RATES) {
            rates.add(rate);
        }
        return rates;
    }

    @Override
    public synchronized void start() {
        if (line != null) {
            throw new IllegalStateException("Microphone already started");
        }
        Optional<String> device = Optional.ofNullable(props.getDeviceName());
        boolean deviceBusy = false;
        Exception lastFailure = null;
        for (int rate : candidateRates()) {
            javax.sound.sampled.AudioFormat fmt = new javax.sound.sampled.AudioFormat(
                    rate,
                    AudioFormat.REQUIRED_BITS_PER_SAMPLE,
                    AudioFormat.REQUIRED_CHANNELS,
                    AudioFormat.REQUIRED_SIGNED,
                    AudioFormat.REQUIRED_BIG_ENDIAN
            );
            try {
                TargetDataLine opened = provider.open(fmt, device);
                opened.start();
                this.line = opened;
                this.format = SourceFormat.pcm16Mono(rate);
                if (rate != AudioFormat.REQUIRED_SAMPLE_RATE) {
                    LOG.info("Microphone opened at fallback rate {} Hz (device='{}')",
                            rate, device.orElse("default"));
                } else {
                    LOG.info("Microphone opened at {} Hz (device='{}')", rate, device.orElse("default"));
                }
                return;
            } catch (SecurityException se) {
                throw new AudioSourceUnavailableException(Reason.MIC_PERMISSION_DENIED,
                        "access to the microphone was denied", se);
            } catch (LineUnavailableException e) {
                LOG.debug("Line unavailable at {} Hz: {}", rate, e.getMessage());
                deviceBusy = true;
                lastFailure = e;
            } catch (IllegalArgumentException e) {
                LOG.debug("Format {} Hz not supported: {}", rate, e.getMessage());
                lastFailure = e;
            }
        }
        if (deviceBusy) {
            throw new AudioSourceUnavailableException(Reason.MIC_UNAVAILABLE,
                    "no input line could be opened", lastFailure);
        }
        throw new AudioSourceUnavailableException(Reason.UNSUPPORTED_FORMAT,
                "device supports none of the candidate sample rates " + candidateRates(), lastFailure);
    }

    @Override
    public int read(byte[] buffer, int off, int len) {
        TargetDataLine current = line;
        if (current == null) {
            return -1;
        }
        try {
            return current.read(buffer, off, len - (len % AudioFormat.REQUIRED_BLOCK_ALIGN));
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.warn("Microphone read failed: {}", e.toString());
            return -1;
        }
    }

    @Override
    public synchronized void stop() {
        TargetDataLine current = line;
        line = null;
        if (current == null) {
            return;
        }
        try {
            current.stop();
        } finally {
            current.close();
        }
    }

    @Override
    public SourceFormat reportedFormat() {
        return format;
    }
}
