package com.phillippitts.ambientscribe.service.audio.capture;

import com.phillippitts.ambientscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException;
import com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException.Reason;
import org.junit.jupiter.api.Test;

import javax.sound.sampled.Control;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineListener;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.TargetDataLine;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JavaSoundMicrophoneSourceTest {

    private final AudioCaptureProperties props =
            new AudioCaptureProperties(20, 1, 20, 0.02, 64, true, false, "USB Mic");

    @Test
    void opensCanonicalRateFirst() {
        List<Float> attempted = new ArrayList<>();
        List<Optional<String>> devices = new ArrayList<>();
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> {
            attempted.add(fmt.getSampleRate());
            devices.add(dev);
            return new StubTargetDataLine(fmt);
        });

        src.start();

        assertThat(attempted).containsExactly(16000f);
        assertThat(devices).containsExactly(Optional.of("USB Mic"));
        assertThat(src.reportedFormat()).isEqualTo(SourceFormat.canonical());
        src.stop();
    }

    @Test
    void fallsBackToFirstRateTheDeviceAccepts() {
        List<Float> attempted = new ArrayList<>();
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> {
            attempted.add(fmt.getSampleRate());
            if (fmt.getSampleRate() != 44100f) {
                throw new IllegalArgumentException("unsupported " + fmt.getSampleRate());
            }
            return new StubTargetDataLine(fmt);
        });

        src.start();

        assertThat(attempted).containsExactly(16000f, 48000f, 44100f);
        assertThat(src.reportedFormat().sampleRate()).isEqualTo(44100);
        assertThat(src.reportedFormat().isCanonical()).isFalse();
        src.stop();
    }

    @Test
    void securityExceptionMapsToPermissionDenied() {
        List<Float> attempted = new ArrayList<>();
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> {
            attempted.add(fmt.getSampleRate());
            throw new SecurityException("Microphone access denied");
        });

        assertThatThrownBy(src::start)
                .isInstanceOfSatisfying(AudioSourceUnavailableException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.MIC_PERMISSION_DENIED));
        assertThat(attempted).hasSize(1);
    }

    @Test
    void busyDeviceMapsToUnavailable() {
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> {
            throw new LineUnavailableException("No audio device available");
        });

        assertThatThrownBy(src::start)
                .isInstanceOfSatisfying(AudioSourceUnavailableException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.MIC_UNAVAILABLE))
                .hasMessageContaining("MIC_UNAVAILABLE");
    }

    @Test
    void noSupportedRateMapsToUnsupportedFormat() {
        List<Float> attempted = new ArrayList<>();
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> {
            attempted.add(fmt.getSampleRate());
            throw new IllegalArgumentException("unsupported");
        });

        assertThatThrownBy(src::start)
                .isInstanceOfSatisfying(AudioSourceUnavailableException.class,
                        e -> assertThat(e.getReason()).isEqualTo(Reason.UNSUPPORTED_FORMAT));
        assertThat(attempted).containsExactly(16000f, 48000f, 44100f, 32000f, 22050f, 8000f);
    }

    @Test
    void readBeforeStartReportsError() {
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> new StubTargetDataLine(fmt));
        assertThat(src.read(new byte[64], 0, 64)).isNegative();
    }

    @Test
    void readsWholeSamplesOnly() {
        StubTargetDataLine[] opened = new StubTargetDataLine[1];
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> {
            opened[0] = new StubTargetDataLine(fmt);
            return opened[0];
        });
        src.start();

        int n = src.read(new byte[641], 0, 641);

        assertThat(n).isEqualTo(640);
        assertThat(opened[0].lastRequestedLength).isEqualTo(640);
        src.stop();
    }

    @Test
    void lineFailureDuringReadReportsError() {
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> {
            StubTargetDataLine line = new StubTargetDataLine(fmt);
            line.failReads = true;
            return line;
        });
        src.start();

        assertThat(src.read(new byte[64], 0, 64)).isEqualTo(-1);
        src.stop();
    }

    @Test
    void stopClosesLineAndAllowsRestart() {
        List<StubTargetDataLine> lines = new ArrayList<>();
        JavaSoundMicrophoneSource src = new JavaSoundMicrophoneSource(props, (fmt, dev) -> {
            StubTargetDataLine line = new StubTargetDataLine(fmt);
            lines.add(line);
            return line;
        });

        src.start();
        assertThatThrownBy(src::start).isInstanceOf(IllegalStateException.class);
        src.stop();
        src.stop();
        src.start();
        src.stop();

        assertThat(lines).hasSize(2);
        assertThat(lines).noneMatch(StubTargetDataLine::isOpen);
    }

    @Test
    void candidateRatesStartWithCanonical() {
        assertThat(JavaSoundMicrophoneSource.candidateRates())
                .containsExactly(16000, 48000, 44100, 32000, 22050, 8000);
    }

    // --- Test doubles ---
    static final class StubTargetDataLine implements TargetDataLine {
        private final javax.sound.sampled.AudioFormat fmt;
        private boolean started;
        private boolean open = true;
        int lastRequestedLength;
        boolean failReads;

        StubTargetDataLine(javax.sound.sampled.AudioFormat fmt) {
            this.fmt = fmt;
        }

        @Override public javax.sound.sampled.AudioFormat getFormat() {
            return fmt;
        }
        @Override public void open(javax.sound.sampled.AudioFormat format, int bufferSize) {
            open = true;
        }
        @Override public void open(javax.sound.sampled.AudioFormat format) {
            open = true;
        }
        @Override public int read(byte[] b, int off, int len) {
            if (failReads) {
                throw new IllegalStateException("line closed underneath");
            }
            lastRequestedLength = len;
            if (!started || !open) {
                return 0;
            }
            return len;
        }
        @Override public void start() {
            started = true;
        }
        @Override public void stop() {
            started = false;
        }
        @Override public void close() {
            open = false;
        }
        @Override public boolean isOpen() {
            return open;
        }
        @Override public int available() {
            return 0;
        }
        @Override public void drain() {
        }
        @Override public void flush() {
        }
        @Override public int getBufferSize() {
            return 0;
        }
        @Override public int getFramePosition() {
            return 0;
        }
        @Override public float getLevel() {
            return 0;
        }
        @Override public long getLongFramePosition() {
            return 0;
        }
        @Override public long getMicrosecondPosition() {
            return 0;
        }
        @Override public Control getControl(Control.Type control) {
            throw new IllegalArgumentException();
        }
        @Override public Control[] getControls() {
            return new Control[0];
        }
        @Override public boolean isControlSupported(Control.Type control) {
            return false;
        }
        @Override public void addLineListener(LineListener listener) {
        }
        @Override public void removeLineListener(LineListener listener) {
        }
        @Override public javax.sound.sampled.Line.Info getLineInfo() {
            return new DataLine.Info(TargetDataLine.class, fmt);
        }
        @Override public void open() {
            open = true;
        }
        @Override public boolean isActive() {
            return started;
        }
        @Override public boolean isRunning() {
            return started;
        }
    }
}
