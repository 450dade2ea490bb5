package com.phillippitts.ambientscribe.config;

import com.phillippitts.ambientscribe.config.properties.AudioCaptureProperties;
import com.phillippitts.ambientscribe.service.audio.AudioFormat;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Configuration;

/**
 * Startup check of the capture geometry: the configured chunk, frame and retention durations
 * converted to byte sizes at the canonical 16 kHz mono PCM16 format.
 *
 * <p>Fails fast when a chunk or frame holds no whole sample, or when the retained window cannot
 * hold one chunk and one frame. Bean validation bounds each property on its own; this checks
 * them against each other.
 */
@Configuration
class AudioFormatConfig {
    private static final Logger LOG = LogManager.getLogger(AudioFormatConfig.class);

    private final AudioCaptureProperties props;

    AudioFormatConfig(AudioCaptureProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validateCaptureGeometry() {
        if (AudioFormat.REQUIRED_BLOCK_ALIGN != AudioFormat.BYTES_PER_SAMPLE * AudioFormat.REQUIRED_CHANNELS
                || AudioFormat.REQUIRED_BYTE_RATE != AudioFormat.REQUIRED_SAMPLE_RATE * AudioFormat.REQUIRED_BLOCK_ALIGN) {
            throw new IllegalStateException("Canonical audio format constants are inconsistent");
        }
        int chunkBytes = AudioFormat.bytesForMillis(props.getChunkMillis());
        int frameBytes = AudioFormat.bytesForMillis(props.getFrameMillis());
        int ringBytes = AudioFormat.bytesForMillis(props.getRetentionSeconds() * 1000L);

        if (chunkBytes < AudioFormat.REQUIRED_BLOCK_ALIGN) {
            throw new IllegalStateException("audio.capture.chunk-millis=" + props.getChunkMillis()
                    + " yields no whole sample");
        }
        if (frameBytes < AudioFormat.REQUIRED_BLOCK_ALIGN) {
            throw new IllegalStateException("audio.capture.frame-millis=" + props.getFrameMillis()
                    + " yields no whole sample");
        }
        if (ringBytes < Math.max(chunkBytes, frameBytes)) {
            throw new IllegalStateException("audio.capture.retention-seconds=" + props.getRetentionSeconds()
                    + " (" + ringBytes + " bytes) cannot hold one chunk (" + chunkBytes
                    + " bytes) and one frame (" + frameBytes + " bytes)");
        }
        if (frameBytes > chunkBytes) {
            LOG.debug("Frame ({} bytes) spans more than one chunk ({} bytes)", frameBytes, chunkBytes);
        }
        LOG.info("Capture geometry: {} Hz mono PCM16, chunk={} bytes, frame={} samples, retained window={} bytes, "
                        + "subscriber queue={} ms of frames",
                AudioFormat.REQUIRED_SAMPLE_RATE, chunkBytes, frameBytes / AudioFormat.BYTES_PER_SAMPLE,
                ringBytes, (long) props.getFrameQueueCapacity() * props.getFrameMillis());
    }
}
