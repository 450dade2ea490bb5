package com.phillippitts.ambientscribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for streaming microphone capture.
 *
 * <p>Canonical format (enforced upstream of the engine): 16 kHz, 16-bit PCM, mono, little-endian.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Size of a read chunk from the audio source in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Trailing window of audio retained for export or purge, in seconds. */
    @Min(1)
    @Max(600)
    private final int retentionSeconds;

    /** Duration of one VAD frame in milliseconds. */
    @Min(10)
    @Max(100)
    private final int frameMillis;

    /** Normalized RMS energy above which a frame counts as voice-active. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double vadThreshold;

    /** Capacity of each frame subscriber's hand-off queue; oldest frames are dropped on overflow. */
    @Min(1)
    @Max(10_000)
    private final int frameQueueCapacity;

    /** Purge retained audio once a session is stopped. */
    private final boolean autoPurgeOnStop;

    /** Start one capture session when the application is ready. */
    private final boolean autoStart;

    /** Optional input device name hint; falls back to system default when null/blank. */
    private final String deviceName;

    @ConstructorBinding
    public AudioCaptureProperties(@DefaultValue("40") int chunkMillis,
                                  @DefaultValue("30") int retentionSeconds,
                                  @DefaultValue("30") int frameMillis,
                                  @DefaultValue("0.02") double vadThreshold,
                                  @DefaultValue("64") int frameQueueCapacity,
                                  @DefaultValue("true") boolean autoPurgeOnStop,
                                  @DefaultValue("false") boolean autoStart,
                                  String deviceName) {
        this.chunkMillis = chunkMillis;
        this.retentionSeconds = retentionSeconds;
        this.frameMillis = frameMillis;
        this.vadThreshold = vadThreshold;
        this.frameQueueCapacity = frameQueueCapacity;
        this.autoPurgeOnStop = autoPurgeOnStop;
        this.autoStart = autoStart;
        this.deviceName = (deviceName == null || deviceName.isBlank()) ? null : deviceName;
    }

    public int getChunkMillis() { return chunkMillis; }
    public int getRetentionSeconds() { return retentionSeconds; }
    public int getFrameMillis() { return frameMillis; }
    public double getVadThreshold() { return vadThreshold; }
    public int getFrameQueueCapacity() { return frameQueueCapacity; }
    public boolean isAutoPurgeOnStop() { return autoPurgeOnStop; }
    public boolean isAutoStart() { return autoStart; }
    public String getDeviceName() { return deviceName; }
}
