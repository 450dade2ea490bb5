package com.phillippitts.ambientscribe.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds for the rolling diarization quality estimate and the fallback mode it drives.
 */
@Validated
@ConfigurationProperties(prefix = "diarization.quality")
public class DiarizationQualityProperties {

    /** Number of recent assignments kept for DER estimation (oldest evicted). */
    @Min(1)
    private int historySize = 100;

    /** Width of the time windows assignments are grouped into. */
    @Min(1)
    private long windowMs = 500;

    /** Assignments required before DER is computed. */
    @Min(1)
    private int minSamples = 20;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double goodThreshold = 0.18;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double moderateThreshold = 0.30;

    /** Swap accuracy below this enters fallback mode. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double swapAccuracyThreshold = 0.95;

    /** A manual swap this soon after an automatic one counts as a correction. */
    @Min(0)
    private long swapCorrectionWindowMs = 5000;

    /** Swap events required before swap accuracy is evaluated. */
    @Min(1)
    private int minSwapEvents = 5;

    /** Assignments processed in fallback mode before automatic diarization resumes. */
    @Min(1)
    private int fallbackDurationSamples = 50;

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public long getWindowMs() {
        return windowMs;
    }

    public void setWindowMs(long windowMs) {
        this.windowMs = windowMs;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getGoodThreshold() {
        return goodThreshold;
    }

    public void setGoodThreshold(double goodThreshold) {
        this.goodThreshold = goodThreshold;
    }

    public double getModerateThreshold() {
        return moderateThreshold;
    }

    public void setModerateThreshold(double moderateThreshold) {
        this.moderateThreshold = moderateThreshold;
    }

    public double getSwapAccuracyThreshold() {
        return swapAccuracyThreshold;
    }

    public void setSwapAccuracyThreshold(double swapAccuracyThreshold) {
        this.swapAccuracyThreshold = swapAccuracyThreshold;
    }

    public long getSwapCorrectionWindowMs() {
        return swapCorrectionWindowMs;
    }

    public void setSwapCorrectionWindowMs(long swapCorrectionWindowMs) {
        this.swapCorrectionWindowMs = swapCorrectionWindowMs;
    }

    public int getMinSwapEvents() {
        return minSwapEvents;
    }

    public void setMinSwapEvents(int minSwapEvents) {
        this.minSwapEvents = minSwapEvents;
    }

    public int getFallbackDurationSamples() {
        return fallbackDurationSamples;
    }

    public void setFallbackDurationSamples(int fallbackDurationSamples) {
        this.fallbackDurationSamples = fallbackDurationSamples;
    }
}
