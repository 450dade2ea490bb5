package com.phillippitts.ambientscribe.config.properties;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Tuning knobs for energy-based two-speaker diarization.
 *
 * <p>Example:
 * <pre>
 * diarization.switch-hysteresis-ms=1000
 * diarization.energy-threshold-ratio=1.5
 * diarization.role-a-label=Doctor
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "diarization")
public class DiarizationProperties {

    /** Ratio of frame energy to rolling baseline that counts as a speaker change cue (either direction). */
    @DecimalMin("1.0")
    private double energyThresholdRatio = 1.5;

    /** Minimum dwell time between automatic speaker switches. */
    @Min(0)
    private long switchHysteresisMs = 1000;

    /** Voice-active duration an utterance needs before it is assigned a speaker. */
    @Min(0)
    private long minUtteranceDurationMs = 500;

    /** Silence needed to close an utterance; three times this resets the speaker to unknown. */
    @Min(1)
    private long silenceThresholdMs = 300;

    /** Factor by which one profile's similarity must beat the other's to decide a speaker. */
    @DecimalMin("1.0")
    private double dominanceRatio = 1.2;

    /** Number of recent voice-active frame energies forming the rolling baseline. */
    @Min(1)
    private int baselineWindowFrames = 20;

    /** Baseline frames required before the baseline ratio is trusted. */
    @Min(1)
    private int baselineMinFrames = 5;

    @NotBlank
    private String roleALabel = "Doctor";

    @NotBlank
    private String roleBLabel = "Patient";

    public double getEnergyThresholdRatio() {
        return energyThresholdRatio;
    }

    public void setEnergyThresholdRatio(double energyThresholdRatio) {
        this.energyThresholdRatio = energyThresholdRatio;
    }

    public long getSwitchHysteresisMs() {
        return switchHysteresisMs;
    }

    public void setSwitchHysteresisMs(long switchHysteresisMs) {
        this.switchHysteresisMs = switchHysteresisMs;
    }

    public long getMinUtteranceDurationMs() {
        return minUtteranceDurationMs;
    }

    public void setMinUtteranceDurationMs(long minUtteranceDurationMs) {
        this.minUtteranceDurationMs = minUtteranceDurationMs;
    }

    public long getSilenceThresholdMs() {
        return silenceThresholdMs;
    }

    public void setSilenceThresholdMs(long silenceThresholdMs) {
        this.silenceThresholdMs = silenceThresholdMs;
    }

    public double getDominanceRatio() {
        return dominanceRatio;
    }

    public void setDominanceRatio(double dominanceRatio) {
        this.dominanceRatio = dominanceRatio;
    }

    public int getBaselineWindowFrames() {
        return baselineWindowFrames;
    }

    public void setBaselineWindowFrames(int baselineWindowFrames) {
        this.baselineWindowFrames = baselineWindowFrames;
    }

    public int getBaselineMinFrames() {
        return baselineMinFrames;
    }

    public void setBaselineMinFrames(int baselineMinFrames) {
        this.baselineMinFrames = baselineMinFrames;
    }

    public String getRoleALabel() {
        return roleALabel;
    }

    public void setRoleALabel(String roleALabel) {
        this.roleALabel = roleALabel;
    }

    public String getRoleBLabel() {
        return roleBLabel;
    }

    public void setRoleBLabel(String roleBLabel) {
        this.roleBLabel = roleBLabel;
    }
}
