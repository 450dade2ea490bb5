package com.phillippitts.ambientscribe.service.diarization;

import com.phillippitts.ambientscribe.config.properties.DiarizationProperties;
import com.phillippitts.ambientscribe.domain.AudioFrame;
import com.phillippitts.ambientscribe.domain.DiarizationAssignment;
import com.phillippitts.ambientscribe.domain.SpeakerRole;
import com.phillippitts.ambientscribe.service.audio.capture.LatestValue;
import com.phillippitts.ambientscribe.service.diarization.event.SpeakerChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Online two-speaker diarization from short-window energy statistics.
 *
 * <p>Voice-active frames form utterances. Once an utterance has lasted
 * {@code min-utterance-duration-ms}, every further voice-active frame is assigned a speaker, and the
 * utterance's peak energy is assigned once more when it ends. Each assignment compares the energy
 * with the two learned {@link SpeakerEnergyProfile}s and with a rolling baseline of recent
 * voice-active energies:
 * <ul>
 *   <li>no profile yet: the speaker is role A and seeds its profile</li>
 *   <li>both profiles: a profile whose similarity beats the other by {@code dominance-ratio} wins;
 *       otherwise a baseline ratio beyond {@code energy-threshold-ratio} (either direction) flips to
 *       the other role; otherwise the current speaker is kept</li>
 *   <li>one profile: a similarity below {@code 1 / energy-threshold-ratio} or a significant baseline
 *       change selects the unlearned role, otherwise the learned one</li>
 * </ul>
 *
 * <p>Automatic decisions are skipped, keeping the current speaker, while a manual override is
 * active, within {@code switch-hysteresis-ms} of the last switch, or while the quality evaluator
 * holds fallback mode. {@link #setCurrentSpeaker} and {@link #swapRoles} bypass all three.
 *
 * <p>Silence longer than three times {@code silence-threshold-ms} resets the speaker to
 * {@link SpeakerRole#UNKNOWN} unless a manual override is active.
 *
 * <p>Never throws. All public methods are synchronized.
 */
@Component
public class SpeakerDiarizer {

    private static final Logger LOG = LogManager.getLogger(SpeakerDiarizer.class);

    static final float SEED_CONFIDENCE = 0.7f;
    static final float RETAINED_CONFIDENCE = 0.8f;
    static final float UNKNOWN_CONFIDENCE = 0.5f;
    static final float MANUAL_CONFIDENCE = 1.0f;
    static final float MIN_SWITCH_CONFIDENCE = 0.5f;
    static final float MAX_SWITCH_CONFIDENCE = 0.95f;
    static final String UNKNOWN_LABEL = "Unknown";

    private record Decision(SpeakerRole role, float confidence) { }

    private final DiarizationProperties props;
    private final DiarizationQualityEvaluator evaluator;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final LatestValue<DiarizationAssignment> latest = new LatestValue<>();

    private final Deque<Float> baselineWindow = new ArrayDeque<>();
    private double baselineSum;
    private SpeakerRole current = SpeakerRole.UNKNOWN;
    private boolean manualOverride;
    private SpeakerEnergyProfile profileA = SpeakerEnergyProfile.empty();
    private SpeakerEnergyProfile profileB = SpeakerEnergyProfile.empty();

    private boolean speaking;
    private long utteranceStartMillis;
    private float utterancePeak;
    private boolean hasSpoken;
    private long lastSpeechEndMillis;
    private boolean hasSwitched;
    private long lastSwitchMillis;
    private boolean hasFrame;
    private long lastFrameMillis;

    @Autowired
    public SpeakerDiarizer(DiarizationProperties props,
                           DiarizationQualityEvaluator evaluator,
                           ApplicationEventPublisher publisher) {
        this(props, evaluator, publisher, Clock.systemUTC());
    }

    SpeakerDiarizer(DiarizationProperties props,
                    DiarizationQualityEvaluator evaluator,
                    ApplicationEventPublisher publisher,
                    Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.evaluator = Objects.requireNonNull(evaluator);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Processes one VAD frame.
     *
     * @return the assignment for this frame when it qualifies, otherwise empty
     */
    public synchronized Optional<DiarizationAssignment> process(AudioFrame frame) {
        float energy = frame.energy();
        long ts = frame.timestampMillis();
        hasFrame = true;
        lastFrameMillis = ts;
        DiarizationAssignment assignment = null;

        if (frame.voiceActive()) {
            updateBaseline(energy);
            if (!speaking) {
                speaking = true;
                utteranceStartMillis = ts;
                utterancePeak = energy;
            } else {
                utterancePeak = Math.max(utterancePeak, energy);
            }
            if (ts - utteranceStartMillis >= props.getMinUtteranceDurationMs()) {
                assignment = assign(energy, ts);
            }
        } else {
            if (speaking) {
                speaking = false;
                hasSpoken = true;
                lastSpeechEndMillis = ts;
                if (ts - utteranceStartMillis >= props.getMinUtteranceDurationMs()) {
                    assignment = assign(utterancePeak, ts);
                }
            }
            if (hasSpoken && !manualOverride && current != SpeakerRole.UNKNOWN
                    && ts - lastSpeechEndMillis > props.getSilenceThresholdMs() * 3) {
                LOG.debug("Long silence, resetting speaker identification");
                changeSpeaker(SpeakerRole.UNKNOWN, ts, false);
            }
        }

        if (assignment == null) {
            return Optional.empty();
        }
        emit(assignment);
        return Optional.of(assignment);
    }

    private DiarizationAssignment assign(float energy, long ts) {
        SpeakerRole before = current;
        Decision decision;
        if (manualOverride || withinHysteresis(ts) || evaluator.isFallbackActive()) {
            decision = new Decision(current, retainedConfidence());
        } else {
            decision = identify(energy);
        }
        if (decision.role() != before) {
            changeSpeaker(decision.role(), ts, false);
        }
        return new DiarizationAssignment(decision.role(), labelFor(decision.role()), energy,
                decision.confidence(), ts, manualOverride);
    }

    private Decision identify(float energy) {
        if (profileA.isEmpty() && profileB.isEmpty()) {
            profileA = profileA.update(energy);
            return new Decision(SpeakerRole.ROLE_A, SEED_CONFIDENCE);
        }

        float simA = profileA.similarity(energy);
        float simB = profileB.similarity(energy);
        boolean significantChange = isSignificantChange(energy);
        SpeakerRole role;

        if (!profileA.isEmpty() && !profileB.isEmpty()) {
            if (simA > simB * props.getDominanceRatio()) {
                role = SpeakerRole.ROLE_A;
            } else if (simB > simA * props.getDominanceRatio()) {
                role = SpeakerRole.ROLE_B;
            } else if (significantChange && current.isKnown()) {
                role = current.other();
            } else {
                role = current;
            }
        } else {
            SpeakerRole learned = profileA.isEmpty() ? SpeakerRole.ROLE_B : SpeakerRole.ROLE_A;
            float learnedSimilarity = learned == SpeakerRole.ROLE_A ? simA : simB;
            boolean mismatch = learnedSimilarity < 1.0 / props.getEnergyThresholdRatio();
            role = mismatch || significantChange ? learned.other() : learned;
        }

        if (role == SpeakerRole.ROLE_A) {
            profileA = profileA.update(energy);
        } else if (role == SpeakerRole.ROLE_B) {
            profileB = profileB.update(energy);
        }

        float confidence;
        if (role != current) {
            confidence = clamp(Math.abs(simA - simB), MIN_SWITCH_CONFIDENCE, MAX_SWITCH_CONFIDENCE);
        } else {
            confidence = retainedConfidence();
        }
        return new Decision(role, confidence);
    }

    private boolean isSignificantChange(float energy) {
        double baseline = baselineEnergy();
        if (baseline <= 0) {
            return false;
        }
        double ratio = energy / baseline;
        return ratio > props.getEnergyThresholdRatio() || ratio < 1.0 / props.getEnergyThresholdRatio();
    }

    private boolean withinHysteresis(long ts) {
        return hasSwitched && ts - lastSwitchMillis < props.getSwitchHysteresisMs();
    }

    private float retainedConfidence() {
        if (manualOverride) {
            return MANUAL_CONFIDENCE;
        }
        return current.isKnown() ? RETAINED_CONFIDENCE : UNKNOWN_CONFIDENCE;
    }

    private void changeSpeaker(SpeakerRole to, long ts, boolean manual) {
        SpeakerRole from = current;
        current = to;
        if (to.isKnown()) {
            hasSwitched = true;
            lastSwitchMillis = ts;
        }
        if (!manual && from.isKnown() && to.isKnown()) {
            evaluator.recordSwap(from, to, true, ts);
        }
        LOG.debug("Speaker changed: {} -> {} (manual={})", from, to, manual);
        publisher.publishEvent(new SpeakerChangedEvent(from, to, labelFor(to), manual, ts, clock.instant()));
    }

    private void updateBaseline(float energy) {
        baselineWindow.addLast(energy);
        baselineSum += energy;
        while (baselineWindow.size() > props.getBaselineWindowFrames()) {
            baselineSum -= baselineWindow.removeFirst();
        }
    }

    private void emit(DiarizationAssignment assignment) {
        evaluator.record(assignment);
        latest.publish(assignment);
    }

    /**
     * Manually assigns the current speaker. Always succeeds, including in fallback mode, and sets
     * the manual-override flag until {@link #clearManualOverride()} or {@link #reset()}.
     *
     * @return the manual assignment that was emitted
     */
    public synchronized DiarizationAssignment setCurrentSpeaker(SpeakerRole role) {
        Objects.requireNonNull(role, "role must not be null");
        long now = manualTimestamp();
        manualOverride = true;
        if (role != current) {
            changeSpeaker(role, now, true);
        } else {
            hasSwitched = true;
            lastSwitchMillis = now;
        }
        LOG.info("Manual speaker assignment: {}", labelFor(role));
        DiarizationAssignment assignment = new DiarizationAssignment(role, labelFor(role), 0f,
                MANUAL_CONFIDENCE, now, true);
        emit(assignment);
        return assignment;
    }

    /**
     * Swaps the two roles: the current speaker becomes the other role and the learned profiles are
     * exchanged. An undecided speaker becomes role A.
     *
     * @return the manual assignment that was emitted
     */
    public synchronized DiarizationAssignment swapRoles() {
        SpeakerRole from = current;
        SpeakerRole to = from.other();
        SpeakerEnergyProfile previousA = profileA;
        profileA = profileB;
        profileB = previousA;
        evaluator.recordSwap(from, to, false, manualTimestamp());
        LOG.info("Speaker roles swapped: {} <-> {}", props.getRoleALabel(), props.getRoleBLabel());
        return setCurrentSpeaker(to);
    }

    /**
     * Manual actions are stamped on the frame timeline so they compare directly with automatic
     * switches. Before the first frame the wall clock stands in.
     */
    private long manualTimestamp() {
        return hasFrame ? lastFrameMillis : clock.millis();
    }

    /** Returns to automatic assignment; learned profiles are kept. */
    public synchronized void clearManualOverride() {
        manualOverride = false;
    }

    /** Clears speaker, override, profiles, baseline, utterance state and the evaluator. */
    public synchronized void reset() {
        current = SpeakerRole.UNKNOWN;
        manualOverride = false;
        profileA = SpeakerEnergyProfile.empty();
        profileB = SpeakerEnergyProfile.empty();
        baselineWindow.clear();
        baselineSum = 0.0;
        speaking = false;
        utteranceStartMillis = 0L;
        utterancePeak = 0f;
        hasSpoken = false;
        lastSpeechEndMillis = 0L;
        hasSwitched = false;
        lastSwitchMillis = 0L;
        hasFrame = false;
        lastFrameMillis = 0L;
        evaluator.reset();
        LOG.debug("Speaker diarization reset");
    }

    public synchronized SpeakerRole currentSpeaker() {
        return current;
    }

    public synchronized boolean isManualOverride() {
        return manualOverride;
    }

    public synchronized SpeakerEnergyProfile profile(SpeakerRole role) {
        return switch (role) {
            case ROLE_A -> profileA;
            case ROLE_B -> profileB;
            case UNKNOWN -> SpeakerEnergyProfile.empty();
        };
    }

    /** Mean of recent voice-active energies, or 0 until enough frames are seen. */
    public synchronized double baselineEnergy() {
        if (baselineWindow.size() < props.getBaselineMinFrames()) {
            return 0.0;
        }
        return baselineSum / baselineWindow.size();
    }

    public boolean isInFallbackMode() {
        return evaluator.isFallbackActive();
    }

    public DiarizationMetrics metrics() {
        return evaluator.metrics();
    }

    /** Latest assignment channel; a slow reader only sees the newest. */
    public LatestValue<DiarizationAssignment> latestAssignment() {
        return latest;
    }

    public String labelFor(SpeakerRole role) {
        return switch (role) {
            case ROLE_A -> props.getRoleALabel();
            case ROLE_B -> props.getRoleBLabel();
            case UNKNOWN -> UNKNOWN_LABEL;
        };
    }

    private static float clamp(float value, float min, float max) {
        return Math.max(min, Math.min(max, value));
    }
}
