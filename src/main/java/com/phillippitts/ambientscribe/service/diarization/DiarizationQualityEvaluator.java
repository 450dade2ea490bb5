package com.phillippitts.ambientscribe.service.diarization;

import com.phillippitts.ambientscribe.config.properties.DiarizationQualityProperties;
import com.phillippitts.ambientscribe.domain.DiarizationAssignment;
import com.phillippitts.ambientscribe.domain.QualityLevel;
import com.phillippitts.ambientscribe.domain.SpeakerRole;
import com.phillippitts.ambientscribe.service.diarization.event.DiarizationFallbackEvent;
import com.phillippitts.ambientscribe.service.diarization.event.DiarizationQualityChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rolling self-assessment of diarization quality that drives single-speaker fallback mode.
 *
 * <p><b>DER proxy:</b> the last {@code history-size} assignments are grouped into
 * {@code window-ms} windows by timestamp. Within each window holding more than one assignment
 * the reference speaker is the manually assigned one if any, otherwise the speaker with the
 * highest summed energy. DER is the share of assignments disagreeing with their window's
 * reference. It is only computed once {@code min-samples} assignments are held.
 *
 * <p><b>Swap accuracy:</b> an automatic A/B swap counts as wrong when a manual swap reverses it
 * within {@code swap-correction-window-ms}. Accuracy is {@code 1 - corrected / automatic}, evaluated
 * once {@code min-swap-events} swaps are recorded.
 *
 * <p><b>Fallback:</b> entered when the band becomes {@link QualityLevel#POOR} or swap accuracy drops
 * below its threshold. It lasts for {@code fallback-duration-samples} further assignments and is
 * then cleared without re-checking quality.
 *
 * <p>Never throws. All methods are synchronized.
 */
@Component
public class DiarizationQualityEvaluator {

    private static final Logger LOG = LogManager.getLogger(DiarizationQualityEvaluator.class);

    private record SwapEvent(SpeakerRole from, SpeakerRole to, boolean automatic, long timestampMillis) { }

    private final DiarizationQualityProperties props;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    private final Deque<DiarizationAssignment> history = new ArrayDeque<>();
    private final Deque<SwapEvent> swaps = new ArrayDeque<>();
    private double der;
    private double swapAccuracy = 1.0;
    private QualityLevel quality = QualityLevel.UNKNOWN;
    private boolean fallbackActive;
    private int fallbackRemaining;

    @Autowired
    public DiarizationQualityEvaluator(DiarizationQualityProperties props, ApplicationEventPublisher publisher) {
        this(props, publisher, Clock.systemUTC());
    }

    DiarizationQualityEvaluator(DiarizationQualityProperties props, ApplicationEventPublisher publisher, Clock clock) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Adds one assignment, re-estimates DER and advances the fallback countdown.
     */
    public synchronized void record(DiarizationAssignment assignment) {
        boolean wasInFallback = fallbackActive;
        history.addLast(assignment);
        while (history.size() > props.getHistorySize()) {
            history.removeFirst();
        }
        if (history.size() >= props.getMinSamples()) {
            updateDer();
        }
        if (wasInFallback && fallbackActive) {
            fallbackRemaining--;
            if (fallbackRemaining <= 0) {
                fallbackActive = false;
                fallbackRemaining = 0;
                LOG.info("Exiting single-speaker fallback mode");
                publisher.publishEvent(new DiarizationFallbackEvent(false,
                        DiarizationFallbackEvent.REASON_COUNTDOWN_ELAPSED, der, swapAccuracy, clock.instant()));
            }
        }
    }

    /**
     * Records a role swap.
     *
     * @param automatic true when the diarizer switched on its own, false for a manual swap
     */
    public synchronized void recordSwap(SpeakerRole from, SpeakerRole to, boolean automatic, long timestampMillis) {
        swaps.addLast(new SwapEvent(from, to, automatic, timestampMillis));
        while (swaps.size() > props.getHistorySize()) {
            swaps.removeFirst();
        }
        if (swaps.size() >= props.getMinSwapEvents()) {
            updateSwapAccuracy();
        }
    }

    private void updateDer() {
        Map<Long, List<DiarizationAssignment>> windows = new LinkedHashMap<>();
        for (DiarizationAssignment a : history) {
            windows.computeIfAbsent(a.timestampMillis() / props.getWindowMs(), k -> new ArrayList<>()).add(a);
        }
        int errors = 0;
        int total = 0;
        for (List<DiarizationAssignment> window : windows.values()) {
            if (window.size() < 2) {
                continue;
            }
            SpeakerRole reference = referenceSpeaker(window);
            for (DiarizationAssignment a : window) {
                if (a.speaker() != reference) {
                    errors++;
                }
            }
            total += window.size();
        }
        if (total == 0) {
            return;
        }
        der = (double) errors / total;

        QualityLevel newQuality = classify(der);
        if (newQuality != quality) {
            QualityLevel previous = quality;
            quality = newQuality;
            LOG.info("Diarization quality updated: {} (DER: {}%)", newQuality, String.format("%.1f", der * 100));
            publisher.publishEvent(new DiarizationQualityChangedEvent(previous, newQuality, der, swapAccuracy,
                    clock.instant()));
        }
        if (newQuality == QualityLevel.POOR && !fallbackActive) {
            enterFallback(DiarizationFallbackEvent.REASON_HIGH_DER);
        }
    }

    private static SpeakerRole referenceSpeaker(List<DiarizationAssignment> window) {
        for (DiarizationAssignment a : window) {
            if (a.manualOverride()) {
                return a.speaker();
            }
        }
        Map<SpeakerRole, Double> energyBySpeaker = new EnumMap<>(SpeakerRole.class);
        SpeakerRole firstSeen = window.get(0).speaker();
        for (DiarizationAssignment a : window) {
            energyBySpeaker.merge(a.speaker(), (double) a.energy(), Double::sum);
        }
        SpeakerRole best = firstSeen;
        double bestEnergy = energyBySpeaker.get(firstSeen);
        for (Map.Entry<SpeakerRole, Double> e : energyBySpeaker.entrySet()) {
            if (e.getValue() > bestEnergy) {
                best = e.getKey();
                bestEnergy = e.getValue();
            }
        }
        return best;
    }

    private QualityLevel classify(double value) {
        if (value <= props.getGoodThreshold()) {
            return QualityLevel.GOOD;
        }
        if (value <= props.getModerateThreshold()) {
            return QualityLevel.MODERATE;
        }
        return QualityLevel.POOR;
    }

    private void updateSwapAccuracy() {
        int automatic = 0;
        int corrected = 0;
        for (SwapEvent auto : swaps) {
            if (!auto.automatic()) {
                continue;
            }
            automatic++;
            for (SwapEvent manual : swaps) {
                long delay = manual.timestampMillis() - auto.timestampMillis();
                if (!manual.automatic()
                        && delay >= 0 && delay <= props.getSwapCorrectionWindowMs()
                        && manual.from() == auto.to()
                        && manual.to() == auto.from()) {
                    corrected++;
                    break;
                }
            }
        }
        swapAccuracy = automatic == 0 ? 1.0 : 1.0 - (double) corrected / automatic;
        if (swapAccuracy < props.getSwapAccuracyThreshold() && !fallbackActive) {
            enterFallback(DiarizationFallbackEvent.REASON_LOW_SWAP_ACCURACY);
        }
    }

    private void enterFallback(String reason) {
        fallbackActive = true;
        fallbackRemaining = props.getFallbackDurationSamples();
        LOG.warn("Enabling single-speaker fallback mode: reason={}, der={}, swapAccuracy={}",
                reason, der, swapAccuracy);
        publisher.publishEvent(new DiarizationFallbackEvent(true, reason, der, swapAccuracy, clock.instant()));
    }

    public synchronized boolean isFallbackActive() {
        return fallbackActive;
    }

    public synchronized QualityLevel quality() {
        return quality;
    }

    public synchronized DiarizationMetrics metrics() {
        return new DiarizationMetrics(der, swapAccuracy, quality, fallbackActive, fallbackRemaining, history.size());
    }

    /** Clears history, swap records, estimates and fallback state. */
    public synchronized void reset() {
        history.clear();
        swaps.clear();
        der = 0.0;
        swapAccuracy = 1.0;
        quality = QualityLevel.UNKNOWN;
        fallbackActive = false;
        fallbackRemaining = 0;
    }
}
