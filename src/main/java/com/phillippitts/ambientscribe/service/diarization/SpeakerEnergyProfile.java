package com.phillippitts.ambientscribe.service.diarization;

/**
 * Running energy statistics for one speaker role.
 *
 * <p>Immutable: {@link #update(float)} returns a new profile, so a reader never observes a
 * half-applied update.
 *
 * @param meanEnergy streaming mean of assigned energies
 * @param peakEnergy highest assigned energy
 * @param minEnergy  lowest assigned energy
 * @param samples    number of energies folded in
 */
public record SpeakerEnergyProfile(float meanEnergy, float peakEnergy, float minEnergy, int samples) {

    private static final SpeakerEnergyProfile EMPTY = new SpeakerEnergyProfile(0f, 0f, 0f, 0);

    public static SpeakerEnergyProfile empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return samples == 0;
    }

    /**
     * Folds one energy into the profile: {@code mean' = (mean * n + x) / (n + 1)}.
     */
    public SpeakerEnergyProfile update(float energy) {
        if (samples == 0) {
            return new SpeakerEnergyProfile(energy, energy, energy, 1);
        }
        float mean = (meanEnergy * samples + energy) / (samples + 1);
        return new SpeakerEnergyProfile(mean, Math.max(peakEnergy, energy), Math.min(minEnergy, energy), samples + 1);
    }

    /**
     * Similarity of {@code energy} to this profile's mean: {@code min(e/mean, mean/e)}, so identical
     * energy scores 1.0. An empty profile scores 0.
     */
    public float similarity(float energy) {
        if (samples == 0) {
            return 0f;
        }
        if (meanEnergy <= 0f || energy <= 0f) {
            return meanEnergy == energy ? 1f : 0f;
        }
        float ratio = energy / meanEnergy;
        return ratio > 1f ? 1f / ratio : ratio;
    }
}
