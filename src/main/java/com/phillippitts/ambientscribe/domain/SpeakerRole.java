package com.phillippitts.ambientscribe.domain;

/**
 * The two conversational roles plus the undecided state.
 */
public enum SpeakerRole {
    UNKNOWN,
    ROLE_A,
    ROLE_B;

    /**
     * Returns the opposite role. {@link #UNKNOWN} maps to {@link #ROLE_A}, matching the
     * "first speaker is role A" rule used when swapping from an undecided state.
     */
    public SpeakerRole other() {
        return switch (this) {
            case ROLE_A -> ROLE_B;
            case ROLE_B, UNKNOWN -> ROLE_A;
        };
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
