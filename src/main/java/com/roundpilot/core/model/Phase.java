package com.roundpilot.core.model;

/**
 * Round phase inferred from the sampled color of the phase region.
 */
public enum Phase {
    UNKNOWN,
    WAITING,
    BETTING_READY,
    ACTIVE_LOW,
    ACTIVE_MID,
    ACTIVE_HIGH,
    ENDED;

    public boolean isActive() {
        return this == ACTIVE_LOW || this == ACTIVE_MID || this == ACTIVE_HIGH;
    }

    /**
     * Whether a running score is plausible for this phase. Only meaningful for active phases.
     */
    public boolean accepts(double runningScore) {
        return switch (this) {
            case ACTIVE_LOW -> runningScore >= 1.0 && runningScore < 2.0;
            case ACTIVE_MID -> runningScore >= 2.0 && runningScore < 10.0;
            case ACTIVE_HIGH -> runningScore >= 10.0;
            default -> false;
        };
    }
}
