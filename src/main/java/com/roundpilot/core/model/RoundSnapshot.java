package com.roundpilot.core.model;

import java.time.Instant;

/**
 * One reading taken while a round is active.
 *
 * @param score         running multiplier
 * @param players       number of players still in the round
 * @param playersWin    amount currently won by other players
 * @param capturedAt    when the reading was taken
 */
public record RoundSnapshot(double score, int players, double playersWin, Instant capturedAt) {

    /**
     * Compares the reading itself, ignoring the capture time.
     */
    public boolean sameReadingAs(RoundSnapshot other) {
        return other != null
                && Double.compare(score, other.score) == 0
                && players == other.players
                && Double.compare(playersWin, other.playersWin) == 0;
    }
}
