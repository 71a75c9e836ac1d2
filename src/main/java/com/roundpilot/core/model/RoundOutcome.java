package com.roundpilot.core.model;

/**
 * Values read from the screen when a round ends.
 */
public record RoundOutcome(double finalScore, int totalPlayers, double totalWin, double balance) {

    public boolean isWinAgainst(double autoCashout) {
        return finalScore > autoCashout;
    }
}
