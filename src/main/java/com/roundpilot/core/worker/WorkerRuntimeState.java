package com.roundpilot.core.worker;

import com.roundpilot.core.model.Phase;
import com.roundpilot.core.model.RoundSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one source worker. Confined to the worker's thread and never shared.
 */
public class WorkerRuntimeState {

    private final int sequenceLength;

    private Phase currentPhase = Phase.UNKNOWN;
    private Phase previousPhase = Phase.UNKNOWN;
    private int betIndex;
    private boolean betPlacedForRound;
    private boolean roundEndPending;
    private double startingMoney;
    private double currentMoney;
    private final List<RoundSnapshot> roundSnapshots = new ArrayList<>();
    private int roundsPlayed;
    private int wins;

    public WorkerRuntimeState(int sequenceLength) {
        if (sequenceLength < 1) {
            throw new IllegalArgumentException("Bet sequence length must be positive");
        }
        this.sequenceLength = sequenceLength;
    }

    /**
     * Moves to {@code sampled} if it differs from the current phase.
     *
     * @return true on a transition (an edge), false when the phase is unchanged
     */
    public boolean transitionTo(Phase sampled) {
        if (sampled == currentPhase) {
            return false;
        }
        previousPhase = currentPhase;
        currentPhase = sampled;
        return true;
    }

    /**
     * Applies a round result to the bet index: reset on a win, advance cyclically on a loss.
     */
    public void applyResult(boolean win) {
        roundsPlayed++;
        if (win) {
            wins++;
            betIndex = 0;
        } else {
            betIndex = (betIndex + 1) % sequenceLength;
        }
    }

    /**
     * Appends the snapshot unless it repeats the last recorded reading.
     *
     * @return true if it was appended
     */
    public boolean addSnapshot(RoundSnapshot snapshot) {
        if (!roundSnapshots.isEmpty() && roundSnapshots.get(roundSnapshots.size() - 1).sameReadingAs(snapshot)) {
            return false;
        }
        roundSnapshots.add(snapshot);
        return true;
    }

    public void setInitialMoney(double money) {
        this.startingMoney = money;
        this.currentMoney = money;
    }

    /**
     * Whether the profit target over the starting balance has been met. Disabled for targets {@code <= 0}.
     */
    public boolean targetReached(double targetMoney) {
        return targetMoney > 0 && currentMoney >= startingMoney + targetMoney;
    }

    public Phase currentPhase() { return currentPhase; }
    public Phase previousPhase() { return previousPhase; }
    public int betIndex() { return betIndex; }
    public boolean betPlacedForRound() { return betPlacedForRound; }
    public void setBetPlacedForRound(boolean placed) { this.betPlacedForRound = placed; }
    public boolean roundEndPending() { return roundEndPending; }
    public void setRoundEndPending(boolean pending) { this.roundEndPending = pending; }
    public double startingMoney() { return startingMoney; }
    public double currentMoney() { return currentMoney; }
    public void setCurrentMoney(double currentMoney) { this.currentMoney = currentMoney; }
    public List<RoundSnapshot> roundSnapshots() { return Collections.unmodifiableList(roundSnapshots); }
    public void clearSnapshots() { roundSnapshots.clear(); }
    public int roundsPlayed() { return roundsPlayed; }
    public int wins() { return wins; }
}
