package com.roundpilot.core.model;

import java.util.List;
import java.util.Map;

/**
 * Immutable per-source configuration, created once at startup.
 *
 * @param id             source identifier (one monitored game instance)
 * @param regions        absolute screen regions by role
 * @param amountField    absolute click point of the stake input
 * @param playButton     absolute click point of the play control
 * @param betSequence    stake amounts used cyclically by consecutive-loss count
 * @param autoCashout    multiplier the score must exceed for a round to count as won
 * @param targetMoney    profit over the starting balance at which the source stops; {@code <= 0} disables
 */
public record SourceConfig(
        String id,
        Map<RegionRole, Region> regions,
        ScreenPoint amountField,
        ScreenPoint playButton,
        List<Integer> betSequence,
        double autoCashout,
        double targetMoney
) {

    public SourceConfig {
        regions = Map.copyOf(regions);
        betSequence = List.copyOf(betSequence);
        if (betSequence.isEmpty()) {
            throw new IllegalArgumentException("Bet sequence for " + id + " must not be empty");
        }
    }

    public Region region(RegionRole role) {
        Region region = regions.get(role);
        if (region == null) {
            throw new IllegalStateException("Source " + id + " has no " + role.key() + " region");
        }
        return region;
    }

    public int stakeAt(int betIndex) {
        return betSequence.get(betIndex);
    }

    /** Sum of the whole sequence: the most a full losing streak can cost. */
    public long maxLoss() {
        return betSequence.stream().mapToLong(Integer::longValue).sum();
    }
}
