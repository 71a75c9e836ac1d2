package com.roundpilot.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Completed round as handed to the persistence worker.
 *
 * @param roundId          client-generated id linking the round to its snapshots and earnings
 * @param sourceId         source that played the round
 * @param finalScore       multiplier the round ended at
 * @param totalWin         total amount won by all players
 * @param totalPlayerCount number of players in the round
 * @param snapshots        de-duplicated readings taken while the round was active, in order
 * @param earnings         stake, auto-stop and balance
 * @param endedAt          when the end of the round was observed
 */
public record RoundRecord(
        String roundId,
        String sourceId,
        double finalScore,
        double totalWin,
        int totalPlayerCount,
        List<RoundSnapshot> snapshots,
        Earnings earnings,
        Instant endedAt
) {

    public RoundRecord {
        snapshots = List.copyOf(snapshots);
    }
}
