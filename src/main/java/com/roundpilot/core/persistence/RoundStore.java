package com.roundpilot.core.persistence;

import com.roundpilot.core.model.RoundRecord;

import java.util.List;
import java.util.Map;

/**
 * Durable store for finished rounds. Used by a single writer thread.
 */
public interface RoundStore extends AutoCloseable {

    /**
     * Writes every group with one bulk write per group inside a single transaction.
     * A group that fails is retried record by record; records that still fail are dropped.
     *
     * @param groups records grouped by source id, in flush order
     * @return how many records were stored and how many were dropped
     * @throws PersistenceWriteException if the transaction itself could not be completed
     */
    WriteResult write(Map<String, List<RoundRecord>> groups);

    /**
     * Per-source round totals, ordered by source id.
     */
    List<SourceSummary> summarize();

    @Override
    void close();

    record WriteResult(int stored, int failed) {}

    /**
     * @param sourceId    source the rounds were played on
     * @param rounds      rounds stored
     * @param wins        rounds whose final score beat the auto-stop in force
     * @param lastBalance balance recorded with the latest round
     */
    record SourceSummary(String sourceId, long rounds, long wins, double lastBalance) {}
}
