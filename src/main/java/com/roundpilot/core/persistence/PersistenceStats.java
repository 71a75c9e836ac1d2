package com.roundpilot.core.persistence;

/**
 * Point-in-time counters of the persistence worker.
 *
 * @param processed         records durably stored
 * @param batches           flushes performed
 * @param errors            records dropped by failed writes
 * @param queueWarnings     times the queue depth crossed the warning size
 * @param maxQueueSize      queue-depth high-water mark
 * @param queueSize         current queue depth
 * @param lastBatchSize     records in the last flush
 * @param lastBatchMillis   duration of the last flush
 * @param totalBatchMillis  time spent flushing overall
 */
public record PersistenceStats(
        long processed,
        long batches,
        long errors,
        long queueWarnings,
        int maxQueueSize,
        int queueSize,
        int lastBatchSize,
        long lastBatchMillis,
        long totalBatchMillis
) {

    public double averageBatchSize() {
        return batches == 0 ? 0.0 : (double) processed / batches;
    }

    public double averageBatchMillis() {
        return batches == 0 ? 0.0 : (double) totalBatchMillis / batches;
    }

    /** Records stored per second of flush time. */
    public double itemsPerSecond() {
        return totalBatchMillis == 0 ? 0.0 : processed * 1000.0 / totalBatchMillis;
    }
}
