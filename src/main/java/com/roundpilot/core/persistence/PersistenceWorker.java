package com.roundpilot.core.persistence;

import com.roundpilot.core.logging.MdcContext;
import com.roundpilot.core.metrics.RoundpilotMetrics;
import com.roundpilot.core.model.RoundRecord;
import com.roundpilot.core.orchestrator.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single writer of the durable store: drains the record channel into batches.
 * <p>
 * A batch is flushed when it reaches the batch size or when the batch timeout has
 * elapsed since the last flush, whichever comes first. After an idle stretch a lone
 * record is therefore written as soon as it arrives. A failed write drops the batch,
 * is counted and logged, and the worker keeps running. On stop, everything still
 * queued or pending is flushed before the store is closed.
 */
public class PersistenceWorker implements RecordSink {

    private static final Logger log = LoggerFactory.getLogger(PersistenceWorker.class);

    private static final long IDLE_RECEIVE_MS = 100;

    /**
     * @param batchSize         records that force a flush
     * @param batchTimeout      longest interval between flushes while records are pending
     * @param statsInterval     period of the stats log line
     * @param queueWarningSize  queue depth that logs a warning
     * @param queueCriticalSize queue depth that logs an error
     */
    public record Settings(
            int batchSize,
            Duration batchTimeout,
            Duration statsInterval,
            int queueWarningSize,
            int queueCriticalSize
    ) {}

    private final RoundStore store;
    private final Settings settings;
    private final RoundpilotMetrics metrics;
    private final BlockingQueue<RoundRecord> queue;
    private final ShutdownSignal stopSignal = new ShutdownSignal();

    // Owned by the worker thread.
    private final List<RoundRecord> pending = new ArrayList<>();
    private long lastFlushNanos;
    private long nextStatsNanos;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private final AtomicLong queueWarnings = new AtomicLong();
    private final AtomicInteger maxQueueSize = new AtomicInteger();
    private final AtomicInteger lastBatchSize = new AtomicInteger();
    private final AtomicLong lastBatchMillis = new AtomicLong();
    private final AtomicLong totalBatchMillis = new AtomicLong();

    private volatile Thread thread;

    public PersistenceWorker(RoundStore store, int capacity, Settings settings, RoundpilotMetrics metrics) {
        this.store = store;
        this.settings = settings;
        this.metrics = metrics;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Persistence worker already started");
        }
        thread = new Thread(this::runLoop, "persistence-worker");
        thread.start();
        log.info("Persistence worker started (batch size {}, timeout {} ms)",
                settings.batchSize(), settings.batchTimeout().toMillis());
    }

    @Override
    public boolean offer(RoundRecord record) {
        if (stopSignal.isTriggered()) {
            return false;
        }
        Thread t = thread;
        if (t != null && !t.isAlive()) {
            log.error("Persistence worker is not running, record {} for {} dropped", record.roundId(), record.sourceId());
            return false;
        }
        boolean accepted = queue.offer(record);
        if (accepted) {
            maxQueueSize.accumulateAndGet(queue.size(), Math::max);
        }
        return accepted;
    }

    /**
     * Stops accepting records, then waits for the worker to drain and close the store.
     */
    public void stop(Duration timeout) {
        log.info("Stopping persistence worker ({} queued)", queue.size());
        stopSignal.trigger();
        Thread t = thread;
        if (t == null) {
            // Never started: flush on the caller's thread.
            try {
                drain();
            } finally {
                store.close();
            }
            return;
        }
        try {
            t.join(timeout.toMillis());
            if (t.isAlive()) {
                log.warn("Persistence worker did not finish draining within {} ms, interrupting",
                        timeout.toMillis());
                t.interrupt();
                t.join(timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runLoop() {
        MdcContext.setComponent("persistence");
        lastFlushNanos = System.nanoTime();
        nextStatsNanos = lastFlushNanos + settings.statsInterval().toNanos();
        try {
            while (!stopSignal.isTriggered()) {
                RoundRecord record;
                try {
                    record = queue.poll(receiveTimeoutMs(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (record != null) {
                    add(record);
                }
                if (pending.size() >= settings.batchSize()
                        || (!pending.isEmpty() && System.nanoTime() >= flushDeadlineNanos())) {
                    flush();
                }
                checkQueueHealth();
                if (System.nanoTime() >= nextStatsNanos) {
                    logStats();
                    nextStatsNanos = System.nanoTime() + settings.statsInterval().toNanos();
                }
            }
            drain();
        } catch (RuntimeException e) {
            log.error("Persistence worker failed, {} pending records lost", pending.size(), e);
        } finally {
            stopSignal.trigger();
            store.close();
            logFinalStats();
            MdcContext.clear();
        }
    }

    private long receiveTimeoutMs() {
        if (pending.isEmpty()) {
            return IDLE_RECEIVE_MS;
        }
        long remaining = TimeUnit.NANOSECONDS.toMillis(flushDeadlineNanos() - System.nanoTime());
        return Math.max(0, remaining);
    }

    private long flushDeadlineNanos() {
        return lastFlushNanos + settings.batchTimeout().toNanos();
    }

    private void add(RoundRecord record) {
        pending.add(record);
    }

    private void drain() {
        int drained = queue.size() + pending.size();
        if (drained > 0) {
            log.info("Draining {} records before shutdown", drained);
        }
        RoundRecord record;
        while ((record = queue.poll()) != null) {
            add(record);
            if (pending.size() >= settings.batchSize()) {
                flush();
            }
        }
        flush();
    }

    /**
     * Writes all pending records grouped by source, in arrival order within each group.
     */
    void flush() {
        if (pending.isEmpty()) {
            return;
        }
        int size = pending.size();
        Map<String, List<RoundRecord>> groups = new LinkedHashMap<>();
        for (RoundRecord record : pending) {
            groups.computeIfAbsent(record.sourceId(), k -> new ArrayList<>()).add(record);
        }
        pending.clear();

        long start = System.nanoTime();
        int stored;
        int failed;
        try {
            RoundStore.WriteResult result = store.write(groups);
            stored = result.stored();
            failed = result.failed();
        } catch (RuntimeException e) {
            stored = 0;
            failed = size;
            log.error("Flush of {} records failed, records dropped: {}", size, e.getMessage(), e);
        }
        lastFlushNanos = System.nanoTime();
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        processed.addAndGet(stored);
        errors.addAndGet(failed);
        batches.incrementAndGet();
        lastBatchSize.set(size);
        lastBatchMillis.set(millis);
        totalBatchMillis.addAndGet(millis);
        metrics.recordBatchFlushed(size, millis);
        metrics.recordRecordsPersisted(stored, failed);
        log.debug("Flushed {} records in {} groups ({} ms, {} failed)", size, groups.size(), millis, failed);
    }

    private void checkQueueHealth() {
        int size = queue.size();
        maxQueueSize.accumulateAndGet(size, Math::max);
        if (size > settings.queueCriticalSize()) {
            queueWarnings.incrementAndGet();
            log.error("Record queue size critical: {} items", size);
        } else if (size > settings.queueWarningSize()) {
            queueWarnings.incrementAndGet();
            log.warn("Record queue size high: {} items", size);
        }
    }

    private void logStats() {
        PersistenceStats s = stats();
        log.info("Stats: {} processed, {} items/sec, avg batch {} items, queue {}",
                s.processed(), String.format("%.1f", s.itemsPerSecond()),
                String.format("%.1f", s.averageBatchSize()), s.queueSize());
    }

    private void logFinalStats() {
        PersistenceStats s = stats();
        log.info("Persistence final statistics: processed={}, batches={}, errors={}, queueWarnings={}, maxQueueSize={}",
                s.processed(), s.batches(), s.errors(), s.queueWarnings(), s.maxQueueSize());
        if (s.batches() > 0) {
            log.info("Persistence averages: batch size {}, batch time {} ms, throughput {} items/sec",
                    String.format("%.1f", s.averageBatchSize()),
                    String.format("%.1f", s.averageBatchMillis()),
                    String.format("%.1f", s.itemsPerSecond()));
        }
    }

    public PersistenceStats stats() {
        return new PersistenceStats(
                processed.get(),
                batches.get(),
                errors.get(),
                queueWarnings.get(),
                maxQueueSize.get(),
                queue.size(),
                lastBatchSize.get(),
                lastBatchMillis.get(),
                totalBatchMillis.get());
    }
}
