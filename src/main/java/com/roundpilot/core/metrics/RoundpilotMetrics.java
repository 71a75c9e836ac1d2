package com.roundpilot.core.metrics;

import com.roundpilot.core.model.Phase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the round runtime.
 */
@Service
public class RoundpilotMetrics {

    private final MeterRegistry registry;

    public RoundpilotMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPhaseTransition(String sourceId, Phase to) {
        Counter.builder("roundpilot.phase.transitions")
                .tag("source", sourceId)
                .tag("phase", to.name())
                .register(registry)
                .increment();
    }

    public void recordReadFailure(String sourceId) {
        Counter.builder("roundpilot.reads.failed")
                .description("Poll cycles that failed to read the screen")
                .tag("source", sourceId)
                .register(registry)
                .increment();
    }

    public void recordBetRequested(String sourceId) {
        Counter.builder("roundpilot.bets.requested")
                .tag("source", sourceId)
                .register(registry)
                .increment();
    }

    /**
     * Records a bet skipped because the action queue stayed full.
     */
    public void recordBetDropped(String sourceId) {
        Counter.builder("roundpilot.bets.dropped")
                .tag("source", sourceId)
                .register(registry)
                .increment();
    }

    public void recordRoundEnded(String sourceId, boolean win) {
        Counter.builder("roundpilot.rounds.ended")
                .tag("source", sourceId)
                .tag("result", win ? "win" : "loss")
                .register(registry)
                .increment();
    }

    public void recordRecordDropped(String sourceId) {
        Counter.builder("roundpilot.records.dropped")
                .description("Round records dropped because the persistence queue was full")
                .tag("source", sourceId)
                .register(registry)
                .increment();
    }

    public void recordActionExecuted(boolean success, long ms) {
        Counter.builder("roundpilot.actions.executed")
                .tag("success", String.valueOf(success))
                .register(registry)
                .increment();
        Timer.builder("roundpilot.actions.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordBatchFlushed(int size, long ms) {
        Counter.builder("roundpilot.persistence.batches")
                .register(registry)
                .increment();
        Timer.builder("roundpilot.persistence.flush.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("roundpilot.persistence.batch_size")
                .description("Number of round records per flushed batch")
                .register(registry)
                .record(size);
    }

    public void recordRecordsPersisted(int stored, int failed) {
        Counter.builder("roundpilot.persistence.records")
                .tag("result", "stored")
                .register(registry)
                .increment(stored);
        Counter.builder("roundpilot.persistence.records")
                .tag("result", "failed")
                .register(registry)
                .increment(failed);
    }
}
