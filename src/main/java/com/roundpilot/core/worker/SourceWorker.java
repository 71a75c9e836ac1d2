package com.roundpilot.core.worker;

import com.roundpilot.core.actuator.ActionSink;
import com.roundpilot.core.events.EventBus;
import com.roundpilot.core.events.RoundEvent;
import com.roundpilot.core.logging.MdcContext;
import com.roundpilot.core.metrics.RoundpilotMetrics;
import com.roundpilot.core.model.ActionRequest;
import com.roundpilot.core.model.Earnings;
import com.roundpilot.core.model.Phase;
import com.roundpilot.core.model.RegionRole;
import com.roundpilot.core.model.RoundOutcome;
import com.roundpilot.core.model.RoundRecord;
import com.roundpilot.core.model.RoundSnapshot;
import com.roundpilot.core.model.SourceConfig;
import com.roundpilot.core.orchestrator.ShutdownSignal;
import com.roundpilot.core.persistence.RecordSink;
import com.roundpilot.core.phase.PhaseClassifier;
import com.roundpilot.core.screen.ReadException;
import com.roundpilot.core.screen.ReadingParser;
import com.roundpilot.core.screen.ScreenReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Monitors one source: polls its phase, runs the round state machine, requests bets
 * and hands finished rounds to persistence.
 * <p>
 * Phase handling is edge-triggered. Entry actions run only on a transition, so each
 * fires once per round however many polls observe the same phase:
 * <ul>
 *   <li>{@code ENDED -> WAITING}: clears the bet-placed flag for the new round</li>
 *   <li>{@code WAITING -> BETTING_READY}: submits one {@link ActionRequest} unless already placed</li>
 *   <li>{@code -> ENDED}: reads the outcome, updates the bet index, emits a {@link RoundRecord}</li>
 * </ul>
 * While a round is active, de-duplicated snapshots are collected on every poll.
 * Read failures are logged and the cycle is retried on the next poll.
 */
public class SourceWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SourceWorker.class);

    /**
     * Timing knobs of the poll loop.
     *
     * @param pollInterval        sleep between poll cycles
     * @param enqueueTimeout      how long a bet request may wait for action channel space
     * @param balanceReadAttempts attempts to read the starting balance
     * @param balanceRetryDelay   pause between balance attempts
     */
    public record Settings(
            Duration pollInterval,
            Duration enqueueTimeout,
            int balanceReadAttempts,
            Duration balanceRetryDelay
    ) {}

    private final SourceConfig config;
    private final ScreenReader reader;
    private final PhaseClassifier classifier;
    private final ActionSink actions;
    private final RecordSink records;
    private final EventBus eventBus;
    private final RoundpilotMetrics metrics;
    private final ShutdownSignal shutdown;
    private final Settings settings;
    private final WorkerRuntimeState state;

    public SourceWorker(SourceConfig config,
                        ScreenReader reader,
                        PhaseClassifier classifier,
                        ActionSink actions,
                        RecordSink records,
                        EventBus eventBus,
                        RoundpilotMetrics metrics,
                        ShutdownSignal shutdown,
                        Settings settings) {
        this.config = config;
        this.reader = reader;
        this.classifier = classifier;
        this.actions = actions;
        this.records = records;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.shutdown = shutdown;
        this.settings = settings;
        this.state = new WorkerRuntimeState(config.betSequence().size());
    }

    public String sourceId() {
        return config.id();
    }

    @Override
    public void run() {
        MdcContext.setSource(config.id());
        try {
            initializeBalance();
            log.info("Source {} started, balance {}, bet sequence {}",
                    config.id(), state.currentMoney(), config.betSequence());
            publish(RoundEvent.SOURCE_STARTED, Map.of("balance", state.currentMoney()));

            while (!shutdown.isTriggered()) {
                if (state.targetReached(config.targetMoney())) {
                    log.info("Target reached for {}: balance {}, started at {}, target +{}",
                            config.id(), state.currentMoney(), state.startingMoney(), config.targetMoney());
                    publish(RoundEvent.TARGET_REACHED, Map.of(
                            "balance", state.currentMoney(),
                            "target", config.targetMoney()));
                    break;
                }
                try {
                    pollOnce();
                } catch (ReadException e) {
                    metrics.recordReadFailure(config.id());
                    log.warn("Read failed for {}, retrying next poll: {}", config.id(), e.getMessage());
                } catch (RuntimeException e) {
                    metrics.recordReadFailure(config.id());
                    log.error("Poll cycle failed for {}, retrying next poll", config.id(), e);
                }
                shutdown.await(settings.pollInterval());
            }
        } finally {
            log.info("Source {} stopped after {} rounds ({} won)",
                    config.id(), state.roundsPlayed(), state.wins());
            publish(RoundEvent.SOURCE_STOPPED, Map.of(
                    "rounds", state.roundsPlayed(),
                    "wins", state.wins()));
            MdcContext.clear();
        }
    }

    /**
     * Reads the starting balance. Repeated failures are tolerated: the source starts at zero.
     */
    void initializeBalance() {
        int attempts = Math.max(1, settings.balanceReadAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                double balance = reader.readNumber(config.region(RegionRole.MY_MONEY));
                if (balance > 0) {
                    state.setInitialMoney(balance);
                    return;
                }
                log.warn("Attempt {} to read balance for {} returned {}", attempt, config.id(), balance);
            } catch (ReadException e) {
                log.warn("Attempt {} to read balance for {} failed: {}", attempt, config.id(), e.getMessage());
            }
            if (attempt < attempts && shutdown.await(settings.balanceRetryDelay())) {
                break;
            }
        }
        state.setInitialMoney(0.0);
        log.warn("Could not read initial balance for {}, starting at 0", config.id());
    }

    /**
     * One poll cycle: classify the phase, run entry actions on an edge, then the per-phase work.
     */
    void pollOnce() {
        Phase sampled = classifier.classify(reader.sampleColor(config.region(RegionRole.PHASE)));
        if (sampled == Phase.UNKNOWN) {
            // Unclassifiable samples keep the last known phase so edges are not lost.
            log.debug("Unclassified phase sample for {}", config.id());
            return;
        }

        if (state.transitionTo(sampled)) {
            Phase previous = state.previousPhase();
            log.debug("Phase {} -> {} for {}", previous, sampled, config.id());
            metrics.recordPhaseTransition(config.id(), sampled);
            publish(RoundEvent.PHASE_CHANGED, Map.of("from", previous.name(), "to", sampled.name()));
            onEnter(previous, sampled);
        }

        if (sampled.isActive()) {
            collectSnapshot(sampled);
        } else if (sampled == Phase.ENDED && state.roundEndPending()) {
            finishRound();
        }
    }

    private void onEnter(Phase previous, Phase entered) {
        if (previous == Phase.ENDED) {
            if (state.roundEndPending()) {
                log.warn("Round end for {} was never read, discarding {} snapshots",
                        config.id(), state.roundSnapshots().size());
                state.setRoundEndPending(false);
            }
            state.clearSnapshots();
        }

        switch (entered) {
            case WAITING -> {
                if (previous == Phase.ENDED) {
                    state.setBetPlacedForRound(false);
                }
            }
            case BETTING_READY -> {
                if (previous == Phase.WAITING && !state.betPlacedForRound()) {
                    requestBet();
                }
            }
            case ENDED -> state.setRoundEndPending(true);
            default -> {
            }
        }
    }

    private void requestBet() {
        int stake = config.stakeAt(state.betIndex());
        var request = new ActionRequest(
                config.id(),
                stake,
                config.amountField(),
                config.playButton(),
                config.id() + "-" + UUID.randomUUID(),
                Instant.now());

        if (actions.submit(request, settings.enqueueTimeout())) {
            state.setBetPlacedForRound(true);
            metrics.recordBetRequested(config.id());
            log.info("Bet requested for {}: {} (index {})", config.id(), stake, state.betIndex());
            publish(RoundEvent.BET_REQUESTED, Map.of(
                    "stake", stake,
                    "betIndex", state.betIndex(),
                    "requestId", request.requestId()));
        } else {
            metrics.recordBetDropped(config.id());
            log.warn("Action queue full, skipping bet of {} for {} this round", stake, config.id());
            publish(RoundEvent.BET_DROPPED, Map.of("stake", stake));
        }
    }

    private void collectSnapshot(Phase phase) {
        double score = reader.readNumber(config.region(RegionRole.SCORE));
        if (!phase.accepts(score)) {
            throw new ReadException("Score " + score + " is inconsistent with phase " + phase);
        }
        int players = ReadingParser.parsePlayerCurrent(reader.readText(config.region(RegionRole.OTHER_COUNT)));
        double playersWin = reader.readNumber(config.region(RegionRole.OTHER_MONEY));
        if (state.addSnapshot(new RoundSnapshot(score, players, playersWin, Instant.now()))) {
            log.trace("Snapshot {}x, {} players for {}", score, players, config.id());
        }
    }

    /**
     * Reads the outcome and closes the round. A failed read leaves the round pending so
     * the next poll that still sees {@code ENDED} tries again.
     */
    private void finishRound() {
        RoundOutcome outcome = readOutcome();
        state.setRoundEndPending(false);

        boolean win = outcome.isWinAgainst(config.autoCashout());
        int stake = config.stakeAt(state.betIndex());
        if (outcome.balance() > 0) {
            state.setCurrentMoney(outcome.balance());
        }

        var record = new RoundRecord(
                UUID.randomUUID().toString(),
                config.id(),
                outcome.finalScore(),
                outcome.totalWin(),
                outcome.totalPlayers(),
                state.roundSnapshots(),
                new Earnings(stake, config.autoCashout(), state.currentMoney()),
                Instant.now());

        state.applyResult(win);
        state.clearSnapshots();

        metrics.recordRoundEnded(config.id(), win);
        log.info("Round {} for {}: {} at {}x, balance {}, next bet index {}",
                state.roundsPlayed(), config.id(), win ? "WIN" : "LOSS",
                outcome.finalScore(), state.currentMoney(), state.betIndex());
        publish(RoundEvent.ROUND_ENDED, Map.of(
                "win", win,
                "score", outcome.finalScore(),
                "balance", state.currentMoney(),
                "snapshots", record.snapshots().size(),
                "betIndex", state.betIndex()));

        if (!records.offer(record)) {
            metrics.recordRecordDropped(config.id());
            log.warn("Record queue full, dropping round {} for {}", record.roundId(), config.id());
            publish(RoundEvent.RECORD_DROPPED, Map.of("roundId", record.roundId()));
        }
    }

    private RoundOutcome readOutcome() {
        double finalScore = reader.readNumber(config.region(RegionRole.SCORE));
        if (finalScore < 1.0) {
            throw new ReadException("Final score " + finalScore + " is below 1.0");
        }
        int totalPlayers = ReadingParser.parsePlayerTotal(reader.readText(config.region(RegionRole.OTHER_COUNT)));
        double totalWin = reader.readNumber(config.region(RegionRole.OTHER_MONEY));
        double balance = reader.readNumber(config.region(RegionRole.MY_MONEY));
        return new RoundOutcome(finalScore, totalPlayers, totalWin, balance);
    }

    private void publish(String eventType, Map<String, Object> payload) {
        eventBus.publish(RoundEvent.of(eventType, config.id(), payload));
    }

    WorkerRuntimeState runtimeState() {
        return state;
    }
}
