package com.roundpilot.core.worker;

import com.roundpilot.core.actuator.ActionSink;
import com.roundpilot.core.events.EventBus;
import com.roundpilot.core.events.FeedFilter;
import com.roundpilot.core.events.RoundEvent;
import com.roundpilot.core.metrics.RoundpilotMetrics;
import com.roundpilot.core.model.ActionRequest;
import com.roundpilot.core.model.Phase;
import com.roundpilot.core.model.Region;
import com.roundpilot.core.model.RegionRole;
import com.roundpilot.core.model.RoundRecord;
import com.roundpilot.core.model.ScreenPoint;
import com.roundpilot.core.model.SourceConfig;
import com.roundpilot.core.orchestrator.ShutdownSignal;
import com.roundpilot.core.persistence.RecordSink;
import com.roundpilot.core.phase.PhaseClassifier;
import com.roundpilot.core.screen.ReadException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SourceWorkerTest {

    private static final Region PHASE = new Region(0, 0, 10, 10);
    private static final Region SCORE = new Region(20, 0, 10, 10);
    private static final Region MY_MONEY = new Region(40, 0, 10, 10);
    private static final Region OTHER_COUNT = new Region(60, 0, 10, 10);
    private static final Region OTHER_MONEY = new Region(80, 0, 10, 10);

    private static final List<Integer> SEQUENCE = List.of(25, 50, 100, 200);

    private ScriptedScreenReader reader;
    private ActionSink actions;
    private List<RoundRecord> records;
    private List<RoundEvent> events;
    private SimpleMeterRegistry registry;
    private ShutdownSignal shutdown;

    @BeforeEach
    void setUp() {
        reader = new ScriptedScreenReader()
                .text(MY_MONEY, "1000")
                .text(OTHER_COUNT, "12/40")
                .text(OTHER_MONEY, "350");
        actions = mock(ActionSink.class);
        when(actions.submit(any(), any())).thenReturn(true);
        records = new CopyOnWriteArrayList<>();
        events = new CopyOnWriteArrayList<>();
        registry = new SimpleMeterRegistry();
        shutdown = new ShutdownSignal();
    }

    private SourceWorker worker(double targetMoney, RecordSink sink) {
        var config = new SourceConfig("Alpha",
                Map.of(RegionRole.PHASE, PHASE,
                        RegionRole.SCORE, SCORE,
                        RegionRole.MY_MONEY, MY_MONEY,
                        RegionRole.OTHER_COUNT, OTHER_COUNT,
                        RegionRole.OTHER_MONEY, OTHER_MONEY),
                new ScreenPoint(300, 620), new ScreenPoint(430, 620),
                SEQUENCE, 2.0, targetMoney);
        var classifier = new PhaseClassifier(sample -> (int) sample.red(), List.of(Phase.values()));
        var bus = new EventBus();
        bus.subscribe(FeedFilter.everything(), events::add);
        var settings = new SourceWorker.Settings(
                Duration.ofMillis(1), Duration.ofMillis(10), 3, Duration.ZERO);
        return new SourceWorker(config, reader, classifier, actions, sink, bus,
                new RoundpilotMetrics(registry), shutdown, settings);
    }

    private SourceWorker worker() {
        return worker(0, record -> records.add(record));
    }

    private void poll(SourceWorker worker, Phase phase) {
        reader.phases(phase);
        worker.pollOnce();
    }

    /** Plays one full round ending at {@code finalScore} on an already-waiting worker. */
    private void playRound(SourceWorker worker, String finalScore) {
        poll(worker, Phase.BETTING_READY);
        reader.text(SCORE, "1.40x");
        poll(worker, Phase.ACTIVE_LOW);
        reader.text(SCORE, finalScore);
        poll(worker, Phase.ENDED);
        poll(worker, Phase.WAITING);
    }

    private long countEvents(String type) {
        return events.stream().filter(e -> e.eventType().equals(type)).count();
    }

    @Nested
    @DisplayName("betting")
    class BettingTests {

        @Test
        @DisplayName("requests exactly one bet per round however many polls see BETTING_READY")
        void oneBetPerRound() {
            var worker = worker();
            poll(worker, Phase.WAITING);
            for (int i = 0; i < 10; i++) {
                poll(worker, Phase.BETTING_READY);
            }

            var captor = ArgumentCaptor.forClass(ActionRequest.class);
            verify(actions, times(1)).submit(captor.capture(), eq(Duration.ofMillis(10)));
            ActionRequest request = captor.getValue();
            assertEquals("Alpha", request.sourceId());
            assertEquals(25, request.stake());
            assertEquals(new ScreenPoint(300, 620), request.amountField());
            assertTrue(request.requestId().startsWith("Alpha-"));
            assertTrue(worker.runtimeState().betPlacedForRound());
        }

        @Test
        @DisplayName("does not bet when BETTING_READY follows ENDED directly")
        void noBetWithoutWaiting() {
            var worker = worker();
            reader.text(SCORE, "1.10");
            poll(worker, Phase.ENDED);
            poll(worker, Phase.BETTING_READY);
            verify(actions, never()).submit(any(), any());
        }

        @Test
        @DisplayName("stake follows the bet index across rounds")
        void stakeFollowsIndex() {
            var worker = worker();
            poll(worker, Phase.WAITING);
            playRound(worker, "1.50");
            playRound(worker, "1.20");
            playRound(worker, "7.80");
            poll(worker, Phase.BETTING_READY);

            var captor = ArgumentCaptor.forClass(ActionRequest.class);
            verify(actions, times(4)).submit(captor.capture(), any());
            assertEquals(List.of(25, 50, 100, 25),
                    captor.getAllValues().stream().map(ActionRequest::stake).toList());
        }

        @Test
        @DisplayName("a full action queue drops the bet for the round")
        void queueFull() {
            when(actions.submit(any(), any())).thenReturn(false);
            var worker = worker();
            poll(worker, Phase.WAITING);
            poll(worker, Phase.BETTING_READY);
            poll(worker, Phase.BETTING_READY);

            verify(actions, times(1)).submit(any(), any());
            assertFalse(worker.runtimeState().betPlacedForRound());
            assertEquals(1, countEvents(RoundEvent.BET_DROPPED));
            assertEquals(1.0, registry.counter("roundpilot.bets.dropped", "source", "Alpha").count());
        }

        @Test
        @DisplayName("an unclassified sample does not break the WAITING -> BETTING_READY edge")
        void unknownKeepsLastPhase() {
            var worker = worker();
            poll(worker, Phase.WAITING);
            poll(worker, Phase.UNKNOWN);
            assertEquals(Phase.WAITING, worker.runtimeState().currentPhase());
            poll(worker, Phase.BETTING_READY);
            verify(actions, times(1)).submit(any(), any());
        }
    }

    @Nested
    @DisplayName("round end")
    class RoundEndTests {

        @Test
        @DisplayName("emits one record with de-duplicated snapshots and earnings")
        void emitsRecord() {
            var worker = worker();
            worker.initializeBalance();
            poll(worker, Phase.WAITING);
            poll(worker, Phase.BETTING_READY);
            reader.text(SCORE, "1.40x");
            poll(worker, Phase.ACTIVE_LOW);
            poll(worker, Phase.ACTIVE_LOW);
            reader.text(SCORE, "2.10x");
            poll(worker, Phase.ACTIVE_MID);
            reader.text(SCORE, "2.60");
            reader.text(MY_MONEY, "1025");
            poll(worker, Phase.ENDED);
            poll(worker, Phase.ENDED);

            assertEquals(1, records.size());
            RoundRecord record = records.get(0);
            assertEquals("Alpha", record.sourceId());
            assertEquals(2.60, record.finalScore());
            assertEquals(40, record.totalPlayerCount());
            assertEquals(350.0, record.totalWin());
            assertEquals(2, record.snapshots().size());
            assertEquals(12, record.snapshots().get(0).players());
            assertEquals(25.0, record.earnings().stake());
            assertEquals(2.0, record.earnings().autoStop());
            assertEquals(1025.0, record.earnings().balance());

            assertEquals(0, worker.runtimeState().betIndex());
            assertEquals(1, worker.runtimeState().wins());
            assertTrue(worker.runtimeState().roundSnapshots().isEmpty());
            assertEquals(1, countEvents(RoundEvent.ROUND_ENDED));
        }

        @Test
        @DisplayName("a score equal to the auto-cashout is a loss")
        void equalIsLoss() {
            var worker = worker();
            poll(worker, Phase.WAITING);
            playRound(worker, "2.00");
            assertEquals(1, worker.runtimeState().betIndex());
            assertEquals(0, worker.runtimeState().wins());
        }

        @Test
        @DisplayName("failed outcome read is retried while ENDED persists")
        void retriesWhileEnded() {
            var worker = worker();
            poll(worker, Phase.WAITING);
            reader.text(SCORE, "---");
            reader.phases(Phase.ENDED);
            assertThrows(ReadException.class, worker::pollOnce);
            assertTrue(worker.runtimeState().roundEndPending());
            assertTrue(records.isEmpty());

            reader.text(SCORE, "1.05");
            worker.pollOnce();
            assertFalse(worker.runtimeState().roundEndPending());
            assertEquals(1, records.size());
            assertEquals(1, worker.runtimeState().betIndex());
        }

        @Test
        @DisplayName("a round never read before leaving ENDED is discarded")
        void abandonedRound() {
            var worker = worker();
            poll(worker, Phase.WAITING);
            reader.text(SCORE, "oops");
            reader.phases(Phase.ENDED);
            assertThrows(ReadException.class, worker::pollOnce);
            poll(worker, Phase.WAITING);

            assertFalse(worker.runtimeState().roundEndPending());
            assertTrue(records.isEmpty());
            assertEquals(0, worker.runtimeState().roundsPlayed());
        }

        @Test
        @DisplayName("score below 1.0 is rejected as a misread")
        void scoreBelowOne() {
            var worker = worker();
            poll(worker, Phase.WAITING);
            reader.text(SCORE, "0.5");
            reader.phases(Phase.ENDED);
            assertThrows(ReadException.class, worker::pollOnce);
            assertTrue(records.isEmpty());
        }

        @Test
        @DisplayName("inconsistent running score is not stored as a snapshot")
        void inconsistentScore() {
            var worker = worker();
            poll(worker, Phase.WAITING);
            reader.text(SCORE, "15.0");
            reader.phases(Phase.ACTIVE_LOW);
            assertThrows(ReadException.class, worker::pollOnce);
            assertTrue(worker.runtimeState().roundSnapshots().isEmpty());
        }

        @Test
        @DisplayName("a full record queue drops the record but the worker continues")
        void recordDropped() {
            var worker = worker(0, record -> false);
            poll(worker, Phase.WAITING);
            playRound(worker, "3.00");

            assertEquals(1, countEvents(RoundEvent.RECORD_DROPPED));
            assertEquals(1.0, registry.counter("roundpilot.records.dropped", "source", "Alpha").count());
            assertEquals(1, worker.runtimeState().roundsPlayed());
            poll(worker, Phase.BETTING_READY);
            verify(actions, times(2)).submit(any(), any());
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("unreadable balance falls back to zero")
        void balanceFallback() {
            reader.text(MY_MONEY, "n/a");
            var worker = worker();
            worker.initializeBalance();
            assertEquals(0.0, worker.runtimeState().startingMoney());
            assertEquals(0.0, worker.runtimeState().currentMoney());
        }

        @Test
        @DisplayName("balance is read on a later attempt")
        void balanceRetry() {
            reader.text(MY_MONEY, "", "0", "1,500.00");
            var worker = worker();
            worker.initializeBalance();
            assertEquals(1500.0, worker.runtimeState().startingMoney());
        }

        @Test
        @DisplayName("stops by itself once the profit target is reached")
        void stopsAtTarget() throws InterruptedException {
            reader.phases(Phase.WAITING, Phase.BETTING_READY, Phase.ACTIVE_LOW, Phase.ENDED)
                    .text(SCORE, "1.50", "3.10")
                    .text(MY_MONEY, "1000", "1100");
            var worker = worker(50, record -> records.add(record));

            var thread = new Thread(worker, "source-Alpha");
            thread.start();
            thread.join(5000);

            assertFalse(thread.isAlive());
            assertEquals(1, records.size());
            assertEquals(1, countEvents(RoundEvent.TARGET_REACHED));
            assertEquals(RoundEvent.SOURCE_STOPPED, events.get(events.size() - 1).eventType());
        }

        @Test
        @DisplayName("exits promptly when the shutdown signal fires")
        void stopsOnSignal() throws InterruptedException {
            reader.phases(Phase.WAITING);
            var worker = worker();
            var thread = new Thread(worker, "source-Alpha");
            thread.start();
            Thread.sleep(50);
            shutdown.trigger();
            thread.join(2000);

            assertFalse(thread.isAlive());
            assertEquals(1, countEvents(RoundEvent.SOURCE_STARTED));
            assertEquals(1, countEvents(RoundEvent.SOURCE_STOPPED));
        }

        @Test
        @DisplayName("read failures are counted and polling continues")
        void readFailuresCounted() throws InterruptedException {
            var worker = worker();
            // no phase scripted: every sample fails
            var thread = new Thread(worker, "source-Alpha");
            thread.start();
            Thread.sleep(50);
            shutdown.trigger();
            thread.join(2000);

            assertTrue(registry.counter("roundpilot.reads.failed", "source", "Alpha").count() > 1);
        }
    }
}
