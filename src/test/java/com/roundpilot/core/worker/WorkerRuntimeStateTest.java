package com.roundpilot.core.worker;

import com.roundpilot.core.model.Phase;
import com.roundpilot.core.model.RoundSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRuntimeStateTest {

    @Nested
    @DisplayName("bet index")
    class BetIndexTests {

        @Test
        @DisplayName("three losses then a win visits 0, 1, 2, 3, 0")
        void lossesThenWin() {
            var state = new WorkerRuntimeState(4);
            var visited = new ArrayList<Integer>();
            visited.add(state.betIndex());
            for (boolean win : new boolean[]{false, false, false, true}) {
                state.applyResult(win);
                visited.add(state.betIndex());
            }
            assertEquals(List.of(0, 1, 2, 3, 0), visited);
            assertEquals(4, state.roundsPlayed());
            assertEquals(1, state.wins());
        }

        @Test
        @DisplayName("N consecutive losses land on N mod length")
        void wrapsAround() {
            for (int n = 0; n < 20; n++) {
                var state = new WorkerRuntimeState(4);
                for (int i = 0; i < n; i++) {
                    state.applyResult(false);
                }
                assertEquals(n % 4, state.betIndex(), "after " + n + " losses");
            }
        }

        @Test
        @DisplayName("stays within the sequence for any result history")
        void alwaysInRange() {
            var random = new Random(42);
            var state = new WorkerRuntimeState(3);
            for (int i = 0; i < 1000; i++) {
                state.applyResult(random.nextBoolean());
                assertTrue(state.betIndex() >= 0 && state.betIndex() < 3);
            }
        }

        @Test
        @DisplayName("a single-stake sequence always stays at 0")
        void singleStake() {
            var state = new WorkerRuntimeState(1);
            state.applyResult(false);
            state.applyResult(false);
            assertEquals(0, state.betIndex());
        }

        @Test
        @DisplayName("empty sequence is rejected")
        void emptySequence() {
            assertThrows(IllegalArgumentException.class, () -> new WorkerRuntimeState(0));
        }
    }

    @Nested
    @DisplayName("phase edges")
    class PhaseTests {

        @Test
        @DisplayName("reports an edge only when the phase changes")
        void edgeOnlyOnChange() {
            var state = new WorkerRuntimeState(2);
            assertTrue(state.transitionTo(Phase.WAITING));
            assertFalse(state.transitionTo(Phase.WAITING));
            assertTrue(state.transitionTo(Phase.BETTING_READY));
            assertEquals(Phase.WAITING, state.previousPhase());
            assertEquals(Phase.BETTING_READY, state.currentPhase());
        }
    }

    @Nested
    @DisplayName("snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("consecutive identical readings are stored once")
        void deduplicates() {
            var state = new WorkerRuntimeState(2);
            assertTrue(state.addSnapshot(new RoundSnapshot(1.2, 10, 50, Instant.now())));
            assertFalse(state.addSnapshot(new RoundSnapshot(1.2, 10, 50, Instant.now().plusMillis(200))));
            assertTrue(state.addSnapshot(new RoundSnapshot(1.3, 10, 50, Instant.now())));
            assertTrue(state.addSnapshot(new RoundSnapshot(1.2, 10, 50, Instant.now())));
            assertEquals(3, state.roundSnapshots().size());
        }

        @Test
        @DisplayName("exposed list is read-only")
        void readOnly() {
            var state = new WorkerRuntimeState(2);
            assertThrows(UnsupportedOperationException.class,
                    () -> state.roundSnapshots().add(new RoundSnapshot(1.0, 0, 0, Instant.now())));
        }
    }

    @Nested
    @DisplayName("target")
    class TargetTests {

        @Test
        @DisplayName("reached once profit meets the target")
        void reached() {
            var state = new WorkerRuntimeState(2);
            state.setInitialMoney(1000);
            assertFalse(state.targetReached(100));
            state.setCurrentMoney(1100);
            assertTrue(state.targetReached(100));
        }

        @Test
        @DisplayName("non-positive target never triggers")
        void disabled() {
            var state = new WorkerRuntimeState(2);
            state.setInitialMoney(0);
            state.setCurrentMoney(5000);
            assertFalse(state.targetReached(0));
        }
    }
}
