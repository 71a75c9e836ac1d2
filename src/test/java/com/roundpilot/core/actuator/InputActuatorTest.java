package com.roundpilot.core.actuator;

import com.roundpilot.core.metrics.RoundpilotMetrics;
import com.roundpilot.core.model.ActionRequest;
import com.roundpilot.core.model.ScreenPoint;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class InputActuatorTest {

    /** Records every input step with the time it happened. */
    static class RecordingDevice implements InputDevice {

        record Step(String action, long nanos) {}

        final List<Step> steps = new CopyOnWriteArrayList<>();
        volatile String failOnType;

        @Override
        public void click(ScreenPoint point) {
            steps.add(new Step("click " + point.x() + "," + point.y(), System.nanoTime()));
        }

        @Override
        public void selectAll() {
            steps.add(new Step("selectAll", System.nanoTime()));
        }

        @Override
        public void type(String text, Duration keystrokeInterval) {
            if (text.equals(failOnType)) {
                throw new ActuatorAbortedException("Pointer moved to the fail-safe corner");
            }
            steps.add(new Step("type " + text, System.nanoTime()));
        }

        List<String> typed() {
            return steps.stream().map(Step::action).filter(a -> a.startsWith("type ")).toList();
        }
    }

    private RecordingDevice device;
    private SimpleMeterRegistry registry;
    private InputActuator actuator;

    @BeforeEach
    void setUp() {
        device = new RecordingDevice();
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    void tearDown() {
        if (actuator != null) {
            actuator.stop(Duration.ofSeconds(2));
        }
    }

    private static ActionRequest request(String sourceId, int stake) {
        return new ActionRequest(sourceId, stake, new ScreenPoint(300, 620), new ScreenPoint(430, 620),
                sourceId + "-" + stake, Instant.now());
    }

    private static void waitFor(java.util.function.BooleanSupplier condition, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("execution")
    class ExecutionTests {

        @Test
        @DisplayName("runs the input steps in order")
        void stepOrder() {
            actuator = new InputActuator(device, InputActuator.Pacing.none(Duration.ZERO), 10,
                    new RoundpilotMetrics(registry));
            actuator.execute(request("Alpha", 150));

            assertEquals(List.of("click 300,620", "selectAll", "type 150", "click 430,620"),
                    device.steps.stream().map(RecordingDevice.Step::action).toList());
            assertEquals(1, actuator.placedCount());
        }

        @Test
        @DisplayName("executes queued requests in arrival order with the cooldown between them")
        void cooldownBetweenRequests() throws InterruptedException {
            actuator = new InputActuator(device, InputActuator.Pacing.none(Duration.ofMillis(200)), 10,
                    new RoundpilotMetrics(registry));
            assertTrue(actuator.submit(request("Alpha", 10), Duration.ofMillis(10)));
            assertTrue(actuator.submit(request("Beta", 20), Duration.ofMillis(10)));
            assertTrue(actuator.submit(request("Alpha", 30), Duration.ofMillis(10)));
            actuator.start();

            waitFor(() -> actuator.placedCount() == 3, Duration.ofSeconds(3));

            assertEquals(List.of("type 10", "type 20", "type 30"), device.typed());
            var firstClicks = device.steps.stream()
                    .filter(s -> s.action().equals("click 300,620"))
                    .mapToLong(RecordingDevice.Step::nanos)
                    .toArray();
            assertEquals(3, firstClicks.length);
            assertTrue(Duration.ofNanos(firstClicks[1] - firstClicks[0]).toMillis() >= 200);
            assertTrue(Duration.ofNanos(firstClicks[2] - firstClicks[0]).toMillis() >= 400);
        }

        @Test
        @DisplayName("a failed request is counted and the next one still runs")
        void failureDoesNotStopActuator() throws InterruptedException {
            device.failOnType = "66";
            actuator = new InputActuator(device, InputActuator.Pacing.none(Duration.ZERO), 10,
                    new RoundpilotMetrics(registry));
            actuator.submit(request("Alpha", 66), Duration.ofMillis(10));
            actuator.submit(request("Beta", 40), Duration.ofMillis(10));
            actuator.start();

            waitFor(() -> actuator.placedCount() == 1, Duration.ofSeconds(2));

            assertEquals(1, actuator.errorCount());
            assertEquals(1, actuator.placedCount());
            assertEquals(List.of("type 40"), device.typed());
            assertEquals(1.0, registry.counter("roundpilot.actions.executed", "success", "false").count());
        }
    }

    @Nested
    @DisplayName("submit")
    class SubmitTests {

        @Test
        @DisplayName("returns false once the channel stays full")
        void fullChannel() {
            actuator = new InputActuator(device, InputActuator.Pacing.none(Duration.ZERO), 1,
                    new RoundpilotMetrics(registry));
            assertTrue(actuator.submit(request("Alpha", 10), Duration.ofMillis(10)));
            assertFalse(actuator.submit(request("Beta", 20), Duration.ofMillis(20)));
            assertEquals(1, actuator.pendingCount());
        }

        @Test
        @DisplayName("rejects requests after stop and discards what was queued")
        void afterStop() {
            actuator = new InputActuator(device, InputActuator.Pacing.none(Duration.ZERO), 5,
                    new RoundpilotMetrics(registry));
            actuator.submit(request("Alpha", 10), Duration.ofMillis(10));
            actuator.stop(Duration.ofSeconds(1));

            assertFalse(actuator.submit(request("Alpha", 20), Duration.ofMillis(10)));
            assertEquals(0, actuator.pendingCount());
            assertTrue(device.steps.isEmpty());
        }

        @Test
        @DisplayName("cannot be started twice")
        void doubleStart() {
            actuator = new InputActuator(device, InputActuator.Pacing.none(Duration.ZERO), 5,
                    new RoundpilotMetrics(registry));
            actuator.start();
            assertThrows(IllegalStateException.class, actuator::start);
        }
    }
}
