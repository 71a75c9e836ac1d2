package com.roundpilot.core.actuator;

import com.roundpilot.core.logging.MdcContext;
import com.roundpilot.core.metrics.RoundpilotMetrics;
import com.roundpilot.core.model.ActionRequest;
import com.roundpilot.core.orchestrator.ShutdownSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single consumer of betting actions and the only writer of pointer and keyboard state.
 * <p>
 * Requests from all sources are queued on one bounded channel and executed strictly in
 * arrival order on a dedicated thread. Each execution is followed by a cooldown before
 * the next request is taken. A failure aborts the current request only: it is counted
 * and the actuator moves on without retrying.
 */
public class InputActuator implements ActionSink {

    private static final Logger log = LoggerFactory.getLogger(InputActuator.class);

    private static final Duration RECEIVE_TIMEOUT = Duration.ofMillis(100);

    /**
     * Delays between the sub-steps of one action and after it.
     */
    public record Pacing(
            Duration clickSettle,
            Duration selectSettle,
            Duration keystrokeInterval,
            Duration typingSettle,
            Duration playSettle,
            Duration cooldown
    ) {
        public static Pacing none(Duration cooldown) {
            return new Pacing(Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, Duration.ZERO, cooldown);
        }
    }

    private final InputDevice device;
    private final Pacing pacing;
    private final BlockingQueue<ActionRequest> queue;
    private final RoundpilotMetrics metrics;
    private final ShutdownSignal stopSignal = new ShutdownSignal();
    private final AtomicLong placed = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    private volatile Thread thread;

    public InputActuator(InputDevice device, Pacing pacing, int capacity, RoundpilotMetrics metrics) {
        this.device = device;
        this.pacing = pacing;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.metrics = metrics;
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Input actuator already started");
        }
        thread = new Thread(this::runLoop, "input-actuator");
        thread.start();
        log.info("Input actuator started (cooldown {} ms, capacity {})",
                pacing.cooldown().toMillis(), queue.remainingCapacity());
    }

    @Override
    public boolean submit(ActionRequest request, Duration timeout) {
        if (stopSignal.isTriggered()) {
            return false;
        }
        try {
            return queue.offer(request, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Stops taking requests and waits for the thread. A request being executed is allowed
     * to finish; queued requests are discarded.
     */
    public void stop(Duration timeout) {
        stopSignal.trigger();
        Thread t = thread;
        if (t != null) {
            try {
                t.join(timeout.toMillis());
                if (t.isAlive()) {
                    log.warn("Input actuator did not stop within {} ms, interrupting", timeout.toMillis());
                    t.interrupt();
                    t.join(timeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        int discarded = queue.size();
        queue.clear();
        if (discarded > 0) {
            log.warn("Discarded {} queued actions on shutdown", discarded);
        }
        log.info("Input actuator stopped. Placed: {}, errors: {}", placed.get(), errors.get());
    }

    private void runLoop() {
        MdcContext.setComponent("actuator");
        try {
            while (!stopSignal.isTriggered()) {
                ActionRequest request;
                try {
                    request = queue.poll(RECEIVE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                if (request == null) {
                    continue;
                }
                execute(request);
                if (stopSignal.await(pacing.cooldown())) {
                    break;
                }
            }
        } finally {
            MdcContext.clear();
        }
    }

    void execute(ActionRequest request) {
        MdcContext.setRequest(request.sourceId(), request.requestId());
        long start = System.nanoTime();
        try {
            log.info("Placing bet of {} for {}", request.stake(), request.sourceId());
            device.click(request.amountField());
            pause(pacing.clickSettle());
            device.selectAll();
            pause(pacing.selectSettle());
            device.type(String.valueOf(request.stake()), pacing.keystrokeInterval());
            pause(pacing.typingSettle());
            device.click(request.playButton());
            pause(pacing.playSettle());

            placed.incrementAndGet();
            metrics.recordActionExecuted(true, elapsedMs(start));
            log.debug("Bet of {} for {} placed", request.stake(), request.sourceId());
        } catch (RuntimeException e) {
            errors.incrementAndGet();
            metrics.recordActionExecuted(false, elapsedMs(start));
            log.error("Action {} for {} aborted: {}", request.requestId(), request.sourceId(), e.getMessage());
        } finally {
            MdcContext.clearRequest();
        }
    }

    private static void pause(Duration duration) {
        if (duration.isZero()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ActuatorAbortedException("Interrupted between input steps", e);
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public long placedCount() {
        return placed.get();
    }

    public long errorCount() {
        return errors.get();
    }

    public int pendingCount() {
        return queue.size();
    }
}
