package com.roundpilot.dispatch.cli;

import com.roundpilot.core.config.ConfigException;
import com.roundpilot.core.events.EventBus;
import com.roundpilot.core.events.FeedFilter;
import com.roundpilot.core.orchestrator.Orchestrator;
import com.roundpilot.core.persistence.PersistenceStats;
import com.roundpilot.core.phase.ModelLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: roundpilot run
 * <p>
 * Starts every configured source and blocks until interrupted (Ctrl+C), until
 * {@code --duration} elapses, or until every source has stopped on its own.
 * Exit code 2 means the configuration or phase model was rejected.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Start monitoring and betting on all sources")
@Component
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_STARTUP_FAILURE = 1;
    static final int EXIT_INVALID_SETUP = 2;

    @Option(names = {"--duration", "-d"},
            description = "Stop after this many seconds (default: run until interrupted)")
    private Long durationSeconds;

    @Option(names = {"--quiet", "-q"}, description = "Do not print the live event feed")
    private boolean quiet;

    @Option(names = {"--source", "-s"},
            description = "Only show feed events from this source (repeatable)")
    private List<String> feedSources = new ArrayList<>();

    @Option(names = "--no-phases", description = "Leave phase changes out of the feed")
    private boolean noPhases;

    private final Orchestrator orchestrator;
    private final EventBus eventBus;

    public RunCommand(Orchestrator orchestrator, EventBus eventBus) {
        this.orchestrator = orchestrator;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        EventBus.Subscription feed = quiet ? null : eventBus.subscribe(feedFilter(), ConsoleOutput::roundEvent);
        try {
            try {
                orchestrator.start();
            } catch (ConfigException | ModelLoadException e) {
                ConsoleOutput.error("Invalid setup: " + e.getMessage());
                return EXIT_INVALID_SETUP;
            } catch (RuntimeException e) {
                log.error("Startup failed", e);
                ConsoleOutput.error("Startup failed: " + e.getMessage());
                return EXIT_STARTUP_FAILURE;
            }
            ConsoleOutput.info("Running. Press Ctrl+C to stop.");

            long started = System.nanoTime();
            var stopRequested = new CountDownLatch(1);
            Thread hook = new Thread(() -> {
                stopRequested.countDown();
                orchestrator.shutdown();
            }, "roundpilot-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            try {
                waitForStop(stopRequested);
            } finally {
                orchestrator.shutdown();
                removeHook(hook);
            }
            ConsoleOutput.success("Stopped after " + ConsoleOutput.formatDuration(
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)));
            printPersistenceSummary();
            return 0;
        } finally {
            if (feed != null) {
                feed.unsubscribe();
            }
        }
    }

    FeedFilter feedFilter() {
        FeedFilter filter = feedSources.isEmpty() ? FeedFilter.everything() : FeedFilter.forSources(feedSources);
        return noPhases ? filter.withoutPhaseChanges() : filter;
    }

    private void printPersistenceSummary() {
        PersistenceStats stats = orchestrator.persistenceStats();
        if (stats == null) {
            return;
        }
        String line = String.format("Stored %d rounds in %d batches", stats.processed(), stats.batches());
        if (stats.errors() > 0) {
            ConsoleOutput.error(line + ", " + stats.errors() + " rounds lost to write failures");
        } else {
            ConsoleOutput.info(line);
        }
    }

    private void waitForStop(CountDownLatch stopRequested) {
        long deadline = durationSeconds == null
                ? Long.MAX_VALUE
                : System.nanoTime() + Duration.ofSeconds(durationSeconds).toNanos();
        try {
            while (orchestrator.activeSourceCount() > 0 && System.nanoTime() < deadline) {
                if (stopRequested.await(1, TimeUnit.SECONDS)) {
                    return;
                }
            }
            if (orchestrator.activeSourceCount() == 0) {
                ConsoleOutput.info("All sources have stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM is already shutting down; the hook is running.
            log.debug("Shutdown in progress, hook not removed");
        }
    }
}
