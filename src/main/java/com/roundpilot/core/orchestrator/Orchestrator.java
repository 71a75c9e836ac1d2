package com.roundpilot.core.orchestrator;

import com.roundpilot.core.actuator.InputActuator;
import com.roundpilot.core.actuator.InputDevice;
import com.roundpilot.core.config.RoundpilotProperties;
import com.roundpilot.core.config.SourceConfigFactory;
import com.roundpilot.core.layout.LayoutCatalog;
import com.roundpilot.core.layout.LayoutLoader;
import com.roundpilot.core.model.SourceConfig;
import com.roundpilot.core.persistence.PersistenceStats;
import com.roundpilot.core.persistence.PersistenceWorker;
import com.roundpilot.core.persistence.RoundStore;
import com.roundpilot.core.phase.NearestCentroidModel;
import com.roundpilot.core.phase.PhaseClassifier;
import com.roundpilot.core.screen.ScreenReader;
import com.roundpilot.core.worker.SourceWorker;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the runtime: the shared channels, the input actuator, the persistence worker and
 * one thread per source.
 * <p>
 * Configuration and the phase model are loaded and validated before any thread starts,
 * so a bad setup fails fast with nothing to undo. Sinks start before producers:
 * persistence, then the actuator, then the source workers. Shutdown runs in strict order:
 * <ol>
 *   <li>signal every source worker to stop polling</li>
 *   <li>stop the input actuator so no further input is sent</li>
 *   <li>join the source workers, interrupting stragglers after the join timeout</li>
 *   <li>stop the persistence worker, which drains what the workers enqueued</li>
 *   <li>release the channels and log final statistics</li>
 * </ol>
 */
@Service
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final RoundpilotProperties properties;
    private final RuntimeFactory factory;
    private final RoundStore store;

    private PersistenceWorker persistence;
    private InputActuator actuator;
    private ShutdownSignal sourceSignal;
    private final List<Thread> sourceThreads = new ArrayList<>();
    private Instant startedAt;
    private boolean running;

    public Orchestrator(RoundpilotProperties properties, RuntimeFactory factory, RoundStore store) {
        this.properties = properties;
        this.factory = factory;
        this.store = store;
    }

    /**
     * Validates configuration, loads the model and starts all components.
     *
     * @throws com.roundpilot.core.config.ConfigException    if the layout or source configuration is invalid
     * @throws com.roundpilot.core.phase.ModelLoadException if the phase model cannot be loaded
     */
    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("Orchestrator already running");
        }
        LayoutCatalog catalog = LayoutLoader.load(Path.of(properties.getLayoutFile()));
        List<SourceConfig> sources = SourceConfigFactory.build(properties, catalog);
        var classifier = new PhaseClassifier(
                NearestCentroidModel.load(Path.of(properties.getModelFile())),
                PhaseClassifier.parseMapping(properties.getPhaseMapping()));
        ScreenReader reader = factory.screenReader();
        InputDevice device = factory.inputDevice();

        startedAt = Instant.now();
        persistence = factory.persistenceWorker(store);
        persistence.start();
        actuator = factory.inputActuator(device);
        actuator.start();

        sourceSignal = new ShutdownSignal();
        for (SourceConfig source : sources) {
            SourceWorker worker = factory.sourceWorker(source, reader, classifier, actuator, persistence, sourceSignal);
            Thread thread = new Thread(worker, "source-" + source.id());
            sourceThreads.add(thread);
            thread.start();
        }
        running = true;
        log.info("Orchestrator started {} sources on layout {}", sources.size(), properties.getLayout());
    }

    /**
     * Runs the ordered shutdown. Safe to call more than once.
     */
    @PreDestroy
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Shutting down {} sources", sourceThreads.size());

        sourceSignal.trigger();
        actuator.stop(Duration.ofMillis(properties.getActuator().getStopTimeoutMs()));
        joinSources(Duration.ofMillis(properties.getWorkerJoinTimeoutMs()));
        persistence.stop(Duration.ofMillis(properties.getPersistence().getStopTimeoutMs()));

        logFinalStats();
        sourceThreads.clear();
    }

    private void joinSources(Duration timeout) {
        for (Thread thread : sourceThreads) {
            try {
                thread.join(timeout.toMillis());
                if (thread.isAlive()) {
                    log.warn("{} did not stop within {} ms, interrupting", thread.getName(), timeout.toMillis());
                    thread.interrupt();
                    thread.join(timeout.toMillis());
                    if (thread.isAlive()) {
                        log.error("{} is still alive after interrupt, abandoning it", thread.getName());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while joining {}", thread.getName());
                return;
            }
        }
    }

    private void logFinalStats() {
        Duration runtime = Duration.between(startedAt, Instant.now());
        PersistenceStats stats = persistence.stats();
        log.info("Final statistics: runtime {}s, sources {}, bets placed {}, bet errors {}",
                runtime.toSeconds(), sourceThreads.size(), actuator.placedCount(), actuator.errorCount());
        log.info("Final persistence: processed {}, batches {}, errors {}, max queue {}",
                stats.processed(), stats.batches(), stats.errors(), stats.maxQueueSize());
    }

    public synchronized boolean isRunning() {
        return running;
    }

    /**
     * Number of source workers still polling. Workers stop on their own when their target is reached.
     */
    public synchronized int activeSourceCount() {
        return (int) sourceThreads.stream().filter(Thread::isAlive).count();
    }

    public synchronized PersistenceStats persistenceStats() {
        return persistence == null ? null : persistence.stats();
    }
}
