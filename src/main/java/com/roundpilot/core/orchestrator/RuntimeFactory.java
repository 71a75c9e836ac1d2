package com.roundpilot.core.orchestrator;

import com.roundpilot.core.actuator.ActionSink;
import com.roundpilot.core.actuator.InputActuator;
import com.roundpilot.core.actuator.InputDevice;
import com.roundpilot.core.actuator.RobotInputDevice;
import com.roundpilot.core.config.RoundpilotProperties;
import com.roundpilot.core.events.EventBus;
import com.roundpilot.core.metrics.RoundpilotMetrics;
import com.roundpilot.core.model.SourceConfig;
import com.roundpilot.core.persistence.PersistenceWorker;
import com.roundpilot.core.persistence.RecordSink;
import com.roundpilot.core.persistence.RoundStore;
import com.roundpilot.core.phase.PhaseClassifier;
import com.roundpilot.core.screen.RobotScreenReader;
import com.roundpilot.core.screen.ScreenReader;
import com.roundpilot.core.screen.TextRecognizer;
import com.roundpilot.core.worker.SourceWorker;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds the runtime components from configuration. Devices are only touched when a
 * run actually starts, so commands that never start the runtime work on headless hosts.
 */
@Component
public class RuntimeFactory {

    private final RoundpilotProperties properties;
    private final ObjectProvider<TextRecognizer> textRecognizer;
    private final EventBus eventBus;
    private final RoundpilotMetrics metrics;

    public RuntimeFactory(RoundpilotProperties properties,
                          ObjectProvider<TextRecognizer> textRecognizer,
                          EventBus eventBus,
                          RoundpilotMetrics metrics) {
        this.properties = properties;
        this.textRecognizer = textRecognizer;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public ScreenReader screenReader() {
        return RobotScreenReader.create(textRecognizer.getIfAvailable());
    }

    public InputDevice inputDevice() {
        return RobotInputDevice.create(properties.getActuator().isFailSafe());
    }

    public PersistenceWorker persistenceWorker(RoundStore store) {
        var p = properties.getPersistence();
        var settings = new PersistenceWorker.Settings(
                p.getBatchSize(),
                Duration.ofMillis(p.getBatchTimeoutMs()),
                Duration.ofSeconds(p.getStatsIntervalSeconds()),
                p.getQueueWarningSize(),
                p.getQueueCriticalSize());
        return new PersistenceWorker(store, properties.getRecordQueueCapacity(), settings, metrics);
    }

    public InputActuator inputActuator(InputDevice device) {
        var a = properties.getActuator();
        var pacing = new InputActuator.Pacing(
                Duration.ofMillis(a.getClickSettleMs()),
                Duration.ofMillis(a.getSelectSettleMs()),
                Duration.ofMillis(a.getKeystrokeIntervalMs()),
                Duration.ofMillis(a.getTypingSettleMs()),
                Duration.ofMillis(a.getPlaySettleMs()),
                Duration.ofMillis(a.getCooldownMs()));
        return new InputActuator(device, pacing, properties.getActionQueueCapacity(), metrics);
    }

    public SourceWorker sourceWorker(SourceConfig config,
                                     ScreenReader reader,
                                     PhaseClassifier classifier,
                                     ActionSink actions,
                                     RecordSink records,
                                     ShutdownSignal shutdown) {
        var settings = new SourceWorker.Settings(
                Duration.ofMillis(properties.getPollIntervalMs()),
                Duration.ofMillis(properties.getActionEnqueueTimeoutMs()),
                properties.getBalanceReadAttempts(),
                Duration.ofMillis(properties.getBalanceRetryDelayMs()));
        return new SourceWorker(config, reader, classifier, actions, records,
                eventBus, metrics, shutdown, settings);
    }
}
