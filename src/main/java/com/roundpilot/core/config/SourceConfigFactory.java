package com.roundpilot.core.config;

import com.roundpilot.core.layout.LayoutCatalog;
import com.roundpilot.core.layout.PositionOffset;
import com.roundpilot.core.layout.RegionResolver;
import com.roundpilot.core.model.SourceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Builds validated {@link SourceConfig}s from the bound properties and the layout file.
 * <p>
 * All validation happens here, once, before any worker starts. Any problem
 * raises {@link ConfigException}.
 */
public final class SourceConfigFactory {

    private static final Logger log = LoggerFactory.getLogger(SourceConfigFactory.class);

    private SourceConfigFactory() {}

    public static List<SourceConfig> build(RoundpilotProperties properties, LayoutCatalog catalog) {
        validateGlobals(properties);
        if (properties.getSources().isEmpty()) {
            throw new ConfigException("No sources configured (roundpilot.sources is empty)");
        }

        var seen = new HashSet<String>();
        var configs = new ArrayList<SourceConfig>();
        for (var source : properties.getSources()) {
            if (source.getId() == null || source.getId().isBlank()) {
                throw new ConfigException("Every source needs an id");
            }
            if (!seen.add(source.getId())) {
                throw new ConfigException("Duplicate source id '" + source.getId() + "'");
            }
            configs.add(build(source, properties, catalog));
        }
        return configs;
    }

    static SourceConfig build(RoundpilotProperties.Source source, RoundpilotProperties properties,
                              LayoutCatalog catalog) {
        String id = source.getId();
        if (source.getAutoCashout() <= 1.0) {
            throw new ConfigException("Auto-cashout for '" + id + "' must be greater than 1.0, got "
                    + source.getAutoCashout());
        }
        if (source.getPosition() == null || source.getPosition().isBlank()) {
            throw new ConfigException("Source '" + id + "' has no position");
        }

        var sourceLayout = catalog.source(id);
        PositionOffset offset = catalog.offset(properties.getLayout(), source.getPosition());
        List<Integer> sequence = betSequence(source, properties);

        var config = new SourceConfig(
                id,
                RegionResolver.resolve(sourceLayout.regions(), offset),
                RegionResolver.resolve(sourceLayout.amountField(), offset),
                RegionResolver.resolve(sourceLayout.playButton(), offset),
                sequence,
                source.getAutoCashout(),
                source.getTargetMoney());

        log.info("Source {} at {} ({},{}): sequence {} (max loss {}), auto-cashout {}",
                id, source.getPosition(), offset.left(), offset.top(),
                sequence, config.maxLoss(), source.getAutoCashout());
        return config;
    }

    static List<Integer> betSequence(RoundpilotProperties.Source source, RoundpilotProperties properties) {
        List<Integer> sequence;
        if (source.getBetSequence() != null && !source.getBetSequence().isEmpty()) {
            sequence = source.getBetSequence();
        } else {
            sequence = properties.getBetStyles().get(source.getBetStyle());
            if (sequence == null) {
                throw new ConfigException("Unknown bet style '" + source.getBetStyle() + "' for '"
                        + source.getId() + "'; known styles: " + properties.getBetStyles().keySet());
            }
        }
        Integer length = source.getBetLength();
        if (length != null) {
            if (length < 1) {
                throw new ConfigException("Bet length for '" + source.getId() + "' must be at least 1");
            }
            sequence = sequence.subList(0, Math.min(length, sequence.size()));
        }
        if (sequence.isEmpty()) {
            throw new ConfigException("Bet sequence for '" + source.getId() + "' is empty");
        }
        for (Integer stake : sequence) {
            if (stake == null || stake <= 0) {
                throw new ConfigException("Bet sequence for '" + source.getId()
                        + "' contains a non-positive stake: " + sequence);
            }
        }
        return List.copyOf(sequence);
    }

    private static void validateGlobals(RoundpilotProperties p) {
        requirePositive(p.getActionQueueCapacity(), "action-queue-capacity");
        requirePositive(p.getRecordQueueCapacity(), "record-queue-capacity");
        requirePositive(p.getPersistence().getBatchSize(), "persistence.batch-size");
        requirePositive(p.getPersistence().getBatchTimeoutMs(), "persistence.batch-timeout-ms");
        requirePositive(p.getPersistence().getStatsIntervalSeconds(), "persistence.stats-interval-seconds");
        requirePositive(p.getPollIntervalMs(), "poll-interval-ms");
        requirePositive(p.getBalanceReadAttempts(), "balance-read-attempts");
        requirePositive(p.getWorkerJoinTimeoutMs(), "worker-join-timeout-ms");
        requirePositive(p.getActuator().getStopTimeoutMs(), "actuator.stop-timeout-ms");
        requirePositive(p.getPersistence().getStopTimeoutMs(), "persistence.stop-timeout-ms");
        requireNonNegative(p.getActionEnqueueTimeoutMs(), "action-enqueue-timeout-ms");
        requireNonNegative(p.getBalanceRetryDelayMs(), "balance-retry-delay-ms");

        RoundpilotProperties.Actuator actuator = p.getActuator();
        requireNonNegative(actuator.getCooldownMs(), "actuator.cooldown-ms");
        requireNonNegative(actuator.getClickSettleMs(), "actuator.click-settle-ms");
        requireNonNegative(actuator.getSelectSettleMs(), "actuator.select-settle-ms");
        requireNonNegative(actuator.getKeystrokeIntervalMs(), "actuator.keystroke-interval-ms");
        requireNonNegative(actuator.getTypingSettleMs(), "actuator.typing-settle-ms");
        requireNonNegative(actuator.getPlaySettleMs(), "actuator.play-settle-ms");
    }

    private static void requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new ConfigException("roundpilot." + name + " must not be negative, got " + value);
        }
    }

    private static void requirePositive(long value, String name) {
        if (value < 1) {
            throw new ConfigException("roundpilot." + name + " must be at least 1, got " + value);
        }
    }
}
