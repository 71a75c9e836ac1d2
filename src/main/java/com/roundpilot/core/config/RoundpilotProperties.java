package com.roundpilot.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "roundpilot")
public class RoundpilotProperties {

    private String layoutFile = "data/coordinates/layout.json";
    private String layout = "Four_100";
    private String modelFile = "data/models/game_phase_centroids.json";
    /** Phase name for each cluster id the model can emit, indexed by cluster id. */
    private List<String> phaseMapping = new ArrayList<>(List.of(
            "ENDED", "WAITING", "BETTING_READY", "ACTIVE_LOW", "ACTIVE_MID", "ACTIVE_HIGH"));
    private long pollIntervalMs = 200;
    private int actionQueueCapacity = 100;
    private int recordQueueCapacity = 10_000;
    private long actionEnqueueTimeoutMs = 1000;
    private long workerJoinTimeoutMs = 5000;
    private int balanceReadAttempts = 3;
    private long balanceRetryDelayMs = 500;

    private Actuator actuator = new Actuator();
    private Persistence persistence = new Persistence();
    private Map<String, List<Integer>> betStyles = new LinkedHashMap<>(defaultBetStyles());
    private List<Source> sources = new ArrayList<>();

    public String getLayoutFile() { return layoutFile; }
    public void setLayoutFile(String layoutFile) { this.layoutFile = layoutFile; }
    public String getLayout() { return layout; }
    public void setLayout(String layout) { this.layout = layout; }
    public String getModelFile() { return modelFile; }
    public void setModelFile(String modelFile) { this.modelFile = modelFile; }
    public List<String> getPhaseMapping() { return phaseMapping; }
    public void setPhaseMapping(List<String> phaseMapping) { this.phaseMapping = phaseMapping; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public int getActionQueueCapacity() { return actionQueueCapacity; }
    public void setActionQueueCapacity(int actionQueueCapacity) { this.actionQueueCapacity = actionQueueCapacity; }
    public int getRecordQueueCapacity() { return recordQueueCapacity; }
    public void setRecordQueueCapacity(int recordQueueCapacity) { this.recordQueueCapacity = recordQueueCapacity; }
    public long getActionEnqueueTimeoutMs() { return actionEnqueueTimeoutMs; }
    public void setActionEnqueueTimeoutMs(long actionEnqueueTimeoutMs) { this.actionEnqueueTimeoutMs = actionEnqueueTimeoutMs; }
    public long getWorkerJoinTimeoutMs() { return workerJoinTimeoutMs; }
    public void setWorkerJoinTimeoutMs(long workerJoinTimeoutMs) { this.workerJoinTimeoutMs = workerJoinTimeoutMs; }
    public int getBalanceReadAttempts() { return balanceReadAttempts; }
    public void setBalanceReadAttempts(int balanceReadAttempts) { this.balanceReadAttempts = balanceReadAttempts; }
    public long getBalanceRetryDelayMs() { return balanceRetryDelayMs; }
    public void setBalanceRetryDelayMs(long balanceRetryDelayMs) { this.balanceRetryDelayMs = balanceRetryDelayMs; }

    public Actuator getActuator() { return actuator; }
    public void setActuator(Actuator actuator) { this.actuator = actuator; }
    public Persistence getPersistence() { return persistence; }
    public void setPersistence(Persistence persistence) { this.persistence = persistence; }
    public Map<String, List<Integer>> getBetStyles() { return betStyles; }
    public void setBetStyles(Map<String, List<Integer>> betStyles) { this.betStyles = betStyles; }
    public List<Source> getSources() { return sources; }
    public void setSources(List<Source> sources) { this.sources = sources; }

    public static class Actuator {
        private long cooldownMs = 2000;
        private long clickSettleMs = 150;
        private long selectSettleMs = 100;
        private long keystrokeIntervalMs = 50;
        private long typingSettleMs = 200;
        private long playSettleMs = 100;
        private boolean failSafe = true;
        private long stopTimeoutMs = 5000;

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }
        public long getClickSettleMs() { return clickSettleMs; }
        public void setClickSettleMs(long clickSettleMs) { this.clickSettleMs = clickSettleMs; }
        public long getSelectSettleMs() { return selectSettleMs; }
        public void setSelectSettleMs(long selectSettleMs) { this.selectSettleMs = selectSettleMs; }
        public long getKeystrokeIntervalMs() { return keystrokeIntervalMs; }
        public void setKeystrokeIntervalMs(long keystrokeIntervalMs) { this.keystrokeIntervalMs = keystrokeIntervalMs; }
        public long getTypingSettleMs() { return typingSettleMs; }
        public void setTypingSettleMs(long typingSettleMs) { this.typingSettleMs = typingSettleMs; }
        public long getPlaySettleMs() { return playSettleMs; }
        public void setPlaySettleMs(long playSettleMs) { this.playSettleMs = playSettleMs; }
        public boolean isFailSafe() { return failSafe; }
        public void setFailSafe(boolean failSafe) { this.failSafe = failSafe; }
        public long getStopTimeoutMs() { return stopTimeoutMs; }
        public void setStopTimeoutMs(long stopTimeoutMs) { this.stopTimeoutMs = stopTimeoutMs; }
    }

    public static class Persistence {
        private int batchSize = 50;
        private long batchTimeoutMs = 1000;
        private int statsIntervalSeconds = 30;
        private int queueWarningSize = 5000;
        private int queueCriticalSize = 8000;
        private long stopTimeoutMs = 10_000;

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
        public long getBatchTimeoutMs() { return batchTimeoutMs; }
        public void setBatchTimeoutMs(long batchTimeoutMs) { this.batchTimeoutMs = batchTimeoutMs; }
        public int getStatsIntervalSeconds() { return statsIntervalSeconds; }
        public void setStatsIntervalSeconds(int statsIntervalSeconds) { this.statsIntervalSeconds = statsIntervalSeconds; }
        public int getQueueWarningSize() { return queueWarningSize; }
        public void setQueueWarningSize(int queueWarningSize) { this.queueWarningSize = queueWarningSize; }
        public int getQueueCriticalSize() { return queueCriticalSize; }
        public void setQueueCriticalSize(int queueCriticalSize) { this.queueCriticalSize = queueCriticalSize; }
        public long getStopTimeoutMs() { return stopTimeoutMs; }
        public void setStopTimeoutMs(long stopTimeoutMs) { this.stopTimeoutMs = stopTimeoutMs; }
    }

    public static class Source {
        private String id;
        private String position;
        private double autoCashout = 2.35;
        private double targetMoney = 0;
        private String betStyle = "balanced";
        private Integer betLength;
        /** Overrides {@code betStyle} when non-empty. */
        private List<Integer> betSequence = new ArrayList<>();

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }
        public String getPosition() { return position; }
        public void setPosition(String position) { this.position = position; }
        public double getAutoCashout() { return autoCashout; }
        public void setAutoCashout(double autoCashout) { this.autoCashout = autoCashout; }
        public double getTargetMoney() { return targetMoney; }
        public void setTargetMoney(double targetMoney) { this.targetMoney = targetMoney; }
        public String getBetStyle() { return betStyle; }
        public void setBetStyle(String betStyle) { this.betStyle = betStyle; }
        public Integer getBetLength() { return betLength; }
        public void setBetLength(Integer betLength) { this.betLength = betLength; }
        public List<Integer> getBetSequence() { return betSequence; }
        public void setBetSequence(List<Integer> betSequence) { this.betSequence = betSequence; }
    }

    static Map<String, List<Integer>> defaultBetStyles() {
        var styles = new LinkedHashMap<String, List<Integer>>();
        styles.put("cautious", List.of(10, 25, 50, 95, 170, 305, 540, 950, 1660, 2900));
        styles.put("balanced", List.of(15, 30, 65, 125, 220, 395, 700, 1235, 2160, 3770));
        styles.put("risky", List.of(15, 40, 75, 140, 255, 460, 810, 1425, 2490, 4350));
        styles.put("crazy", List.of(20, 50, 100, 190, 340, 610, 1080, 1900, 3320, 5800));
        styles.put("addict", List.of(30, 75, 150, 285, 510, 915, 1620, 2850, 4980, 8700));
        styles.put("all-in", List.of(40, 95, 190, 360, 645, 1160, 2050, 3610, 6310, 11000));
        styles.put("uv", List.of(20, 40, 80, 150, 300, 600, 1200, 2100, 3700, 6600));
        return styles;
    }
}
