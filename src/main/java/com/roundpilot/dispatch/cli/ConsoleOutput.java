package com.roundpilot.dispatch.cli;

import com.roundpilot.core.events.RoundEvent;
import picocli.CommandLine;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the roundpilot CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ROUNDPILOT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ROUNDPILOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * One line of the live feed printed by {@code run}.
     */
    public static void roundEvent(RoundEvent event) {
        String prefix = switch (event.eventType()) {
            case RoundEvent.SOURCE_STARTED, RoundEvent.SOURCE_STOPPED -> "@|fg(cyan) [SOURCE]|@";
            case RoundEvent.PHASE_CHANGED -> "@|fg(white) [PHASE]|@";
            case RoundEvent.BET_REQUESTED -> "@|fg(blue) [BET]|@";
            case RoundEvent.BET_DROPPED, RoundEvent.RECORD_DROPPED -> "@|fg(red) [DROPPED]|@";
            case RoundEvent.ROUND_ENDED -> Boolean.TRUE.equals(event.payload().get("win"))
                    ? "@|fg(green),bold [WIN]|@"
                    : "@|fg(red),bold [LOSS]|@";
            case RoundEvent.TARGET_REACHED -> "@|bold,fg(yellow) [TARGET]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + event.sourceId() + " " + formatPayload(event.payload())));
    }

    public static void sourceSummary(String sourceId, long rounds, long wins, double lastBalance) {
        String rate = rounds == 0 ? "-" : String.format("%.1f%%", wins * 100.0 / rounds);
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(
                "  @|bold %-16s|@ %6d rounds  @|fg(green) %6d won|@  %7s  balance %.2f",
                sourceId, rounds, wins, rate, lastBalance)));
    }

    static String formatPayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "";
        }
        return payload.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }

    static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
