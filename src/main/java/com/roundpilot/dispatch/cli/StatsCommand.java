package com.roundpilot.dispatch.cli;

import com.roundpilot.core.persistence.PersistenceWriteException;
import com.roundpilot.core.persistence.RoundStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: roundpilot stats
 * <p>
 * Summarizes stored rounds per source: round count, wins and latest balance.
 */
@Command(name = "stats", mixinStandardHelpOptions = true, description = "Show stored round statistics per source")
@Component
public class StatsCommand implements Callable<Integer> {

    @Option(names = {"--source", "-s"}, description = "Only show this source")
    private String source;

    private final RoundStore roundStore;

    public StatsCommand(RoundStore roundStore) {
        this.roundStore = roundStore;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<RoundStore.SourceSummary> summaries;
        try {
            summaries = roundStore.summarize();
        } catch (PersistenceWriteException e) {
            ConsoleOutput.error("Cannot read round statistics: " + e.getMessage());
            return 1;
        }

        var shown = summaries.stream()
                .filter(s -> source == null || source.equals(s.sourceId()))
                .toList();
        if (shown.isEmpty()) {
            ConsoleOutput.info(source == null ? "No rounds stored yet." : "No rounds stored for " + source + ".");
            return 0;
        }

        long totalRounds = 0;
        long totalWins = 0;
        for (var s : shown) {
            ConsoleOutput.sourceSummary(s.sourceId(), s.rounds(), s.wins(), s.lastBalance());
            totalRounds += s.rounds();
            totalWins += s.wins();
        }
        System.out.println("──────────────────────────────────");
        ConsoleOutput.info(totalRounds + " rounds across " + shown.size()
                + " source" + (shown.size() != 1 ? "s" : "") + ", " + totalWins + " won");
        return 0;
    }
}
