package com.roundpilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for roundpilot.
 * Routes to subcommands: run, health, stats.
 */
@Command(
        name = "roundpilot",
        mixinStandardHelpOptions = true,
        version = "Roundpilot 0.1.0",
        description = "Monitors live round-based game sources and automates betting per round",
        subcommands = {
                RunCommand.class,
                HealthCommand.class,
                StatsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class RoundpilotCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
