package com.repoatlas.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Repo Atlas.
 * Routes to subcommands: graph, signals, impact, gate, profile.
 */
@Command(
        name = "atlas",
        mixinStandardHelpOptions = true,
        version = "Repo Atlas 0.1.0",
        description = "Dependency graph, change impact and gate decisions for a source tree",
        subcommands = {
                GraphCommand.class,
                SignalsCommand.class,
                ImpactCommand.class,
                GateCommand.class,
                ProfileCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AtlasCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
