package com.repoatlas.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * CLI command group: atlas gate run|status|reset
 */
@Command(
        name = "gate",
        mixinStandardHelpOptions = true,
        description = "Run verification checks behind a consecutive-failure circuit breaker",
        subcommands = {
                GateRunCommand.class,
                GateStatusCommand.class,
                GateResetCommand.class
        }
)
@Component
public class GateCommand implements Runnable {

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }
}
