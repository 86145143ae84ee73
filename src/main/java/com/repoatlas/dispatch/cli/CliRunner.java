package com.repoatlas.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final AtlasCommand atlasCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(AtlasCommand atlasCommand, IFactory factory) {
        this.atlasCommand = atlasCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine(atlasCommand, factory).execute(args);
    }

    /** Usage errors map to the input-error code so they never read as a halted gate. */
    static CommandLine commandLine(AtlasCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setExitCodeExceptionMapper(e -> e instanceof CommandLine.ParameterException
                        ? ExitCodes.INPUT_ERROR
                        : CommandLine.ExitCode.SOFTWARE);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
