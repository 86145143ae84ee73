package com.repoatlas.dispatch.cli;

import com.repoatlas.core.gate.GateRecordStore;
import com.repoatlas.core.model.GateRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.time.Clock;

/**
 * CLI command: atlas gate reset
 */
@Command(name = "reset", mixinStandardHelpOptions = true, description = "Clear the failure counter")
@Component
public class GateResetCommand extends AtlasSubcommand {

    private final GateRecordStore store;
    private final Clock clock;

    public GateResetCommand(GateRecordStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    protected String commandName() {
        return "gate reset";
    }

    @Override
    protected int execute() {
        GateRecord record = store.reset(common.root(), clock.instant());
        if (common.json) {
            ConsoleOutput.json(record);
        } else {
            ConsoleOutput.success("Gate reset: failure counter cleared");
        }
        return ExitCodes.OK;
    }
}
