package com.repoatlas.dispatch.cli;

import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.gate.GateRecordStore;
import com.repoatlas.core.model.GateRecord;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CLI command: atlas gate status
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show the persisted gate record")
@Component
public class GateStatusCommand extends AtlasSubcommand {

    private final GateRecordStore store;
    private final AtlasProperties properties;

    public GateStatusCommand(GateRecordStore store, AtlasProperties properties) {
        this.store = store;
        this.properties = properties;
    }

    @Override
    protected String commandName() {
        return "gate status";
    }

    @Override
    protected int execute() {
        GateRecord record = store.load(common.root());
        int threshold = properties.getGate().getFailureThreshold();
        boolean open = record.consecutiveFailures() >= threshold;

        if (common.json) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("state_file", store.statePath(common.root()).toString());
            json.put("record", record);
            json.put("threshold", threshold);
            json.put("circuit_open", open);
            ConsoleOutput.json(json);
            return ExitCodes.OK;
        }

        ConsoleOutput.info("Last outcome: " + record.lastOutcome().name().toLowerCase()
                + (record.lastRunAt() != null ? " at " + record.lastRunAt() : ""));
        ConsoleOutput.info("Consecutive failures: " + record.consecutiveFailures() + "/" + threshold);
        if (open) {
            ConsoleOutput.warn("Circuit open: the next run halts until 'atlas gate reset'");
        }
        return ExitCodes.OK;
    }
}
