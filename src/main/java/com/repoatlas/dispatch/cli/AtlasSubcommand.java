package com.repoatlas.dispatch.cli;

import com.repoatlas.core.analysis.AnalysisException;
import com.repoatlas.core.gate.GateRecordStore;
import com.repoatlas.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Mixin;

import java.io.UncheckedIOException;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Shared run wrapper: MDC setup and conversion of input and write errors into a
 * structured error result instead of a stack trace.
 */
abstract class AtlasSubcommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AtlasSubcommand.class);

    @Mixin
    CommonOptions common = new CommonOptions();

    protected abstract String commandName();

    protected abstract int execute();

    @Override
    public Integer call() {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId, common.root().toString(), commandName());
        try {
            return execute();
        } catch (AnalysisException e) {
            log.error("{} failed: {}", commandName(), e.getMessage());
            ConsoleOutput.failure(common.json, e.getMessage());
            return ExitCodes.INPUT_ERROR;
        } catch (UncheckedIOException | GateRecordStore.GateStateException e) {
            String cause = e.getCause() != null ? e.getCause().toString() : "";
            log.error("{} failed: {} {}", commandName(), e.getMessage(), cause);
            ConsoleOutput.failure(common.json, e.getMessage() + (cause.isEmpty() ? "" : ": " + cause));
            return ExitCodes.IO_ERROR;
        } finally {
            MdcContext.clear();
        }
    }
}
