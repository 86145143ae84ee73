package com.repoatlas.dispatch.cli;

import com.repoatlas.core.analysis.AnalysisResult;
import com.repoatlas.core.analysis.ProjectAnalyzer;
import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.gate.CheckDetector;
import com.repoatlas.core.gate.GateContext;
import com.repoatlas.core.gate.GateRunner;
import com.repoatlas.core.impact.ImpactAnalyzer;
import com.repoatlas.core.impact.ImpactReport;
import com.repoatlas.core.model.CheckResult;
import com.repoatlas.core.model.GateDecision;
import com.repoatlas.core.vcs.ChangeSetProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: atlas gate run
 * <p>
 * Exit code 0 when the gate passed or was bypassed, 1 when a check blocked, 2 when the
 * circuit breaker is open.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run lint, test and secret-scan checks")
@Component
public class GateRunCommand extends AtlasSubcommand {

    private final GateRunner runner;
    private final CheckDetector detector;
    private final AtlasProperties properties;
    private final ProjectAnalyzer analyzer;
    private final ImpactAnalyzer impactAnalyzer;
    private final ChangeSetProvider changeSets;

    @Option(names = "--threshold", description = "Consecutive failures before the gate halts")
    Integer threshold;

    @Option(names = "--bypass", description = "Record a bypass and skip all checks")
    boolean bypass;

    @Option(names = "--with-impact", description = "Attach the change set's blast radius to the decision")
    boolean withImpact;

    @Option(names = {"-c", "--changed"}, split = ",", description = "Changed files for --with-impact")
    List<String> changed;

    public GateRunCommand(GateRunner runner, CheckDetector detector, AtlasProperties properties,
                          ProjectAnalyzer analyzer, ImpactAnalyzer impactAnalyzer, ChangeSetProvider changeSets) {
        this.runner = runner;
        this.detector = detector;
        this.properties = properties;
        this.analyzer = analyzer;
        this.impactAnalyzer = impactAnalyzer;
        this.changeSets = changeSets;
    }

    @Override
    protected String commandName() {
        return "gate run";
    }

    @Override
    protected int execute() {
        Path root = common.root();
        int failureThreshold = threshold != null ? threshold : properties.getGate().getFailureThreshold();
        if (failureThreshold < 1) {
            ConsoleOutput.failure(common.json, "--threshold must be at least 1, got " + failureThreshold);
            return ExitCodes.INPUT_ERROR;
        }

        Integer blastRadius = null;
        if (withImpact) {
            AnalysisResult analysis = analyzer.analyze(root, common.includeTests);
            List<String> files = changed != null && !changed.isEmpty()
                    ? changed
                    : changeSets.changedFiles(root).files();
            ImpactReport report = impactAnalyzer.analyze(analysis.graph(), files, null);
            blastRadius = report.size();
        }

        CheckDetector.DetectedChecks detected = detector.detect(root);
        GateContext context = new GateContext(failureThreshold, bypass, blastRadius,
                properties.getImpact().getEscalationThreshold());
        GateDecision decision = runner.run(root, detected.checks(), context);

        if (common.json) {
            ConsoleOutput.json(decision);
        } else {
            detected.notes().forEach(ConsoleOutput::info);
            for (CheckResult check : decision.checks()) {
                ConsoleOutput.check(check);
            }
            ConsoleOutput.gateDecision(decision);
            if (decision.escalate()) {
                ConsoleOutput.warn("Blast radius " + blastRadius + " exceeds the escalation threshold");
            }
        }
        return exitCodeFor(decision);
    }

    static int exitCodeFor(GateDecision decision) {
        return switch (decision.outcome()) {
            case PASSED, BYPASSED -> ExitCodes.OK;
            case HALTED -> ExitCodes.GATE_HALTED;
            default -> ExitCodes.GATE_FAILED;
        };
    }
}
