package com.repoatlas.dispatch.cli;

import com.repoatlas.core.analysis.AnalysisResult;
import com.repoatlas.core.analysis.ProjectAnalyzer;
import com.repoatlas.core.impact.ImpactAnalyzer;
import com.repoatlas.core.impact.ImpactReport;
import com.repoatlas.core.metrics.AtlasMetrics;
import com.repoatlas.core.model.Cycle;
import com.repoatlas.core.vcs.ChangeSet;
import com.repoatlas.core.vcs.ChangeSetProvider;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: atlas impact
 * <p>
 * Computes the blast radius of a change set. Without --changed the change set comes
 * from version control: staged, then unstaged, then the last commit.
 */
@Command(name = "impact", mixinStandardHelpOptions = true, description = "Compute the blast radius of changed files")
@Component
public class ImpactCommand extends AtlasSubcommand {

    private final ProjectAnalyzer analyzer;
    private final ImpactAnalyzer impactAnalyzer;
    private final ChangeSetProvider changeSets;
    private final AtlasMetrics metrics;

    @Option(names = {"-c", "--changed"}, split = ",", description = "Changed files, relative to the root")
    List<String> changed;

    @Option(names = {"-d", "--depth"}, description = "Maximum number of edges to follow (default: unbounded)")
    Integer depth;

    public ImpactCommand(ProjectAnalyzer analyzer, ImpactAnalyzer impactAnalyzer,
                         ChangeSetProvider changeSets, AtlasMetrics metrics) {
        this.analyzer = analyzer;
        this.impactAnalyzer = impactAnalyzer;
        this.changeSets = changeSets;
        this.metrics = metrics;
    }

    @Override
    protected String commandName() {
        return "impact";
    }

    @Override
    protected int execute() {
        AnalysisResult result = analyzer.analyze(common.root(), common.includeTests);
        ChangeSet changeSet = changed != null && !changed.isEmpty()
                ? ChangeSet.explicit(changed)
                : changeSets.changedFiles(common.root());
        ImpactReport report = impactAnalyzer.analyze(result.graph(), changeSet.files(), depth);
        metrics.recordBlastRadius(report.size(), report.escalate());

        if (common.json) {
            ConsoleOutput.json(toJson(changeSet, report));
            return ExitCodes.OK;
        }

        ConsoleOutput.info("Change set (" + changeSet.source().name().toLowerCase() + "): "
                + (changeSet.files().isEmpty() ? "none" : String.join(", ", changeSet.files())));
        ConsoleOutput.heading("Blast radius: " + report.size() + " module(s), impact " + report.level());
        report.blastRadius().distance().forEach((module, distance) ->
                ConsoleOutput.line("  " + module + " (distance " + distance + ")"));
        if (report.escalate()) {
            ConsoleOutput.warn("Blast radius exceeds the escalation threshold; review required");
        }
        if (!report.cycles().isEmpty()) {
            ConsoleOutput.heading("Circular dependencies: " + report.cycles().size());
            for (Cycle cycle : report.cycles()) {
                ConsoleOutput.cycle(cycle);
            }
        }
        report.warnings().forEach(ConsoleOutput::warn);
        return ExitCodes.OK;
    }

    static Map<String, Object> toJson(ChangeSet changeSet, ImpactReport report) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("source", changeSet.source().name().toLowerCase());
        json.put("changed_files", report.changedFiles());
        json.put("unknown_files", report.unknownFiles());
        json.put("affected", report.blastRadius().affected());
        json.put("distance", report.blastRadius().distance());
        json.put("direct_dependents", report.blastRadius().direct());
        json.put("size", report.size());
        json.put("escalate", report.escalate());
        json.put("level", report.level());
        json.put("cycles", report.cycles());
        json.put("warnings", report.warnings());
        return json;
    }
}
