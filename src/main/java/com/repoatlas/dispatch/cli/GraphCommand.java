package com.repoatlas.dispatch.cli;

import com.repoatlas.core.analysis.AnalysisResult;
import com.repoatlas.core.analysis.ProjectAnalyzer;
import com.repoatlas.core.graph.ModuleGraph;
import com.repoatlas.core.model.Module;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: atlas graph
 * <p>
 * Prints the module dependency graph with resolution statistics.
 */
@Command(name = "graph", mixinStandardHelpOptions = true, description = "Build and print the module dependency graph")
@Component
public class GraphCommand extends AtlasSubcommand {

    private final ProjectAnalyzer analyzer;

    @Option(names = "--boundaries", description = "Print logical module boundaries instead of files")
    boolean boundaries;

    public GraphCommand(ProjectAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    protected String commandName() {
        return "graph";
    }

    @Override
    protected int execute() {
        AnalysisResult result = analyzer.analyze(common.root(), common.includeTests);
        ModuleGraph graph = result.graph();

        if (common.json) {
            ConsoleOutput.json(toJson(result));
            return ExitCodes.OK;
        }

        ConsoleOutput.info("Graph: " + graph.modules().size() + " modules, " + graph.edges().size()
                + " edges, " + graph.unresolvedCount() + " unresolved references");
        if (boundaries) {
            graph.boundaryGraph().forEach((module, targets) ->
                    ConsoleOutput.line("  " + module + (targets.isEmpty() ? "" : " -> " + String.join(", ", targets))));
        } else {
            for (Module module : graph.modules().values()) {
                var deps = graph.dependenciesOf(module.path());
                ConsoleOutput.line("  " + module.path() + (module.barrel() ? " [barrel]" : "")
                        + (deps.isEmpty() ? "" : " -> " + String.join(", ", deps)));
            }
        }
        result.warnings().forEach(ConsoleOutput::warn);
        return ExitCodes.OK;
    }

    static Map<String, Object> toJson(AnalysisResult result) {
        ModuleGraph graph = result.graph();
        List<Map<String, Object>> modules = new ArrayList<>();
        for (Module module : graph.modules().values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("path", module.path());
            entry.put("logical_name", module.logicalName());
            entry.put("category", module.category());
            entry.put("language", module.language());
            entry.put("lines", module.lines());
            entry.put("barrel", module.barrel());
            entry.put("dependencies", graph.dependenciesOf(module.path()));
            modules.add(entry);
        }
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("root", result.root().toString());
        json.put("modules", modules);
        json.put("edges", graph.edges());
        json.put("boundaries", graph.boundaryGraph());
        json.put("unresolved_count", graph.unresolvedCount());
        json.put("unresolved_sample", graph.unresolvedSample());
        json.put("warnings", result.warnings());
        return json;
    }
}
