package com.repoatlas.dispatch.cli;

import com.repoatlas.core.analysis.AnalysisResult;
import com.repoatlas.core.analysis.ProjectAnalyzer;
import com.repoatlas.core.model.DataModel;
import com.repoatlas.core.model.RouteEntry;
import com.repoatlas.core.model.SignalCategory;
import com.repoatlas.core.signals.FileSignals;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CLI command: atlas signals
 * <p>
 * Lists technology signals with the files reporting them, plus routes and data models.
 */
@Command(name = "signals", mixinStandardHelpOptions = true, description = "Detect technology-stack signals, routes and data models")
@Component
public class SignalsCommand extends AtlasSubcommand {

    private final ProjectAnalyzer analyzer;

    public SignalsCommand(ProjectAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    protected String commandName() {
        return "signals";
    }

    @Override
    protected int execute() {
        AnalysisResult result = analyzer.analyze(common.root(), common.includeTests);
        List<RouteEntry> routes = result.files().stream().flatMap(f -> f.routes().stream()).toList();
        List<DataModel> models = result.files().stream().flatMap(f -> f.models().stream()).toList();

        if (common.json) {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("signals", result.signals().asMap());
            json.put("routes", routes);
            json.put("models", models);
            json.put("barrels", result.files().stream().filter(FileSignals::barrel).map(FileSignals::path).toList());
            json.put("warnings", result.warnings());
            ConsoleOutput.json(json);
            return ExitCodes.OK;
        }

        if (result.signals().isEmpty()) {
            ConsoleOutput.info("No technology signals detected");
        }
        for (SignalCategory category : SignalCategory.values()) {
            var values = result.signals().values(category);
            if (values.isEmpty()) {
                continue;
            }
            ConsoleOutput.heading(category.label());
            values.forEach((value, files) ->
                    ConsoleOutput.line("  " + value + " (" + files.size() + " file" + (files.size() != 1 ? "s" : "") + ")"));
        }
        if (!routes.isEmpty()) {
            ConsoleOutput.heading("Routes");
            routes.forEach(r -> ConsoleOutput.line("  " + r.method() + " " + r.path() + " -> " + r.handler() + " (" + r.file() + ")"));
        }
        if (!models.isEmpty()) {
            ConsoleOutput.heading("Data Models");
            models.forEach(m -> ConsoleOutput.line("  " + m.name() + " [" + m.type() + "] " + String.join(", ", m.fields())));
        }
        result.warnings().forEach(ConsoleOutput::warn);
        return ExitCodes.OK;
    }
}
