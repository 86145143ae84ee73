package com.repoatlas.core.profile;

import com.repoatlas.core.analysis.AnalysisResult;
import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.graph.ModuleGraph;
import com.repoatlas.core.impact.ImpactAnalyzer;
import com.repoatlas.core.model.Cycle;
import com.repoatlas.core.model.DataModel;
import com.repoatlas.core.model.Module;
import com.repoatlas.core.model.RouteEntry;
import com.repoatlas.core.model.SignalCategory;
import com.repoatlas.core.signals.FileCategorizer;
import com.repoatlas.core.signals.FileSignals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Builds the size-bounded project profile and its module maps from an analysis result.
 * Sections are filled in priority order; lower-priority sections give way first when
 * the budget runs out.
 */
@Service
public class ProfileSummarizer {

    private static final Logger log = LoggerFactory.getLogger(ProfileSummarizer.class);

    private final AtlasProperties.Profile config;
    private final ImpactAnalyzer impactAnalyzer;

    public ProfileSummarizer(AtlasProperties properties, ImpactAnalyzer impactAnalyzer) {
        this.config = properties.getProfile();
        this.impactAnalyzer = impactAnalyzer;
    }

    public ProfileResult summarize(AnalysisResult analysis) {
        return summarize(analysis, config.getBudgetChars());
    }

    public ProfileResult summarize(AnalysisResult analysis, int budget) {
        ModuleGraph graph = analysis.graph();
        List<Cycle> cycles = impactAnalyzer.detectCycles(graph);
        List<DirectoryStats> directories = DirectoryStats.rank(analysis.files());

        var drafts = new ArrayList<SectionDraft>();
        drafts.add(header(analysis));
        drafts.add(techStack(analysis));
        drafts.add(SectionDraft.items("Key Files", keyFiles(graph, directories, analysis.files()), config.getMaxKeyFiles()));
        drafts.add(SectionDraft.items("Circular Dependencies", cycleLines(cycles), config.getMaxCycles()));
        drafts.add(SectionDraft.items("Data Models", modelLines(analysis.files()), config.getMaxDataModels()));
        drafts.add(SectionDraft.items("API Surface", routeLines(analysis.files()), config.getMaxRoutes()));
        drafts.add(SectionDraft.items("Module Dependencies", boundaryLines(graph), config.getMaxModuleLinks()));
        drafts.add(SectionDraft.items("Directory Map", directoryLines(directories), config.getMaxDirectories()));

        var notes = new ArrayList<String>();
        if (graph.unresolvedCount() > 0) {
            notes.add(graph.unresolvedCount() + " unresolved reference(s) dropped from the graph");
        }
        if (!analysis.warnings().isEmpty()) {
            notes.add(analysis.warnings().size() + " scan warning(s); first: " + analysis.warnings().get(0));
        }

        Profile main = BudgetAllocator.allocate(rootName(analysis), drafts, notes, budget);
        List<Profile> maps = moduleMaps(analysis);
        log.info("Profile built: {} of {} chars, {} section(s), {} omitted, {} module map(s)",
                main.chars(), budget, main.sections().size(), main.omitted().size(), maps.size());
        return new ProfileResult(main, maps);
    }

    private SectionDraft header(AnalysisResult analysis) {
        ModuleGraph graph = analysis.graph();
        int totalLines = analysis.files().stream().mapToInt(FileSignals::lines).sum();
        Map<String, Long> languages = graph.modules().values().stream()
                .collect(Collectors.groupingBy(Module::language, TreeMap::new, Collectors.counting()));
        String languageLine = languages.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .map(e -> e.getKey() + " (" + e.getValue() + ")")
                .collect(Collectors.joining(", "));
        var lines = new ArrayList<String>();
        lines.add("Files: " + analysis.files().size() + " scanned, " + graph.modules().size() + " source modules, "
                + totalLines + " lines");
        lines.add("Graph: " + graph.edges().size() + " dependencies, " + graph.boundaryGraph().size() + " logical modules");
        if (!languageLine.isEmpty()) {
            lines.add("Languages: " + languageLine);
        }
        return SectionDraft.fixed(1, "Project Profile: " + rootName(analysis), lines);
    }

    private SectionDraft techStack(AnalysisResult analysis) {
        var lines = new ArrayList<String>();
        for (SignalCategory category : SignalCategory.values()) {
            var values = analysis.signals().values(category);
            if (values.isEmpty()) {
                continue;
            }
            String rendered = values.entrySet().stream()
                    .map(e -> e.getKey() + " " + examples(e.getValue()))
                    .collect(Collectors.joining("; "));
            lines.add("- " + category.label() + ": " + rendered);
        }
        return SectionDraft.items("Tech Stack", lines, lines.size());
    }

    private String examples(SortedSet<String> files) {
        int limit = config.getExampleFilesPerSignal();
        String shown = files.stream().limit(limit).collect(Collectors.joining(", "));
        return "(" + shown + (files.size() > limit ? ", +" + (files.size() - limit) : "") + ")";
    }

    private List<String> keyFiles(ModuleGraph graph, List<DirectoryStats> directories, List<FileSignals> files) {
        Map<String, List<FileSignals>> byDirectory = new LinkedHashMap<>();
        for (FileSignals file : files) {
            if (!file.category().isCode() || file.barrel() || FileCategorizer.isStyle(file.extension())) {
                continue;
            }
            byDirectory.computeIfAbsent(DirectoryStats.directoryOf(file.path()), d -> new ArrayList<>()).add(file);
        }
        var lines = new ArrayList<String>();
        for (DirectoryStats directory : directories) {
            List<FileSignals> inDirectory = byDirectory.getOrDefault(directory.path(), List.of());
            inDirectory.stream()
                    .sorted(Comparator.comparingInt(FileSignals::lines).reversed().thenComparing(FileSignals::path))
                    .forEach(file -> lines.add("- " + file.path() + " (" + file.lines() + " lines, "
                            + graph.dependentsOf(file.path()).size() + " dependents)"));
        }
        return lines;
    }

    private static List<String> cycleLines(List<Cycle> cycles) {
        var lines = new ArrayList<String>();
        for (Cycle cycle : cycles) {
            String closed = String.join(" -> ", cycle.modules()) + " -> " + cycle.modules().get(0);
            if (cycle.kind() == Cycle.Kind.DIRECT) {
                lines.add("- Direct cycle: " + closed);
            } else {
                lines.add("- Indirect chain (" + cycle.length() + " modules): " + closed);
            }
        }
        return lines;
    }

    private List<String> modelLines(List<FileSignals> files) {
        var lines = new ArrayList<String>();
        int maxFields = config.getMaxFieldsPerModel();
        files.stream()
                .flatMap(f -> f.models().stream())
                .sorted(Comparator.comparing(DataModel::name).thenComparing(DataModel::file))
                .forEach(model -> {
                    List<String> fields = model.fields();
                    String shown = fields.stream().limit(maxFields).collect(Collectors.joining(", "));
                    String more = fields.size() > maxFields ? ", ... (+" + (fields.size() - maxFields) + ")" : "";
                    lines.add("- " + model.name() + " (" + model.type() + ", " + model.file() + ")"
                            + (fields.isEmpty() ? "" : ": " + shown + more));
                });
        return lines;
    }

    private static List<String> routeLines(List<FileSignals> files) {
        var lines = new ArrayList<String>();
        for (FileSignals file : files) {
            for (RouteEntry route : file.routes()) {
                lines.add("- " + route.method() + " " + route.path() + " -> " + route.handler() + " (" + route.file() + ")");
            }
        }
        return lines;
    }

    private static List<String> boundaryLines(ModuleGraph graph) {
        var lines = new ArrayList<String>();
        graph.boundaryGraph().forEach((module, targets) -> {
            if (!targets.isEmpty()) {
                lines.add("- " + module + " -> " + String.join(", ", targets));
            }
        });
        return lines;
    }

    private static List<String> directoryLines(List<DirectoryStats> directories) {
        return directories.stream()
                .map(d -> "- " + (d.path().isEmpty() ? "." : d.path()) + " (" + d.totalFiles() + " files, "
                        + Math.round(d.sourceRatio() * 100) + "% source)")
                .toList();
    }

    private List<Profile> moduleMaps(AnalysisResult analysis) {
        ModuleGraph graph = analysis.graph();
        Map<String, List<Module>> byTopLevel = new TreeMap<>();
        for (Module module : graph.modules().values()) {
            int slash = module.path().indexOf('/');
            if (slash > 0) {
                byTopLevel.computeIfAbsent(module.path().substring(0, slash), k -> new ArrayList<>()).add(module);
            }
        }
        List<Map.Entry<String, List<Module>>> ranked = byTopLevel.entrySet().stream()
                .filter(e -> e.getValue().size() >= config.getMinModuleMapFiles())
                .sorted(Comparator.comparingInt((Map.Entry<String, List<Module>> e) -> e.getValue().size()).reversed()
                        .thenComparing(Map.Entry::getKey))
                .limit(config.getMaxModuleMaps())
                .toList();

        var maps = new ArrayList<Profile>();
        for (Map.Entry<String, List<Module>> entry : ranked) {
            maps.add(moduleMap(entry.getKey(), entry.getValue(), graph, analysis.files()));
        }
        return maps;
    }

    private Profile moduleMap(String directory, List<Module> modules, ModuleGraph graph, List<FileSignals> files) {
        var importsFrom = new TreeSet<String>();
        var importedBy = new TreeSet<String>();
        for (Module module : modules) {
            for (String target : graph.dependenciesOf(module.path())) {
                String top = topLevel(target);
                if (!top.equals(directory)) importsFrom.add(top);
            }
            for (String source : graph.dependentsOf(module.path())) {
                String top = topLevel(source);
                if (!top.equals(directory)) importedBy.add(top);
            }
        }
        List<String> keyFiles = modules.stream()
                .filter(m -> !m.barrel())
                .sorted(Comparator.comparingInt(Module::lines).reversed().thenComparing(Module::path))
                .map(m -> "- " + m.path() + " (" + m.lines() + " lines)")
                .toList();
        List<String> routes = files.stream()
                .filter(f -> f.path().startsWith(directory + "/"))
                .flatMap(f -> f.routes().stream())
                .map(r -> "- " + r.method() + " " + r.path() + " -> " + r.handler())
                .toList();

        int lines = modules.stream().mapToInt(Module::lines).sum();
        var drafts = List.of(
                SectionDraft.fixed(1, "Module Map: " + directory,
                        List.of(modules.size() + " source files, " + lines + " lines")),
                SectionDraft.items("Imports From", importsFrom.stream().map(m -> "- " + m).toList(), config.getMaxModuleLinks()),
                SectionDraft.items("Imported By", importedBy.stream().map(m -> "- " + m).toList(), config.getMaxModuleLinks()),
                SectionDraft.items("Key Files", keyFiles, config.getMaxModuleKeyFiles()),
                SectionDraft.items("Route Surface", routes, config.getMaxRoutes())
        );
        return BudgetAllocator.allocate(directory, drafts, List.of(), config.getModuleBudgetChars());
    }

    private static String topLevel(String path) {
        int slash = path.indexOf('/');
        return slash < 0 ? Module.ROOT : path.substring(0, slash);
    }

    private static String rootName(AnalysisResult analysis) {
        return analysis.root().getFileName() == null ? analysis.root().toString() : analysis.root().getFileName().toString();
    }
}
