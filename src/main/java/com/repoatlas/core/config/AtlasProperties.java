package com.repoatlas.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Externalised configuration for every analysis stage, bound from the {@code atlas.*} namespace.
 * <p>
 * CLI options override individual values per invocation; the values here are the defaults.
 */
@Component
@ConfigurationProperties(prefix = "atlas")
public class AtlasProperties {

    private Scan scan = new Scan();
    private Graph graph = new Graph();
    private Impact impact = new Impact();
    private Gate gate = new Gate();
    private Profile profile = new Profile();

    public Scan getScan() { return scan; }
    public void setScan(Scan scan) { this.scan = scan; }
    public Graph getGraph() { return graph; }
    public void setGraph(Graph graph) { this.graph = graph; }
    public Impact getImpact() { return impact; }
    public void setImpact(Impact impact) { this.impact = impact; }
    public Gate getGate() { return gate; }
    public void setGate(Gate gate) { this.gate = gate; }
    public Profile getProfile() { return profile; }
    public void setProfile(Profile profile) { this.profile = profile; }

    public static class Scan {
        private Set<String> excludeDirs = new LinkedHashSet<>(List.of(
                ".git", ".hg", ".svn", "node_modules", "target", "build", "dist", "out",
                ".idea", ".vscode", "__pycache__", ".gradle", ".mvn", ".next", ".nuxt",
                "coverage", ".cache", "venv", ".venv", "env", ".tox", "vendor", ".atlas"
        ));
        private Set<String> includeExtensions = new LinkedHashSet<>(List.of(
                ".js", ".jsx", ".ts", ".tsx", ".mjs", ".cjs", ".vue", ".svelte",
                ".py", ".java", ".kt", ".go", ".rb", ".php",
                ".css", ".scss", ".sass", ".less", ".styl", ".pcss",
                ".json", ".md"
        ));
        private long maxFileSizeBytes = 1_000_000;
        private int maxLines = 2000;
        private boolean includeTests = false;
        /** Prunes every dot-directory, not only the listed ones. */
        private boolean excludeHiddenDirs = true;

        public Set<String> getExcludeDirs() { return excludeDirs; }
        public void setExcludeDirs(Set<String> excludeDirs) { this.excludeDirs = excludeDirs; }
        public Set<String> getIncludeExtensions() { return includeExtensions; }
        public void setIncludeExtensions(Set<String> includeExtensions) { this.includeExtensions = includeExtensions; }
        public long getMaxFileSizeBytes() { return maxFileSizeBytes; }
        public void setMaxFileSizeBytes(long maxFileSizeBytes) { this.maxFileSizeBytes = maxFileSizeBytes; }
        public int getMaxLines() { return maxLines; }
        public void setMaxLines(int maxLines) { this.maxLines = maxLines; }
        public boolean isIncludeTests() { return includeTests; }
        public void setIncludeTests(boolean includeTests) { this.includeTests = includeTests; }
        public boolean isExcludeHiddenDirs() { return excludeHiddenDirs; }
        public void setExcludeHiddenDirs(boolean excludeHiddenDirs) { this.excludeHiddenDirs = excludeHiddenDirs; }
    }

    public static class Graph {
        private Map<String, String> aliases = new LinkedHashMap<>(Map.of(
                "@/", "src/",
                "~/", "src/",
                "src/", "src/"
        ));
        private List<String> sourceRoots = List.of("src/main/java", "src/main/kotlin", "src", "");
        private int unresolvedSampleSize = 20;

        public Map<String, String> getAliases() { return aliases; }
        public void setAliases(Map<String, String> aliases) { this.aliases = aliases; }
        public List<String> getSourceRoots() { return sourceRoots; }
        public void setSourceRoots(List<String> sourceRoots) { this.sourceRoots = sourceRoots; }
        public int getUnresolvedSampleSize() { return unresolvedSampleSize; }
        public void setUnresolvedSampleSize(int unresolvedSampleSize) { this.unresolvedSampleSize = unresolvedSampleSize; }
    }

    public static class Impact {
        private int directCycleMaxLength = 3;
        private int escalationThreshold = 20;
        /** Negative means unbounded. */
        private int maxDepth = -1;
        private int criticalDirectDependents = 10;
        private int highDirectDependents = 5;
        private int mediumDirectDependents = 2;

        public int getDirectCycleMaxLength() { return directCycleMaxLength; }
        public void setDirectCycleMaxLength(int directCycleMaxLength) { this.directCycleMaxLength = directCycleMaxLength; }
        public int getEscalationThreshold() { return escalationThreshold; }
        public void setEscalationThreshold(int escalationThreshold) { this.escalationThreshold = escalationThreshold; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public int getCriticalDirectDependents() { return criticalDirectDependents; }
        public void setCriticalDirectDependents(int criticalDirectDependents) { this.criticalDirectDependents = criticalDirectDependents; }
        public int getHighDirectDependents() { return highDirectDependents; }
        public void setHighDirectDependents(int highDirectDependents) { this.highDirectDependents = highDirectDependents; }
        public int getMediumDirectDependents() { return mediumDirectDependents; }
        public void setMediumDirectDependents(int mediumDirectDependents) { this.mediumDirectDependents = mediumDirectDependents; }
    }

    public static class Gate {
        private int failureThreshold = 3;
        private String stateDir = ".atlas/state";
        private int lintTimeoutSeconds = 120;
        private int testTimeoutSeconds = 300;
        private int secretScanTimeoutSeconds = 60;
        private boolean secretScanEnabled = true;
        private int outputSummaryChars = 400;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }
        public String getStateDir() { return stateDir; }
        public void setStateDir(String stateDir) { this.stateDir = stateDir; }
        public int getLintTimeoutSeconds() { return lintTimeoutSeconds; }
        public void setLintTimeoutSeconds(int lintTimeoutSeconds) { this.lintTimeoutSeconds = lintTimeoutSeconds; }
        public int getTestTimeoutSeconds() { return testTimeoutSeconds; }
        public void setTestTimeoutSeconds(int testTimeoutSeconds) { this.testTimeoutSeconds = testTimeoutSeconds; }
        public int getSecretScanTimeoutSeconds() { return secretScanTimeoutSeconds; }
        public void setSecretScanTimeoutSeconds(int secretScanTimeoutSeconds) { this.secretScanTimeoutSeconds = secretScanTimeoutSeconds; }
        public boolean isSecretScanEnabled() { return secretScanEnabled; }
        public void setSecretScanEnabled(boolean secretScanEnabled) { this.secretScanEnabled = secretScanEnabled; }
        public int getOutputSummaryChars() { return outputSummaryChars; }
        public void setOutputSummaryChars(int outputSummaryChars) { this.outputSummaryChars = outputSummaryChars; }
    }

    public static class Profile {
        private int budgetChars = 2400;
        private int moduleBudgetChars = 800;
        private int maxModuleMaps = 3;
        private int minModuleMapFiles = 3;
        private int exampleFilesPerSignal = 3;
        private int maxDataModels = 20;
        private int maxFieldsPerModel = 6;
        private int maxRoutes = 15;
        private int maxKeyFiles = 12;
        private int maxCycles = 5;
        private int maxDirectories = 12;
        private int maxModuleLinks = 12;
        private int maxModuleKeyFiles = 15;
        private String outputDir = ".atlas/context";

        public int getBudgetChars() { return budgetChars; }
        public void setBudgetChars(int budgetChars) { this.budgetChars = budgetChars; }
        public int getModuleBudgetChars() { return moduleBudgetChars; }
        public void setModuleBudgetChars(int moduleBudgetChars) { this.moduleBudgetChars = moduleBudgetChars; }
        public int getMaxModuleMaps() { return maxModuleMaps; }
        public void setMaxModuleMaps(int maxModuleMaps) { this.maxModuleMaps = maxModuleMaps; }
        public int getMinModuleMapFiles() { return minModuleMapFiles; }
        public void setMinModuleMapFiles(int minModuleMapFiles) { this.minModuleMapFiles = minModuleMapFiles; }
        public int getExampleFilesPerSignal() { return exampleFilesPerSignal; }
        public void setExampleFilesPerSignal(int exampleFilesPerSignal) { this.exampleFilesPerSignal = exampleFilesPerSignal; }
        public int getMaxDataModels() { return maxDataModels; }
        public void setMaxDataModels(int maxDataModels) { this.maxDataModels = maxDataModels; }
        public int getMaxFieldsPerModel() { return maxFieldsPerModel; }
        public void setMaxFieldsPerModel(int maxFieldsPerModel) { this.maxFieldsPerModel = maxFieldsPerModel; }
        public int getMaxRoutes() { return maxRoutes; }
        public void setMaxRoutes(int maxRoutes) { this.maxRoutes = maxRoutes; }
        public int getMaxKeyFiles() { return maxKeyFiles; }
        public void setMaxKeyFiles(int maxKeyFiles) { this.maxKeyFiles = maxKeyFiles; }
        public int getMaxCycles() { return maxCycles; }
        public void setMaxCycles(int maxCycles) { this.maxCycles = maxCycles; }
        public int getMaxDirectories() { return maxDirectories; }
        public void setMaxDirectories(int maxDirectories) { this.maxDirectories = maxDirectories; }
        public int getMaxModuleLinks() { return maxModuleLinks; }
        public void setMaxModuleLinks(int maxModuleLinks) { this.maxModuleLinks = maxModuleLinks; }
        public int getMaxModuleKeyFiles() { return maxModuleKeyFiles; }
        public void setMaxModuleKeyFiles(int maxModuleKeyFiles) { this.maxModuleKeyFiles = maxModuleKeyFiles; }
        public String getOutputDir() { return outputDir; }
        public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    }
}
