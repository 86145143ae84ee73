package com.repoatlas.core.gate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repoatlas.core.config.AtlasProperties;
import com.repoatlas.core.scanner.FileWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Picks the lint and test commands for a project from its build files, plus the
 * in-process secret scan when enabled.
 */
@Component
public class CheckDetector {

    private static final Logger log = LoggerFactory.getLogger(CheckDetector.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /** Checks chosen for a root, plus notes about what could not be detected. */
    public record DetectedChecks(List<GateCheck> checks, List<String> notes) {}

    private final AtlasProperties.Gate config;
    private final FileWalker walker;

    public CheckDetector(AtlasProperties properties, FileWalker walker) {
        this.config = properties.getGate();
        this.walker = walker;
    }

    public DetectedChecks detect(Path root) {
        var checks = new ArrayList<GateCheck>();
        var notes = new ArrayList<String>();
        JsonNode scripts = packageScripts(root);

        detectLint(root, scripts).ifPresentOrElse(checks::add,
                () -> notes.add("No lint command detected; lint not enforced"));
        detectTest(root, scripts).ifPresentOrElse(checks::add,
                () -> notes.add("No test command detected; tests not enforced"));
        if (config.isSecretScanEnabled()) {
            checks.add(new SecretScanCheck(walker, Duration.ofSeconds(config.getSecretScanTimeoutSeconds()),
                    config.getOutputSummaryChars()));
        }
        log.debug("Detected checks for {}: {}", root, checks);
        return new DetectedChecks(checks, notes);
    }

    Optional<GateCheck> detectLint(Path root, JsonNode scripts) {
        if (hasScript(scripts, "lint")) {
            return Optional.of(lint("npm", "npm", "run", "lint"));
        }
        if (hasAny(root, ".eslintrc") || hasAny(root, "eslint.config.")) {
            return Optional.of(lint("eslint", "npx", "eslint", "."));
        }
        if (Files.exists(root.resolve("biome.json"))) {
            return Optional.of(lint("biome", "npx", "biome", "check", "."));
        }
        if (pyprojectHas(root, "[tool.ruff]")) {
            return Optional.of(lint("ruff", "ruff", "check", "."));
        }
        if (pyprojectHas(root, "[tool.flake8]") || Files.exists(root.resolve(".flake8"))) {
            return Optional.of(lint("flake8", "flake8", "."));
        }
        if (Files.exists(root.resolve(".golangci.yml")) || Files.exists(root.resolve(".golangci.yaml"))) {
            return Optional.of(lint("golangci-lint", "golangci-lint", "run"));
        }
        return Optional.empty();
    }

    Optional<GateCheck> detectTest(Path root, JsonNode scripts) {
        if (hasScript(scripts, "test") && !isPlaceholderTest(scripts.get("test").asText())) {
            return Optional.of(test("npm", "npm", "test"));
        }
        if (hasAny(root, "jest.config.")) {
            return Optional.of(test("jest", "npx", "jest", "--passWithNoTests"));
        }
        if (hasAny(root, "vitest.config.")) {
            return Optional.of(test("vitest", "npx", "vitest", "run"));
        }
        if (pyprojectHas(root, "[tool.pytest") || Files.exists(root.resolve("pytest.ini"))
                || Files.exists(root.resolve("conftest.py"))) {
            return Optional.of(test("pytest", "pytest"));
        }
        if (Files.exists(root.resolve("Cargo.toml"))) {
            return Optional.of(test("cargo", "cargo", "test"));
        }
        if (Files.exists(root.resolve("go.mod"))) {
            return Optional.of(test("go", "go", "test", "./..."));
        }
        if (Files.exists(root.resolve("pom.xml"))) {
            return Optional.of(test("mvn", "mvn", "-B", "-q", "test"));
        }
        if (Files.exists(root.resolve("build.gradle")) || Files.exists(root.resolve("build.gradle.kts"))) {
            return Optional.of(test("gradle", "gradle", "test"));
        }
        return Optional.empty();
    }

    private GateCheck lint(String tool, String... command) {
        return new CommandCheck("lint", tool, List.of(command),
                Duration.ofSeconds(config.getLintTimeoutSeconds()), config.getOutputSummaryChars());
    }

    private GateCheck test(String tool, String... command) {
        return new CommandCheck("test", tool, List.of(command),
                Duration.ofSeconds(config.getTestTimeoutSeconds()), config.getOutputSummaryChars());
    }

    JsonNode packageScripts(Path root) {
        Path packageJson = root.resolve("package.json");
        if (!Files.isRegularFile(packageJson)) {
            return OBJECT_MAPPER.createObjectNode();
        }
        try {
            JsonNode scripts = OBJECT_MAPPER.readTree(packageJson.toFile()).path("scripts");
            return scripts.isObject() ? scripts : OBJECT_MAPPER.createObjectNode();
        } catch (IOException e) {
            log.warn("Could not parse {}: {}", packageJson, e.getMessage());
            return OBJECT_MAPPER.createObjectNode();
        }
    }

    private static boolean hasScript(JsonNode scripts, String name) {
        JsonNode script = scripts.get(name);
        return script != null && script.isTextual() && !script.asText().isBlank();
    }

    /** npm's generated default test script always fails. */
    static boolean isPlaceholderTest(String script) {
        String lowered = script.toLowerCase(Locale.ROOT);
        return lowered.contains("no test specified") && lowered.contains("exit 1");
    }

    private static boolean hasAny(Path root, String prefix) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(root)) {
            for (Path entry : entries) {
                if (entry.getFileName().toString().startsWith(prefix)) {
                    return true;
                }
            }
        } catch (IOException e) {
            log.debug("Cannot list {}: {}", root, e.getMessage());
        }
        return false;
    }

    private static boolean pyprojectHas(Path root, String section) {
        Path pyproject = root.resolve("pyproject.toml");
        if (!Files.isRegularFile(pyproject)) {
            return false;
        }
        try {
            return Files.readString(pyproject).contains(section);
        } catch (IOException e) {
            log.debug("Cannot read {}: {}", pyproject, e.getMessage());
            return false;
        }
    }
}
