package com.repoatlas.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.repoatlas.core.model.CheckResult;
import com.repoatlas.core.model.Cycle;
import com.repoatlas.core.model.GateDecision;
import picocli.CommandLine;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ANSI-colored terminal output and JSON printing for the Repo Atlas CLI.
 */
public class ConsoleOutput {

    private static final ObjectMapper JSON = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(cyan) REPO ATLAS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ATLAS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void heading(String title) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
    }

    public static void line(String text) {
        System.out.println(text);
    }

    public static void cycle(Cycle cycle) {
        String path = String.join(" -> ", cycle.modules()) + " -> " + cycle.modules().get(0);
        String label = cycle.kind() == Cycle.Kind.DIRECT ? "@|fg(red) [DIRECT]|@" : "@|fg(yellow) [INDIRECT]|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string("  " + label + " " + path));
    }

    public static void check(CheckResult result) {
        String status = switch (result.status()) {
            case PASSED -> "@|fg(green) PASS|@";
            case FAILED -> "@|fg(red) FAIL|@";
            case TIMED_OUT -> "@|fg(red) TIMEOUT|@";
            case ERROR -> "@|fg(red) ERROR|@";
            case SKIPPED -> "@|fg(yellow) SKIP|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + status + " " + result.name() + " (" + result.durationMs() + "ms)"
                        + (result.detail() == null || result.detail().isEmpty() ? "" : " " + result.detail())));
    }

    public static void gateDecision(GateDecision decision) {
        String label = switch (decision.outcome()) {
            case PASSED -> "@|fg(green),bold [GATE PASSED]|@";
            case BYPASSED -> "@|fg(yellow),bold [GATE BYPASSED]|@";
            case HALTED -> "@|fg(red),bold [GATE HALTED]|@";
            default -> "@|fg(red),bold [GATE FAILED]|@";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(label + " " + decision.summary()));
    }

    public static void json(Object value) {
        try {
            System.out.println(JSON.writeValueAsString(value));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise output", e);
        }
    }

    /** Structured error: JSON object in JSON mode, a red line otherwise. */
    public static void failure(boolean asJson, String message) {
        if (asJson) {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("status", "error");
            error.put("message", message);
            json(error);
        } else {
            error(message);
        }
    }
}
