package com.repoatlas.core.gate;

import com.repoatlas.core.model.CheckResult;
import com.repoatlas.core.scanner.FileWalker;
import com.repoatlas.core.scanner.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * In-process scan for hard-coded credentials in the walked source files.
 */
public class SecretScanCheck implements GateCheck {

    private static final Logger log = LoggerFactory.getLogger(SecretScanCheck.class);

    static final String NAME = "secret-scan";

    private record SecretPattern(String rule, Pattern pattern) {}

    private static final List<SecretPattern> SECRET_PATTERNS = List.of(
            new SecretPattern("hardcoded-secret", Pattern.compile(
                    "(?i)\\b(api[_-]?key|secret|password|passwd|access[_-]?token|auth[_-]?token|private[_-]?key)\\b['\"]?\\s*[:=]\\s*['\"][^'\"\\s]{8,}['\"]")),
            new SecretPattern("aws-access-key", Pattern.compile("\\bAKIA[0-9A-Z]{16}\\b")),
            new SecretPattern("github-token", Pattern.compile("\\bgh[pousr]_[A-Za-z0-9]{36,}\\b")),
            new SecretPattern("private-key-block", Pattern.compile("-----BEGIN (RSA |EC |OPENSSH |DSA )?PRIVATE KEY-----"))
    );

    private static final int MAX_REPORTED = 5;

    private final FileWalker walker;
    private final Duration timeout;
    private final int summaryChars;

    public SecretScanCheck(FileWalker walker, Duration timeout, int summaryChars) {
        this.walker = walker;
        this.timeout = timeout;
        this.summaryChars = summaryChars;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public CheckResult run(Path root) {
        long start = System.nanoTime();
        var findings = new ArrayList<String>();
        int scanned = 0;
        for (SourceFile file : walker.walk(root, false)) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            scanned++;
            List<String> lines;
            try {
                lines = Files.readAllLines(file.absolutePath(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.debug("Secret scan skipped {}: {}", file.relativePath(), e.getMessage());
                continue;
            }
            for (int i = 0; i < lines.size(); i++) {
                for (SecretPattern secret : SECRET_PATTERNS) {
                    if (secret.pattern().matcher(lines.get(i)).find()) {
                        findings.add(file.relativePath() + ":" + (i + 1) + " (" + secret.rule() + ")");
                    }
                }
            }
        }
        long elapsed = (System.nanoTime() - start) / 1_000_000;
        if (findings.isEmpty()) {
            return CheckResult.passed(NAME, scanned + " file(s) clean", elapsed);
        }
        String shown = String.join(", ", findings.subList(0, Math.min(MAX_REPORTED, findings.size())));
        String detail = findings.size() + " possible secret(s): " + shown
                + (findings.size() > MAX_REPORTED ? ", ..." : "");
        return CheckResult.failed(NAME, detail.length() > summaryChars ? detail.substring(0, summaryChars) : detail, elapsed);
    }
}
