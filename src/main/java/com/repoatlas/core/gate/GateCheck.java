package com.repoatlas.core.gate;

import com.repoatlas.core.model.CheckResult;

import java.nio.file.Path;
import java.time.Duration;

/**
 * One gate check. Implementations report their own failures through {@link CheckResult};
 * an exception escaping {@link #run(Path)} is recorded as an error.
 */
public interface GateCheck {

    String name();

    /** Upper bound on a single run; the runner abandons the check after this long. */
    Duration timeout();

    CheckResult run(Path root) throws Exception;
}
