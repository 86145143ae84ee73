package com.repoatlas.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Repo Atlas MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId, String root, String command) {
        MDC.put("runId", runId);
        MDC.put("root", root);
        MDC.put("command", command);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("root");
        MDC.remove("command");
    }
}
