package com.repoatlas.core.metrics;

import com.repoatlas.core.model.CheckResult;
import com.repoatlas.core.model.GateState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;

/**
 * Centralised Micrometer metrics for scans, impact analysis and gate runs.
 */
@Service
public class AtlasMetrics {

    private final MeterRegistry registry;

    public AtlasMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordScan(int files, long ms) {
        Timer.builder("atlas.scan.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
        DistributionSummary.builder("atlas.scan.files")
                .register(registry)
                .record(files);
    }

    public void recordUnresolved(int count) {
        Counter.builder("atlas.graph.unresolved")
                .description("References that did not resolve to a scanned module")
                .register(registry)
                .increment(count);
    }

    public void recordBlastRadius(int size, boolean escalated) {
        DistributionSummary.builder("atlas.impact.blast_radius")
                .tag("escalated", String.valueOf(escalated))
                .register(registry)
                .record(size);
    }

    public void recordGateOutcome(GateState outcome) {
        Counter.builder("atlas.gate.runs")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Records how long a check ran and how it ended.
     *
     * @param check  check name, e.g. "lint"
     * @param status final status, timeouts included
     */
    public void recordCheck(String check, CheckResult.Status status, long ms) {
        Timer.builder("atlas.gate.check.duration")
                .tag("check", check)
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
