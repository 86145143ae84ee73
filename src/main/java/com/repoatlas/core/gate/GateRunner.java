package com.repoatlas.core.gate;

import com.repoatlas.core.metrics.AtlasMetrics;
import com.repoatlas.core.model.CheckResult;
import com.repoatlas.core.model.GateDecision;
import com.repoatlas.core.model.GateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * I/O shell around {@link GateStateMachine}: loads the record, runs the checks one at a
 * time under their own timeouts, and writes the new record exactly once.
 */
@Service
public class GateRunner {

    private static final Logger log = LoggerFactory.getLogger(GateRunner.class);

    private final GateRecordStore store;
    private final AtlasMetrics metrics;
    private final Clock clock;

    public GateRunner(GateRecordStore store, AtlasMetrics metrics, Clock clock) {
        this.store = store;
        this.metrics = metrics;
        this.clock = clock;
    }

    public GateDecision run(Path root, List<GateCheck> checks, GateContext context) {
        GateRecord record = store.load(root);

        Optional<GateDecision> early = GateStateMachine.preflight(record, context);
        if (early.isPresent()) {
            GateDecision decision = early.get();
            log.warn("{}", decision.summary());
            return finish(root, decision);
        }

        log.info("Running {} gate check(s), failure streak {}/{}",
                checks.size(), record.consecutiveFailures(), context.failureThreshold());
        var results = new ArrayList<CheckResult>(checks.size());
        for (GateCheck check : checks) {
            CheckResult result = runCheck(root, check);
            metrics.recordCheck(check.name(), result.status(), result.durationMs());
            results.add(result);
        }

        GateDecision decision = GateStateMachine.conclude(record, results, context);
        if (decision.allowsProceed()) {
            log.info("{}", decision.summary());
        } else {
            log.warn("{}", decision.summary());
        }
        return finish(root, decision);
    }

    /** Persists the outcome; a failed write keeps the decision and says so in its summary. */
    private GateDecision finish(Path root, GateDecision decision) {
        metrics.recordGateOutcome(decision.outcome());
        try {
            store.save(root, GateStateMachine.next(decision, clock.instant()));
            return decision;
        } catch (GateRecordStore.GateStateException e) {
            String cause = e.getCause() != null ? e.getCause().toString() : e.getMessage();
            log.error("{}: {}", e.getMessage(), cause);
            return decision.withNote("state not persisted: " + cause);
        }
    }

    CheckResult runCheck(Path root, GateCheck check) {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "gate-check-" + check.name());
            thread.setDaemon(true);
            return thread;
        });
        long start = System.nanoTime();
        Future<CheckResult> future = executor.submit(() -> check.run(root));
        try {
            CheckResult result = future.get(check.timeout().toMillis(), TimeUnit.MILLISECONDS);
            log.info("Check {} {}", check.name(), result.status());
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            long elapsed = elapsedMs(start);
            log.warn("Check {} timed out after {}s", check.name(), check.timeout().toSeconds());
            return new CheckResult(check.name(), CheckResult.Status.TIMED_OUT,
                    "Timed out after " + check.timeout().toSeconds() + "s", elapsed);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Check {} crashed", check.name(), cause);
            return new CheckResult(check.name(), CheckResult.Status.ERROR,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new CheckResult(check.name(), CheckResult.Status.ERROR, "Interrupted", elapsedMs(start));
        } finally {
            executor.shutdownNow();
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
