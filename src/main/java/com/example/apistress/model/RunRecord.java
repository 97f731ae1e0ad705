package com.example.apistress.model;

import com.example.apistress.config.StressTestConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable snapshot of one submitted run. Each lifecycle transition returns a new snapshot; the service
 * swaps it in atomically.
 */
public record RunRecord(
        UUID runId,
        StressTestConfig config,
        RunStatus status,
        Instant submittedAt,
        Instant startedAt,
        Instant completedAt,
        RunSummary summary,
        String errorMessage) {

    public static RunRecord queued(UUID runId, StressTestConfig config, Instant submittedAt) {
        return new RunRecord(runId, config, RunStatus.QUEUED, submittedAt, null, null, null, null);
    }

    public RunRecord running(Instant at) {
        return new RunRecord(runId, config, RunStatus.RUNNING, submittedAt, at, null, null, null);
    }

    public RunRecord completed(Instant at, RunSummary runSummary) {
        return new RunRecord(runId, config, RunStatus.COMPLETED, submittedAt, startedAt, at, runSummary, null);
    }

    public RunRecord failed(Instant at, String message) {
        return new RunRecord(runId, config, RunStatus.FAILED, submittedAt, startedAt, at, null, message);
    }

    /** Start to completion, or {@code null} while the run has not both started and finished. */
    public Long processingTimeMillis() {
        if (startedAt == null || completedAt == null) {
            return null;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
