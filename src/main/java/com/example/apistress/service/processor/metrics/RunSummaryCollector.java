package com.example.apistress.service.processor.metrics;

import com.example.apistress.model.ResultRecord;
import com.example.apistress.model.RunSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import org.slf4j.Logger;

import static java.util.concurrent.Executors.newSingleThreadScheduledExecutor;

/**
 * Accumulates result records from concurrent workers into the run summary. While started, logs a progress
 * snapshot every 5 seconds.
 */
public class RunSummaryCollector {

    public record RunInfo(String runId, String url, String method, String logFile, long expectedRequests) {}

    private final RunInfo info;
    private final Logger log;

    private final Instant startedAt = Instant.now();
    private final AtomicLong requests = new AtomicLong();
    private final AtomicLong successes = new AtomicLong();
    private final AtomicLong transportErrors = new AtomicLong();
    private final DoubleAccumulator latencyMin = new DoubleAccumulator(Math::min, Double.POSITIVE_INFINITY);
    private final DoubleAccumulator latencyMax = new DoubleAccumulator(Math::max, Double.NEGATIVE_INFINITY);
    private final DoubleAdder latencySum = new DoubleAdder();

    private ScheduledExecutorService snapshots;

    public RunSummaryCollector(RunInfo info, Logger log) {
        this.info = Objects.requireNonNull(info, "info");
        this.log = Objects.requireNonNull(log, "log");
    }

    public void start() {
        log.info("Run {} started: method={}, url={}, requests={}, log={}",
                info.runId(), info.method(), info.url(), info.expectedRequests(), info.logFile());
        snapshots = newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("run-snapshots-" + info.runId());
            t.setDaemon(true);
            return t;
        });
        snapshots.scheduleAtFixedRate(this::logSnapshot, 5, 5, TimeUnit.SECONDS);
    }

    public void stop() {
        if (snapshots != null) {
            snapshots.shutdownNow();
            try {
                snapshots.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public void record(ResultRecord record) {
        Objects.requireNonNull(record, "record");
        requests.incrementAndGet();
        if (record.success()) {
            successes.incrementAndGet();
        }
        if (record.error() != null) {
            transportErrors.incrementAndGet();
        }
        double latency = Math.max(0.0, record.responseTimeMs());
        latencySum.add(latency);
        latencyMin.accumulate(latency);
        latencyMax.accumulate(latency);
    }

    public long totalRequests() { return requests.get(); }
    public long successCount() { return successes.get(); }
    public long failureCount() { return requests.get() - successes.get(); }
    public long transportErrorCount() { return transportErrors.get(); }

    public Optional<Double> latencyMinMs() {
        return requests.get() == 0 ? Optional.empty() : Optional.of(latencyMin.get());
    }

    public Optional<Double> latencyMaxMs() {
        return requests.get() == 0 ? Optional.empty() : Optional.of(latencyMax.get());
    }

    public Optional<Double> latencyMeanMs() {
        long count = requests.get();
        return count == 0 ? Optional.empty() : Optional.of(round(latencySum.sum() / count));
    }

    /** Builds the summary. Call after every record has been recorded. */
    public RunSummary summarize() {
        Instant finishedAt = Instant.now();
        long total = totalRequests();
        long success = successCount();
        RunSummary summary = new RunSummary(
                info.runId(),
                info.url(),
                info.method(),
                info.logFile(),
                total,
                success,
                total - success,
                total == 0 ? 0.0 : (double) success / total,
                latencyMinMs().orElse(null),
                latencyMaxMs().orElse(null),
                latencyMeanMs().orElse(null),
                startedAt,
                finishedAt,
                Math.max(0.0, Duration.between(startedAt, finishedAt).toMillis() / 1000.0));
        logSummary(summary);
        return summary;
    }

    private void logSnapshot() {
        StringBuilder sb = new StringBuilder();
        sb.append("Run ").append(info.runId()).append(" snapshot: ")
          .append("requests=").append(totalRequests()).append("/").append(info.expectedRequests())
          .append(", success=").append(successCount())
          .append(", failure=").append(failureCount());
        latencyMinMs().ifPresent(min -> sb.append(", lat(ms) min=").append(min));
        latencyMeanMs().ifPresent(avg -> sb.append(", avg=").append(avg));
        latencyMaxMs().ifPresent(max -> sb.append(", max=").append(max));
        log.info(sb.toString());
    }

    private void logSummary(RunSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append("Run ").append(summary.runId()).append(" summary: ")
          .append("total=").append(summary.totalRequests())
          .append(", success=").append(summary.successCount())
          .append(", failure=").append(summary.failureCount())
          .append(", successRate=").append(String.format("%.2f%%", summary.successRate() * 100));
        if (summary.minResponseTimeMs() != null) {
            sb.append(", lat(ms) min=").append(summary.minResponseTimeMs())
              .append(", avg=").append(summary.meanResponseTimeMs())
              .append(", max=").append(summary.maxResponseTimeMs());
        }
        if (transportErrorCount() > 0) {
            sb.append(", transportErrors=").append(transportErrorCount());
        }
        sb.append(", duration=").append(summary.durationSec()).append("s");
        log.info(sb.toString());
    }

    private static double round(double millis) {
        return Math.round(millis * 100.0) / 100.0;
    }
}
