package com.example.apistress.service;

import com.example.apistress.config.StressTestConfig;
import com.example.apistress.config.StressTestProperties;
import com.example.apistress.dto.RunHistoryEntry;
import com.example.apistress.dto.RunStatusResponse;
import com.example.apistress.model.RunRecord;
import com.example.apistress.model.RunStatus;
import com.example.apistress.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

import static java.util.concurrent.Executors.newFixedThreadPool;

/**
 * Runs submitted stress tests in the background, at most {@code stress.max-parallel-runs} at a time, and keeps
 * their lifecycle and summaries for lookup. A result log belongs to one queued or running run at a time.
 */
@Service
public class StressRunService {

    private static final Logger log = LoggerFactory.getLogger(StressRunService.class);

    private final StressTestProperties properties;
    private final StressTestRunner runner;
    private final ThreadPoolExecutor executor;
    private final Map<UUID, RunRecord> runRecords;
    private final Map<Path, UUID> activeLogFiles;
    private final Deque<RunRecord> runHistory;
    private final AtomicBoolean acceptingRuns;
    private final AtomicInteger activeRunCount;

    public StressRunService(StressTestProperties properties, StressTestRunner runner) {
        this.properties = properties;
        this.runner = runner;
        this.executor = createExecutor(properties.getMaxParallelRuns());
        this.runRecords = new ConcurrentHashMap<>();
        this.activeLogFiles = new ConcurrentHashMap<>();
        this.runHistory = new ConcurrentLinkedDeque<>();
        this.acceptingRuns = new AtomicBoolean(true);
        this.activeRunCount = new AtomicInteger();
    }

    @PostConstruct
    void logConfiguration() {
        log.info("StressRunService initialized with maxParallelRuns={} historySize={}",
                properties.getMaxParallelRuns(), properties.getHistorySize());
    }

    private ThreadPoolExecutor createExecutor(int parallelRuns) {
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("stress-run-worker-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        };
        ThreadPoolExecutor pool = (ThreadPoolExecutor) newFixedThreadPool(Math.max(1, parallelRuns), threadFactory);
        pool.setRejectedExecutionHandler((runnable, exec) -> {
            throw new RejectedExecutionException("Run queue is closed");
        });
        return pool;
    }

    /**
     * Validates and queues a run. Returns empty once the service has stopped accepting runs.
     *
     * @throws com.example.apistress.config.ConfigurationException when the configuration is invalid
     * @throws LogFileInUseException when another queued or running run writes the same result log
     */
    public Optional<RunSubmissionOutcome> submitRun(StressTestConfig config) {
        if (!acceptingRuns.get()) {
            return Optional.empty();
        }
        config.validate();

        UUID runId = UUID.randomUUID();
        Path logFile = config.logPath().toAbsolutePath().normalize();
        UUID owner = activeLogFiles.putIfAbsent(logFile, runId);
        if (owner != null) {
            log.warn("Run rejected: result log {} is in use by run {}", logFile, owner);
            throw new LogFileInUseException(logFile, owner);
        }

        RunRecord record = RunRecord.queued(runId, config, Instant.now());
        runRecords.put(runId, record);

        try {
            executor.submit(() -> executeRun(runId, logFile));
            log.info("Run {} submitted ({} {} x{} @{})", runId, config.getMethod(), config.getUrl(),
                    config.getTotalRequests(), config.getConcurrentRequests());
            return Optional.of(new RunSubmissionOutcome(runId, record.status(), "Run queued"));
        } catch (RejectedExecutionException ex) {
            log.warn("Run {} rejected: {}", runId, ex.getMessage());
            runRecords.remove(runId);
            activeLogFiles.remove(logFile, runId);
            return Optional.empty();
        }
    }

    private void executeRun(UUID runId, Path logFile) {
        boolean started = false;
        try {
            if (Thread.currentThread().isInterrupted()) {
                transition(runId, record -> record.failed(Instant.now(), "Run interrupted before start"));
                log.info("Run {} interrupted before start", runId);
                return;
            }

            RunRecord running = transition(runId, record -> record.running(Instant.now()));
            started = true;
            activeRunCount.incrementAndGet();
            log.info("Run {} started", runId);

            RunSummary summary = runner.runStressTest(runId, running.config());

            transition(runId, record -> record.completed(Instant.now(), summary));
            log.info("Run {} completed", runId);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
            transition(runId, record -> record.failed(Instant.now(), "Run interrupted"));
            log.info("Run {} interrupted", runId);
        } catch (Exception ex) {
            transition(runId, record -> record.failed(Instant.now(), ex.getMessage()));
            log.error("Run {} failed: {}", runId, ex.getMessage(), ex);
        } finally {
            if (started) {
                activeRunCount.decrementAndGet();
            }
            activeLogFiles.remove(logFile, runId);
            addToHistory(runRecords.get(runId));
        }
    }

    private RunRecord transition(UUID runId, UnaryOperator<RunRecord> change) {
        return runRecords.computeIfPresent(runId, (id, record) -> change.apply(record));
    }

    private void addToHistory(RunRecord record) {
        runHistory.addFirst(record);
        while (runHistory.size() > properties.getHistorySize()) {
            runHistory.pollLast();
        }
    }

    public Optional<RunStatusResponse> getRunStatus(UUID runId) {
        return Optional.ofNullable(runRecords.get(runId)).map(this::toStatusResponse);
    }

    public List<RunStatusResponse> getAllRuns() {
        List<RunStatusResponse> responses = new ArrayList<>();
        for (RunRecord record : runRecords.values()) {
            responses.add(toStatusResponse(record));
        }
        return responses;
    }

    public List<RunHistoryEntry> getRunHistory() {
        List<RunHistoryEntry> snapshot = new ArrayList<>();
        for (RunRecord record : runHistory) {
            RunSummary summary = record.summary();
            snapshot.add(new RunHistoryEntry(
                    record.runId(),
                    record.config().getUrl(),
                    record.status(),
                    record.startedAt(),
                    record.completedAt(),
                    record.processingTimeMillis(),
                    summary != null ? summary.successCount() : null,
                    summary != null ? summary.failureCount() : null,
                    record.errorMessage()));
        }
        return snapshot;
    }

    public int getActiveRunCount() {
        return activeRunCount.get();
    }

    public void shutdown() {
        if (acceptingRuns.compareAndSet(true, false)) {
            executor.shutdownNow();
        }
    }

    @PreDestroy
    void onShutdown() {
        shutdown();
    }

    public boolean isHealthy() {
        return acceptingRuns.get() && !executor.isShutdown();
    }

    private RunStatusResponse toStatusResponse(RunRecord record) {
        StressTestConfig config = record.config();
        return new RunStatusResponse(
                record.runId(),
                record.status(),
                config.getUrl(),
                config.getMethod().name(),
                config.getTotalRequests(),
                config.getConcurrentRequests(),
                config.getLogFile(),
                record.submittedAt(),
                record.startedAt(),
                record.completedAt(),
                record.processingTimeMillis(),
                record.errorMessage(),
                record.summary());
    }

    public static class RunSubmissionOutcome {
        private final UUID runId;
        private final RunStatus status;
        private final String message;

        public RunSubmissionOutcome(UUID runId, RunStatus status, String message) {
            this.runId = runId;
            this.status = status;
            this.message = message;
        }

        public UUID getRunId() {
            return runId;
        }

        public RunStatus getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }
    }
}
