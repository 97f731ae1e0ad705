package com.example.apistress.service.processor.executor;

import com.example.apistress.clients.RequestDescriptor;
import com.example.apistress.clients.RequestExecutor;
import com.example.apistress.model.ResultRecord;
import com.example.apistress.sink.SinkException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;

import static java.util.concurrent.Executors.newFixedThreadPool;

/**
 * Dispatches {@code totalRequests} attempts of one descriptor through a fixed budget of {@code concurrency}
 * workers. Request ids 1..N are queued before any worker starts; each worker takes the next id as soon as its
 * previous attempt finishes, so at most {@code concurrency} attempts are in flight at any instant.
 *
 * <p>Per-request failures arrive as records and never stop the run. A {@link SinkException} raised by the
 * listener is fatal: dispatch stops, in-flight attempts drain and the first sink failure is rethrown.
 */
public final class RequestDispatchCoordinator {

    private RequestDispatchCoordinator() {
    }

    public static DispatchResult run(UUID runId,
                                     RequestDescriptor descriptor,
                                     DispatchParameters parameters,
                                     RequestExecutor executor,
                                     ResultListener listener,
                                     Logger logger) throws InterruptedException {
        Objects.requireNonNull(runId, "runId");
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(parameters, "parameters");
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(logger, "logger");
        if (parameters.totalRequests() < 1) {
            throw new IllegalArgumentException("totalRequests must be >= 1");
        }
        if (parameters.concurrency() < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }

        long total = parameters.totalRequests();
        int workers = (int) Math.min(parameters.concurrency(), total);

        Queue<Long> pendingIds = new ConcurrentLinkedQueue<>();
        for (long id = 1; id <= total; id++) {
            pendingIds.add(id);
        }

        AtomicLong dispatched = new AtomicLong();
        AtomicLong completed = new AtomicLong();
        AtomicBoolean aborted = new AtomicBoolean(false);
        AtomicReference<SinkException> sinkFailure = new AtomicReference<>();

        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("stress-run-" + runId + "-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        };

        var pool = newFixedThreadPool(workers, threadFactory);
        List<Future<?>> futures = new ArrayList<>(workers);

        logger.info("Run {} dispatching {} requests with {} workers", runId, total, workers);
        try {
            for (int worker = 0; worker < workers; worker++) {
                futures.add(pool.submit(() -> runWorker(runId,
                        descriptor,
                        pendingIds,
                        executor,
                        listener,
                        dispatched,
                        completed,
                        aborted,
                        sinkFailure,
                        logger)));
            }
            awaitWorkers(futures, logger, runId);
        } finally {
            pool.shutdownNow();
            try {
                pool.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                throw interrupted;
            }
        }

        SinkException failure = sinkFailure.get();
        if (failure != null) {
            logger.error("Run {} aborted after {} of {} records: {}", runId, completed.get(), total, failure.getMessage());
            throw failure;
        }

        logger.info("Run {} dispatch complete: dispatched={} completed={}", runId, dispatched.get(), completed.get());
        return new DispatchResult(total, dispatched.get(), completed.get());
    }

    private static void runWorker(UUID runId,
                                  RequestDescriptor descriptor,
                                  Queue<Long> pendingIds,
                                  RequestExecutor executor,
                                  ResultListener listener,
                                  AtomicLong dispatched,
                                  AtomicLong completed,
                                  AtomicBoolean aborted,
                                  AtomicReference<SinkException> sinkFailure,
                                  Logger logger) {
        Long requestId;
        while (!aborted.get() && !Thread.currentThread().isInterrupted() && (requestId = pendingIds.poll()) != null) {
            dispatched.incrementAndGet();
            ResultRecord record = executor.execute(descriptor, requestId);
            if (record == null) {
                throw new IllegalStateException("Executor returned no record for request " + requestId);
            }
            try {
                listener.onResult(record);
                completed.incrementAndGet();
            } catch (SinkException ex) {
                if (sinkFailure.compareAndSet(null, ex)) {
                    aborted.set(true);
                    logger.error("Run {} result sink failed at request {}: {}", runId, requestId, ex.getMessage());
                } else {
                    sinkFailure.get().addSuppressed(ex);
                }
                return;
            }
        }
    }

    private static void awaitWorkers(List<Future<?>> futures, Logger logger, UUID runId) throws InterruptedException {
        for (Future<?> future : futures) {
            try {
                future.get();
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause();
                logger.error("Run {} worker failed: {}", runId, cause.getMessage(), cause);
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new IllegalStateException("Worker failed", cause);
            }
        }
    }

    public record DispatchParameters(long totalRequests, int concurrency) {
    }

    public record DispatchResult(long totalRequests, long dispatched, long completed) {
    }

    /** Receives every completed record, on the worker thread that produced it. */
    @FunctionalInterface
    public interface ResultListener {
        void onResult(ResultRecord record) throws SinkException;
    }
}
