package com.example.apistress.service;

import com.example.apistress.clients.HttpMethod;
import com.example.apistress.clients.RequestDescriptor;
import com.example.apistress.clients.StressHttpClient;
import com.example.apistress.config.ConfigurationException;
import com.example.apistress.config.StressTestConfig;
import com.example.apistress.model.RunSummary;
import com.example.apistress.service.processor.executor.RequestDispatchCoordinator;
import com.example.apistress.service.processor.executor.RequestDispatchCoordinator.DispatchParameters;
import com.example.apistress.service.processor.executor.RequestDispatchCoordinator.DispatchResult;
import com.example.apistress.service.processor.executor.RequestDispatchCoordinator.ResultListener;
import com.example.apistress.service.processor.metrics.RunSummaryCollector;
import com.example.apistress.sink.JsonLinesResultSink;
import com.example.apistress.sink.ResultSink;
import com.example.apistress.sink.SinkException;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Top-level orchestration of one stress run: validates the configuration, opens the result log, drives the
 * dispatch coordinator and reduces the emitted records into a {@link RunSummary}.
 */
@Component
public class StressTestRunner {

    private static final Logger log = LoggerFactory.getLogger(StressTestRunner.class);

    /** Same parameters and defaults as the command-style entry point; {@code null} selects the default. */
    public RunSummary runStressTest(String url,
                                    Integer totalRequests,
                                    Integer concurrentRequests,
                                    Map<String, String> headers,
                                    Map<String, String> params,
                                    String method,
                                    String logFile,
                                    Double timeoutSeconds) throws InterruptedException {
        StressTestConfig.StressTestConfigBuilder builder = StressTestConfig.builder().url(url);
        if (totalRequests != null) {
            builder.totalRequests(totalRequests);
        }
        if (concurrentRequests != null) {
            builder.concurrentRequests(concurrentRequests);
        }
        if (headers != null) {
            builder.headers(headers);
        }
        if (params != null) {
            builder.params(params);
        }
        if (method != null) {
            builder.method(parseMethod(method));
        }
        if (logFile != null) {
            builder.logFile(logFile);
        }
        if (timeoutSeconds != null) {
            builder.timeout(StressTestConfig.timeoutOfSeconds(timeoutSeconds));
        }
        return runStressTest(builder.build());
    }

    public RunSummary runStressTest(StressTestConfig config) throws InterruptedException {
        return runStressTest(UUID.randomUUID(), config);
    }

    /**
     * Runs to completion and returns the summary.
     *
     * @throws ConfigurationException before any I/O when the configuration is invalid
     * @throws SinkException when the result log cannot be opened or written
     */
    public RunSummary runStressTest(UUID runId, StressTestConfig config) throws InterruptedException {
        Objects.requireNonNull(runId, "runId");
        if (config == null) {
            throw new ConfigurationException("configuration must be provided");
        }
        config.validate();

        RequestDescriptor descriptor = toDescriptor(config);
        RunSummaryCollector collector = new RunSummaryCollector(new RunSummaryCollector.RunInfo(
                runId.toString(),
                descriptor.getUrl(),
                descriptor.getMethod().name(),
                config.logPath().toAbsolutePath().toString(),
                config.getTotalRequests()), log);

        DispatchResult result;
        StressHttpClient client = new StressHttpClient(config.getTimeout());
        try (JsonLinesResultSink sink = JsonLinesResultSink.open(config.logPath(), config.getWriteMode())) {
            collector.start();
            try {
                result = RequestDispatchCoordinator.run(
                        runId,
                        descriptor,
                        new DispatchParameters(config.getTotalRequests(), config.getConcurrentRequests()),
                        client,
                        recordTo(sink, collector),
                        log);
            } finally {
                collector.stop();
            }
        } catch (IOException e) {
            throw new SinkException("Unable to close result log " + config.getLogFile() + ": " + e.getMessage(), e);
        }

        if (result.completed() != config.getTotalRequests()) {
            log.warn("Run {} completed {} of {} requests", runId, result.completed(), config.getTotalRequests());
        }
        return collector.summarize();
    }

    /** Log first, then count, so the summary never includes a record that is missing from the log. */
    private static ResultListener recordTo(ResultSink sink, RunSummaryCollector collector) {
        return record -> {
            sink.append(record);
            collector.record(record);
        };
    }

    private RequestDescriptor toDescriptor(StressTestConfig config) {
        return RequestDescriptor.builder()
                .method(config.getMethod())
                .url(config.getUrl().trim())
                .headers(config.getHeaders())
                .params(config.getParams())
                .timeout(config.getTimeout())
                .build();
    }

    private HttpMethod parseMethod(String method) {
        try {
            return HttpMethod.fromValue(method);
        } catch (IllegalArgumentException ex) {
            throw new ConfigurationException(ex.getMessage());
        }
    }
}
