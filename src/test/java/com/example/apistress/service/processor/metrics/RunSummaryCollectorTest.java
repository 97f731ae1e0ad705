package com.example.apistress.service.processor.metrics;

import com.example.apistress.model.ResultRecord;
import com.example.apistress.model.RunSummary;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RunSummaryCollectorTest {

    private static final Logger log = LoggerFactory.getLogger(RunSummaryCollectorTest.class);

    private static RunSummaryCollector collector(long expected) {
        return new RunSummaryCollector(
                new RunSummaryCollector.RunInfo("run-1", "http://localhost/x", "GET", "/tmp/run.jsonl", expected), log);
    }

    private static ResultRecord status(long id, int status, double millis) {
        return ResultRecord.completed(id, Instant.now(), "http://localhost/x", "GET", Map.of(), Map.of(),
                status, millis, Map.of(), 0, null);
    }

    private static ResultRecord transportError(long id, double millis) {
        return ResultRecord.failed(id, Instant.now(), "http://localhost/x", "GET", Map.of(), Map.of(),
                millis, "TIMEOUT: request timed out");
    }

    @Test
    void summaryCountsSuccessesFailuresAndLatencies() {
        RunSummaryCollector collector = collector(4);
        collector.record(status(1, 200, 10.0));
        collector.record(status(2, 302, 30.0));
        collector.record(status(3, 500, 20.0));
        collector.record(transportError(4, 40.0));

        RunSummary summary = collector.summarize();

        assertThat(summary.runId()).isEqualTo("run-1");
        assertThat(summary.totalRequests()).isEqualTo(4);
        assertThat(summary.successCount()).isEqualTo(2);
        assertThat(summary.failureCount()).isEqualTo(2);
        assertThat(summary.successRate()).isCloseTo(0.5, within(1e-9));
        assertThat(summary.minResponseTimeMs()).isEqualTo(10.0);
        assertThat(summary.maxResponseTimeMs()).isEqualTo(40.0);
        assertThat(summary.meanResponseTimeMs()).isEqualTo(25.0);
        assertThat(summary.finishedAt()).isAfterOrEqualTo(summary.startedAt());
        assertThat(summary.durationSec()).isGreaterThanOrEqualTo(0.0);
        assertThat(collector.transportErrorCount()).isEqualTo(1);
    }

    @Test
    void emptyCollectorHasNoLatencyFigures() {
        RunSummaryCollector collector = collector(0);

        RunSummary summary = collector.summarize();

        assertThat(summary.totalRequests()).isZero();
        assertThat(summary.successRate()).isZero();
        assertThat(summary.minResponseTimeMs()).isNull();
        assertThat(summary.maxResponseTimeMs()).isNull();
        assertThat(summary.meanResponseTimeMs()).isNull();
        assertThat(collector.latencyMeanMs()).isEmpty();
    }

    @Test
    void meanIsRoundedToTwoDecimals() {
        RunSummaryCollector collector = collector(3);
        collector.record(status(1, 200, 1.0));
        collector.record(status(2, 200, 1.0));
        collector.record(status(3, 200, 2.0));

        assertThat(collector.latencyMeanMs()).contains(1.33);
    }

    @Test
    void concurrentRecordingLosesNothing() throws Exception {
        RunSummaryCollector collector = collector(4_000);
        collector.start();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            for (int w = 0; w < 8; w++) {
                int offset = w * 500;
                pool.submit(() -> {
                    for (int i = 1; i <= 500; i++) {
                        collector.record(status(offset + i, i % 2 == 0 ? 200 : 404, i));
                    }
                });
            }
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            collector.stop();
        }

        assertThat(collector.totalRequests()).isEqualTo(4_000);
        assertThat(collector.successCount()).isEqualTo(2_000);
        assertThat(collector.failureCount()).isEqualTo(2_000);
        assertThat(collector.latencyMinMs()).contains(1.0);
        assertThat(collector.latencyMaxMs()).contains(500.0);
    }
}
