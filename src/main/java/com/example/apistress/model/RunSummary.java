package com.example.apistress.model;

import java.time.Instant;

/**
 * Read-only reduction over every record of a completed run. Response-time fields are {@code null} when the
 * run produced no records.
 */
public record RunSummary(
        String runId,
        String url,
        String method,
        String logFile,
        long totalRequests,
        long successCount,
        long failureCount,
        double successRate,
        Double minResponseTimeMs,
        Double maxResponseTimeMs,
        Double meanResponseTimeMs,
        Instant startedAt,
        Instant finishedAt,
        double durationSec
) {
}
