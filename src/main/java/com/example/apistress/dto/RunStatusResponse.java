package com.example.apistress.dto;

import com.example.apistress.model.RunStatus;
import com.example.apistress.model.RunSummary;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RunStatusResponse {

    private final UUID runId;
    private final RunStatus status;
    private final String url;
    private final String method;
    private final int totalRequests;
    private final int concurrentRequests;
    private final String logFile;
    private final Instant submittedAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Long processingTimeMillis;
    private final String errorMessage;
    private final RunSummary summary;

    public RunStatusResponse(
            UUID runId,
            RunStatus status,
            String url,
            String method,
            int totalRequests,
            int concurrentRequests,
            String logFile,
            Instant submittedAt,
            Instant startedAt,
            Instant completedAt,
            Long processingTimeMillis,
            String errorMessage,
            RunSummary summary) {
        this.runId = runId;
        this.status = status;
        this.url = url;
        this.method = method;
        this.totalRequests = totalRequests;
        this.concurrentRequests = concurrentRequests;
        this.logFile = logFile;
        this.submittedAt = submittedAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.processingTimeMillis = processingTimeMillis;
        this.errorMessage = errorMessage;
        this.summary = summary;
    }

    public UUID getRunId() {
        return runId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    public int getTotalRequests() {
        return totalRequests;
    }

    public int getConcurrentRequests() {
        return concurrentRequests;
    }

    public String getLogFile() {
        return logFile;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Long getProcessingTimeMillis() {
        return processingTimeMillis;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public RunSummary getSummary() {
        return summary;
    }
}
