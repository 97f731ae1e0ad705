package com.example.apistress.dto;

import com.example.apistress.model.RunStatus;

import java.util.UUID;

public class RunSubmissionResponse {

    private final UUID runId;
    private final RunStatus status;
    private final String message;

    public RunSubmissionResponse(UUID runId, RunStatus status, String message) {
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
