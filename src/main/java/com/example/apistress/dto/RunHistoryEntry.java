package com.example.apistress.dto;

import com.example.apistress.model.RunStatus;
import java.time.Instant;
import java.util.UUID;

/** One finished run, newest first in the history list. */
public record RunHistoryEntry(
        UUID runId,
        String url,
        RunStatus status,
        Instant startedAt,
        Instant completedAt,
        Long processingTimeMillis,
        Long successCount,
        Long failureCount,
        String errorMessage) {}
