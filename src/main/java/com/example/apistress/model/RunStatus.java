package com.example.apistress.model;

public enum RunStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED
}
