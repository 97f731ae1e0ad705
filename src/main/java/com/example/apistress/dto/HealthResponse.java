package com.example.apistress.dto;

/** {@code status} is {@code UP} while the service accepts runs. */
public record HealthResponse(String status, int activeRuns, boolean acceptingRuns) {}
