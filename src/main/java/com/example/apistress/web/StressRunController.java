package com.example.apistress.web;

import com.example.apistress.config.StressTestConfig;
import com.example.apistress.config.StressTestProperties;
import com.example.apistress.dto.ErrorResponse;
import com.example.apistress.dto.HealthResponse;
import com.example.apistress.dto.RunHistoryEntry;
import com.example.apistress.dto.RunStatusResponse;
import com.example.apistress.dto.RunSubmissionRequest;
import com.example.apistress.dto.RunSubmissionResponse;
import com.example.apistress.model.RunStatus;
import com.example.apistress.service.StressRunService;
import com.example.apistress.service.StressRunService.RunSubmissionOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.*;

@Tag(name = "Stress Runs", description = "Endpoints for launching stress runs and reading their summaries")
@RestController
@RequestMapping("/api/runs")
@Validated
public class StressRunController {

    private final StressRunService runService;
    private final StressTestProperties properties;
    private final RunMapper runMapper;

    public StressRunController(StressRunService runService,
                               StressTestProperties properties,
                               RunMapper runMapper) {
        this.runService = runService;
        this.properties = properties;
        this.runMapper = runMapper;
    }

    @Operation(
            summary = "Submit a stress run",
            description = "Validates the run configuration and queues it for execution. Fields left out of the "
                    + "payload take the configured stress.* defaults.",
            responses = {
                    @ApiResponse(responseCode = "202", description = "Run accepted and queued",
                            content = @Content(schema = @Schema(implementation = RunSubmissionResponse.class))),
                    @ApiResponse(responseCode = "400", description = "Invalid run configuration",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "409", description = "Result log already written by an active run",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "503", description = "Service not accepting new runs",
                            content = @Content(schema = @Schema(implementation = RunSubmissionResponse.class)))
            }
    )
    @PostMapping
    public ResponseEntity<RunSubmissionResponse> submitRun(@Valid @RequestBody RunSubmissionRequest request) {
        StressTestConfig.StressTestConfigBuilder builder = properties.toConfigBuilder();
        runMapper.applyOverrides(request, builder);
        Optional<RunSubmissionOutcome> outcomeOpt = runService.submitRun(builder.build());

        if (outcomeOpt.isEmpty()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new RunSubmissionResponse(null, null, "Service not accepting new runs"));
        }

        RunSubmissionOutcome outcome = outcomeOpt.get();
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new RunSubmissionResponse(outcome.getRunId(), outcome.getStatus(), outcome.getMessage()));
    }

    @Operation(
            summary = "Get run status",
            description = "Returns the lifecycle of a run and, once completed, its summary.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Run found",
                            content = @Content(schema = @Schema(implementation = RunStatusResponse.class))),
                    @ApiResponse(responseCode = "404", description = "Run not found",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            }
    )
    @GetMapping("/{runId}")
    public ResponseEntity<?> getRunStatus(
            @Parameter(description = "UUID of the run") @PathVariable UUID runId) {
        return runService.getRunStatus(runId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(new ErrorResponse("Not Found", "Run not found: " + runId)));
    }

    @Operation(summary = "List runs", description = "Retrieves all known runs, optionally filtered by status.")
    @GetMapping
    public ResponseEntity<List<RunStatusResponse>> getRuns(
            @Parameter(description = "Optional status filter (e.g., RUNNING, COMPLETED)") @RequestParam(required = false) String status) {
        List<RunStatusResponse> runs = runService.getAllRuns();
        if (status == null) {
            return ResponseEntity.ok(runs);
        }
        RunStatus runStatus = RunStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        return ResponseEntity.ok(runs.stream().filter(run -> run.getStatus() == runStatus).toList());
    }

    @Operation(summary = "Get run history", description = "Returns recently finished runs, newest first.")
    @GetMapping("/history")
    public ResponseEntity<List<RunHistoryEntry>> getRunHistory() {
        return ResponseEntity.ok(runService.getRunHistory());
    }

    @Operation(summary = "Health check", description = "Simple health endpoint to verify the service is running.")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        boolean healthy = runService.isHealthy();
        return ResponseEntity.ok(new HealthResponse(healthy ? "UP" : "DOWN", runService.getActiveRunCount(), healthy));
    }
}
