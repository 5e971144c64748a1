package com.notelinker.engine.controller;

import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.notelinker.engine.dto.run.RunRequest;
import com.notelinker.engine.dto.run.RunStatus;
import com.notelinker.engine.exception.ResourceNotFoundException;
import com.notelinker.engine.service.orchestration.RunCoordinator;
import com.notelinker.engine.service.workflow.LinkingWorkflowService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Starts, inspects and cancels linking runs. Runs execute in the background. */
@Slf4j
@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
@Tag(name = "Runs", description = "Embedding, scoring, linking and tagging runs")
public class LinkingController {

  private final LinkingWorkflowService workflowService;
  private final RunCoordinator runCoordinator;

  @PostMapping(
      value = "/process",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Process the vault",
      description =
          "Embeds changed notes, scores candidate pairs, updates link regions and generates tags")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "202",
            description = "Run started",
            content = @Content(schema = @Schema(implementation = RunStatus.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content),
        @ApiResponse(
            responseCode = "409",
            description = "Another run is in progress",
            content = @Content)
      })
  public ResponseEntity<RunStatus> processVault(
      @Valid @RequestBody(required = false) RunRequest request) {
    RunRequest effective = request != null ? request : new RunRequest();
    log.info("Process request for path '{}' (force={})", effective.getPath(), effective.getForce());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(workflowService.startProcessVault(effective));
  }

  @PostMapping("/recalibrate")
  @Operation(
      summary = "Recalibrate links",
      description = "Rewrites every note's link region from cached scores without remote calls")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "202", description = "Run started"),
        @ApiResponse(responseCode = "409", description = "Another run is in progress")
      })
  public ResponseEntity<RunStatus> recalibrateLinks() {
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(workflowService.startRecalibration());
  }

  @PostMapping("/retry-failures")
  @Operation(
      summary = "Retry failed batches",
      description = "Re-runs only the items listed in the failure journal")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "202", description = "Run started"),
        @ApiResponse(responseCode = "409", description = "Another run is in progress")
      })
  public ResponseEntity<RunStatus> retryFailures() {
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(workflowService.startRetryFailures());
  }

  @PostMapping(value = "/tags", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Generate tags",
      description = "Tags notes without generated tags, or every note in force mode")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "202", description = "Run started"),
        @ApiResponse(responseCode = "409", description = "Another run is in progress")
      })
  public ResponseEntity<RunStatus> generateTags(
      @Valid @RequestBody(required = false) RunRequest request) {
    RunRequest effective = request != null ? request : new RunRequest();
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(workflowService.startTagGeneration(effective));
  }

  @PostMapping("/cancel")
  @Operation(
      summary = "Cancel the active run",
      description = "Cancellation is checked between batches; finished batches stay persisted")
  public ResponseEntity<Map<String, Object>> cancel() {
    boolean requested = runCoordinator.cancel();
    return ResponseEntity.ok(
        Map.of(
            "cancellationRequested",
            requested,
            "message",
            requested ? "Cancellation requested" : "No run is active"));
  }

  @GetMapping("/current")
  @Operation(
      summary = "Get run status",
      description = "Status of the active run, or of the last finished run when none is active")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Status retrieved"),
        @ApiResponse(responseCode = "404", description = "No run has been started")
      })
  public ResponseEntity<RunStatus> getCurrentRun() {
    RunStatus status =
        runCoordinator
            .getCurrentRun()
            .or(runCoordinator::getLastRun)
            .orElseThrow(() -> new ResourceNotFoundException("No run has been started yet"));
    return ResponseEntity.ok(status);
  }
}
