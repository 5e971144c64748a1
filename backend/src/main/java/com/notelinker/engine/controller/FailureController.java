package com.notelinker.engine.controller;

import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.notelinker.engine.dto.cache.FailureRecord;
import com.notelinker.engine.exception.ResourceNotFoundException;
import com.notelinker.engine.service.failure.FailureJournalService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/failures")
@RequiredArgsConstructor
@Tag(name = "Failures", description = "Journal of failed batches awaiting retry")
public class FailureController {

  private final FailureJournalService failureJournal;

  @GetMapping
  @Operation(
      summary = "List failures",
      description = "Most recent failures first; unresolvedOnly limits to those awaiting retry")
  public ResponseEntity<List<FailureRecord>> getFailures(
      @RequestParam(defaultValue = "false") boolean unresolvedOnly,
      @RequestParam(defaultValue = "100") int limit) {
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be positive");
    }
    return ResponseEntity.ok(
        unresolvedOnly
            ? failureJournal.getUnresolvedFailures()
            : failureJournal.getRecentFailures(limit));
  }

  @PostMapping("/{id}/resolve")
  @Operation(summary = "Mark a failure resolved", description = "Stops it from being retried")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Failure resolved"),
        @ApiResponse(responseCode = "404", description = "No failure with this id")
      })
  public ResponseEntity<Map<String, String>> resolveFailure(@PathVariable String id) {
    if (!failureJournal.resolveFailure(id)) {
      throw new ResourceNotFoundException("Failure not found: " + id);
    }
    log.info("Failure {} marked resolved", id);
    return ResponseEntity.ok(Map.of("message", "Failure resolved", "id", id));
  }

  @DeleteMapping("/{id}")
  @Operation(summary = "Delete a failure")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Failure deleted"),
        @ApiResponse(responseCode = "404", description = "No failure with this id")
      })
  public ResponseEntity<Map<String, String>> deleteFailure(@PathVariable String id) {
    if (!failureJournal.deleteFailure(id)) {
      throw new ResourceNotFoundException("Failure not found: " + id);
    }
    return ResponseEntity.ok(Map.of("message", "Failure deleted", "id", id));
  }

  @PostMapping("/cleanup")
  @Operation(
      summary = "Remove old resolved failures",
      description = "Deletes resolved records older than linker.failures.retention")
  public ResponseEntity<Map<String, Integer>> cleanupOldFailures() {
    return ResponseEntity.ok(Map.of("deleted", failureJournal.cleanupOldFailures()));
  }
}
