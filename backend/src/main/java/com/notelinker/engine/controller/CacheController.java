package com.notelinker.engine.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.notelinker.engine.dto.cache.CacheStatistics;
import com.notelinker.engine.dto.cache.CleanupResult;
import com.notelinker.engine.dto.run.HealthReport;
import com.notelinker.engine.dto.run.MaintenanceReport;
import com.notelinker.engine.dto.run.RunRequest;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.workflow.LinkingWorkflowService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/cache")
@RequiredArgsConstructor
@Tag(name = "Cache", description = "Cache statistics and maintenance")
public class CacheController {

  private final CacheStore cacheStore;
  private final LinkingWorkflowService workflowService;

  @GetMapping("/stats")
  @Operation(summary = "Get cache statistics", description = "Row counts of every cache table")
  public ResponseEntity<CacheStatistics> getStatistics() {
    return ResponseEntity.ok(cacheStore.getStatistics());
  }

  @GetMapping("/health")
  @Operation(
      summary = "Check cache health",
      description = "Compares the cache with the vault and lists inconsistencies")
  public ResponseEntity<HealthReport> healthCheck() {
    return ResponseEntity.ok(workflowService.healthCheck());
  }

  @PostMapping("/cleanup")
  @Operation(
      summary = "Clean orphaned data",
      description = "Removes notes whose files are gone and everything that referenced them")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Cleanup finished"),
        @ApiResponse(responseCode = "409", description = "A run is in progress")
      })
  public ResponseEntity<CleanupResult> cleanOrphanedData() {
    CleanupResult result = workflowService.cleanOrphanedData();
    log.info("Orphan cleanup removed {} rows", result.total());
    return ResponseEntity.ok(result);
  }

  @PostMapping("/sync-hashes")
  @Operation(
      summary = "Sync content hashes",
      description = "Records current body hashes so unchanged notes are not re-embedded")
  public ResponseEntity<MaintenanceReport> syncHashes(
      @Valid @RequestBody(required = false) RunRequest request) {
    return ResponseEntity.ok(workflowService.syncHashes(request));
  }

  @PostMapping("/boundaries")
  @Operation(
      summary = "Add hash boundaries",
      description = "Appends the hash boundary marker to notes that lack it")
  public ResponseEntity<MaintenanceReport> addHashBoundaries() {
    return ResponseEntity.ok(workflowService.addHashBoundaries());
  }

  @DeleteMapping
  @Operation(summary = "Clear the cache", description = "Deletes every cached row")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Cache cleared"),
        @ApiResponse(responseCode = "409", description = "A run is in progress")
      })
  public ResponseEntity<Map<String, String>> clearCache() {
    workflowService.clearCache();
    return ResponseEntity.ok(Map.of("message", "Cache cleared"));
  }
}
