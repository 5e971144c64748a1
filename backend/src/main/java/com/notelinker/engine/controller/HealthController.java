package com.notelinker.engine.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.notelinker.engine.service.gateway.JinaEmbeddingService;
import com.notelinker.engine.service.gateway.LLMServiceSelector;
import com.notelinker.engine.service.orchestration.RunCoordinator;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/health")
@RequiredArgsConstructor
@Tag(name = "Health", description = "Liveness and provider configuration")
public class HealthController {

  private final RunCoordinator runCoordinator;
  private final JinaEmbeddingService embeddingService;
  private final LLMServiceSelector llmServiceSelector;

  @GetMapping
  @Operation(
      summary = "Liveness check",
      description = "Reports whether a run is active and which providers are configured")
  public ResponseEntity<Map<String, Object>> health() {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", "UP");
    body.put("runActive", runCoordinator.isRunning());
    body.put("embeddingConfigured", embeddingService.isConfigured());
    body.put("llmProvider", llmServiceSelector.getActiveProvider());
    body.put("llmConfigured", llmServiceSelector.isConfigured());
    return ResponseEntity.ok(body);
  }
}
