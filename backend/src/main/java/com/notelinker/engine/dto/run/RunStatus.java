package com.notelinker.engine.dto.run;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.notelinker.engine.service.orchestration.RunState;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Snapshot of a linking run")
public class RunStatus {
  private String runId;
  private String taskName;
  private boolean force;
  private RunState state;
  private Instant startedAt;
  private Instant finishedAt;
  private String progressStep;
  private int progressCompleted;
  private int progressTotal;
  private boolean cancellationRequested;
  private String message;
  private String guidance;
  private Object result;
}
