package com.notelinker.engine.dto.cache;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FailureRecord {
  private String id;
  private Instant timestamp;
  private OperationType operationType;
  private BatchDescriptor batch;
  /** JSON object with message, type, status and guidance. */
  private String errorDetail;
  private boolean resolved;
}
