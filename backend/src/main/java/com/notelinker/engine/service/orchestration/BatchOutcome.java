package com.notelinker.engine.service.orchestration;

import java.util.ArrayList;
import java.util.List;

import com.notelinker.engine.dto.cache.OperationType;

import lombok.Data;

/** What a batched pass produced: per-item results plus batch and item failure counts. */
@Data
public class BatchOutcome<R> {
  private final OperationType operation;
  private final List<R> results = new ArrayList<>();
  private int totalBatches;
  private int failedBatches;
  private int skippedItems;

  public boolean hasFailures() {
    return failedBatches > 0;
  }
}
