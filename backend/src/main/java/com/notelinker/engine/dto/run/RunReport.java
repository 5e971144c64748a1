package com.notelinker.engine.dto.run;

import java.util.ArrayList;
import java.util.List;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/** Counters collected while a workflow runs; returned as the run's result. */
@Data
@Schema(description = "Summary of a finished linking run")
public class RunReport {
  private int documentsScanned;
  private int documentsPrepared;
  private int documentsEmbedded;
  private int candidatePairs;
  private int pairsSkipped;
  private int pairsScored;
  private int retriedItems;
  private int notesReconciled;
  private int linksAdded;
  private int linksRemoved;
  private int notesTagged;
  private int failedBatches;
  private int skippedItems;
  private final List<String> warnings = new ArrayList<>();

  public void addWarning(String warning) {
    warnings.add(warning);
  }
}
