package com.notelinker.engine.dto.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResult {
  private int documents;
  private int embeddings;
  private int scores;
  private int ledgerEntries;

  public int total() {
    return documents + embeddings + scores + ledgerEntries;
  }
}
