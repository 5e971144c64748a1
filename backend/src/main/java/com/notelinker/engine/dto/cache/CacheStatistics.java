package com.notelinker.engine.dto.cache;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Row counts of the linker cache")
public class CacheStatistics {
  private long documents;
  private long embeddings;
  private long scores;
  private long ledgerEntries;
  private long failures;
  private long unresolvedFailures;
}
