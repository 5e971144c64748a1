package com.notelinker.engine.dto.run;

import java.util.ArrayList;
import java.util.List;

import com.notelinker.engine.dto.cache.CacheStatistics;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Consistency check of the cache against the vault")
public class HealthReport {
  private CacheStatistics statistics;
  private int orphanedDocuments;
  private int missingNoteIds;
  private int missingBoundaries;
  private int documentsWithoutEmbedding;
  @Builder.Default private List<String> issues = new ArrayList<>();

  public boolean isHealthy() {
    return issues.isEmpty();
  }
}
