package com.notelinker.engine.dto.cache;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Which batch failed and what was in it. Item keys are pair keys for scoring and note ids for
 * embedding and tagging; labels are the matching note paths for people reading the journal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchDescriptor {

  @JsonProperty("batch_number")
  private int batchNumber;

  @JsonProperty("total_batches")
  private int totalBatches;

  @JsonProperty("items")
  @Builder.Default
  private List<String> itemKeys = new ArrayList<>();

  @JsonProperty("display_items")
  @Builder.Default
  private List<String> labels = new ArrayList<>();
}
