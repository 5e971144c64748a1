package com.notelinker.engine.dto.cache;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingVector {
  private String documentId;
  private float[] vector;
  private String model;
  private Instant createdAt;
}
