package com.notelinker.engine.service.orchestration;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A note whose body changed since its last embedding. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingTask {
  private String documentId;
  private String path;
  private String title;
  private String contentHash;
  private String body;
  private Instant modifiedAt;

  /** Text sent for embedding; the title stands in for an empty body. */
  public String embeddingText() {
    return body == null || body.isBlank() ? title : body;
  }
}
