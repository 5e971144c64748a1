package com.notelinker.engine.dto.cache;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Cached metadata for one note. {@code id} is the note's front-matter id and never changes. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DocumentRecord {
  private String id;
  private String path;
  private String contentHash;
  private Instant createdAt;
  private Instant modifiedAt;
  private String title;
  @Builder.Default private List<String> tags = new ArrayList<>();
  private Instant embeddingUpdatedAt;
  private Instant tagsGeneratedAt;
}
