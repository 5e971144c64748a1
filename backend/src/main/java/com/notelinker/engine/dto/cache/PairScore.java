package com.notelinker.engine.dto.cache;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Similarity and relevance of two notes. Stored with {@code id1 < id2}; use {@link #canonical()}
 * before persisting anything built by hand.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class PairScore {
  private String id1;
  private String id2;
  private double similarityScore;
  private double aiScore;
  private String model;
  private String reasoning;
  private Instant lastScored;

  public PairKey key() {
    return PairKey.of(id1, id2);
  }

  public PairScore canonical() {
    if (id1.compareTo(id2) <= 0) {
      return this;
    }
    return toBuilder().id1(id2).id2(id1).build();
  }

  /** The member of this pair that is not {@code documentId}. */
  public String otherThan(String documentId) {
    return id1.equals(documentId) ? id2 : id1;
  }
}
