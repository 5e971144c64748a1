package com.notelinker.engine.service.cache;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.notelinker.engine.dto.cache.PairScore;

/**
 * Bidirectional view of the pair scores: each note maps to its neighbours and the shared score
 * record. Derived from the {@code pair_scores} table and rebuilt from it whenever in doubt.
 */
class ScoreIndex {

  private final Map<String, Map<String, PairScore>> byDocument = new HashMap<>();

  void put(PairScore score) {
    byDocument.computeIfAbsent(score.getId1(), id -> new HashMap<>()).put(score.getId2(), score);
    byDocument.computeIfAbsent(score.getId2(), id -> new HashMap<>()).put(score.getId1(), score);
  }

  PairScore get(String a, String b) {
    return byDocument.getOrDefault(a, Collections.emptyMap()).get(b);
  }

  Collection<PairScore> scoresFor(String documentId) {
    return byDocument.getOrDefault(documentId, Collections.emptyMap()).values();
  }

  void removeDocument(String documentId) {
    Map<String, PairScore> neighbours = byDocument.remove(documentId);
    if (neighbours == null) {
      return;
    }
    for (String neighbour : neighbours.keySet()) {
      Map<String, PairScore> reverse = byDocument.get(neighbour);
      if (reverse != null) {
        reverse.remove(documentId);
        if (reverse.isEmpty()) {
          byDocument.remove(neighbour);
        }
      }
    }
  }

  void clear() {
    byDocument.clear();
  }

  int documentCount() {
    return byDocument.size();
  }
}
