package com.notelinker.engine.service.similarity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.notelinker.engine.dto.cache.PairKey;
import com.notelinker.engine.dto.cache.PairScore;

import lombok.extern.slf4j.Slf4j;

/**
 * Produces the note pairs worth sending to the LLM: those whose embedding similarity reaches the
 * threshold. Returned pairs are canonical, unique and ordered by descending similarity, and carry
 * no AI score yet.
 */
@Slf4j
@Service
public class CandidatePairService {

  /** Every unordered pair among the given embeddings. */
  public List<PairScore> computeFullCandidates(Map<String, float[]> embeddings, double threshold) {
    List<String> ids = new ArrayList<>(embeddings.keySet());
    List<PairScore> candidates = new ArrayList<>();
    Set<PairKey> seen = new HashSet<>();

    for (int i = 0; i < ids.size(); i++) {
      for (int j = i + 1; j < ids.size(); j++) {
        addIfSimilar(ids.get(i), ids.get(j), embeddings, threshold, seen, candidates);
      }
    }

    candidates.sort(Comparator.comparingDouble(PairScore::getSimilarityScore).reversed());
    log.info(
        "Full candidate pass over {} notes kept {} pairs at threshold {}",
        ids.size(),
        candidates.size(),
        threshold);
    return candidates;
  }

  /**
   * Pairs each changed note with every other note. Two changed notes are paired once.
   * Changed ids without an embedding are ignored.
   */
  public List<PairScore> computeIncrementalCandidates(
      Map<String, float[]> embeddings, Collection<String> changedIds, double threshold) {
    List<PairScore> candidates = new ArrayList<>();
    Set<PairKey> seen = new HashSet<>();

    for (String changedId : changedIds) {
      if (!embeddings.containsKey(changedId)) {
        log.debug("Skipping changed note {} without embedding", changedId);
        continue;
      }
      for (String otherId : embeddings.keySet()) {
        if (!otherId.equals(changedId)) {
          addIfSimilar(changedId, otherId, embeddings, threshold, seen, candidates);
        }
      }
    }

    candidates.sort(Comparator.comparingDouble(PairScore::getSimilarityScore).reversed());
    log.info(
        "Incremental candidate pass for {} changed notes kept {} pairs at threshold {}",
        changedIds.size(),
        candidates.size(),
        threshold);
    return candidates;
  }

  /**
   * Similarity of a specific pair, or {@code null} when either side has no embedding or the two
   * embeddings come from models of different dimension.
   */
  public PairScore computePair(PairKey key, Map<String, float[]> embeddings) {
    float[] first = embeddings.get(key.getFirst());
    float[] second = embeddings.get(key.getSecond());
    if (first == null || second == null || first.length != second.length) {
      return null;
    }
    return PairScore.builder()
        .id1(key.getFirst())
        .id2(key.getSecond())
        .similarityScore(VectorMath.cosineSimilarity(first, second))
        .build();
  }

  private void addIfSimilar(
      String a,
      String b,
      Map<String, float[]> embeddings,
      double threshold,
      Set<PairKey> seen,
      List<PairScore> candidates) {
    PairKey key = PairKey.of(a, b);
    if (!seen.add(key)) {
      return;
    }
    float[] first = embeddings.get(a);
    float[] second = embeddings.get(b);
    if (first.length != second.length) {
      log.warn(
          "Skipping pair {} / {}: embedding dimensions differ ({} vs {})",
          a,
          b,
          first.length,
          second.length);
      return;
    }
    double similarity = VectorMath.cosineSimilarity(first, second);
    if (similarity >= threshold) {
      candidates.add(
          PairScore.builder()
              .id1(key.getFirst())
              .id2(key.getSecond())
              .similarityScore(similarity)
              .build());
    }
  }
}
