package com.notelinker.engine.service.similarity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.notelinker.engine.dto.cache.PairKey;
import com.notelinker.engine.dto.cache.PairScore;

@DisplayName("CandidatePairService Tests")
class CandidatePairServiceTest {

  private CandidatePairService service;
  private Map<String, float[]> embeddings;

  @BeforeEach
  void setUp() {
    service = new CandidatePairService();
    // A-B ~0.80, A-C ~0.30, B-C ~0.81
    embeddings = new LinkedHashMap<>();
    embeddings.put("A", new float[] {1f, 0f});
    embeddings.put("B", new float[] {0.8f, 0.6f});
    embeddings.put("C", new float[] {0.3f, (float) Math.sqrt(0.91)});
  }

  private Set<String> keys(List<PairScore> pairs) {
    return pairs.stream().map(p -> p.key().toString()).collect(Collectors.toSet());
  }

  @Nested
  @DisplayName("Full candidates")
  class FullCandidates {

    @Test
    @DisplayName("Should keep only pairs at or above the threshold")
    void shouldFilterByThreshold() {
      List<PairScore> pairs = service.computeFullCandidates(embeddings, 0.7);

      assertThat(keys(pairs)).containsExactlyInAnyOrder("A:B", "B:C");
      assertThat(pairs).allSatisfy(p -> assertThat(p.getId1()).isLessThan(p.getId2()));
    }

    @Test
    @DisplayName("Should order pairs by descending similarity")
    void shouldSortBySimilarityDescending() {
      List<PairScore> pairs = service.computeFullCandidates(embeddings, 0.0);

      assertThat(pairs).hasSize(3);
      assertThat(pairs.get(0).getSimilarityScore())
          .isGreaterThanOrEqualTo(pairs.get(1).getSimilarityScore());
      assertThat(pairs.get(1).getSimilarityScore())
          .isGreaterThanOrEqualTo(pairs.get(2).getSimilarityScore());
      assertThat(pairs.get(2).key()).isEqualTo(PairKey.of("C", "A"));
      assertThat(pairs.get(2).getSimilarityScore()).isCloseTo(0.3, within(1e-4));
    }

    @Test
    @DisplayName("Should return nothing for a single note")
    void shouldReturnEmptyForSingleNote() {
      assertThat(service.computeFullCandidates(Map.of("A", new float[] {1f}), 0.0)).isEmpty();
    }

    @Test
    @DisplayName("Should leave the AI score unset")
    void shouldNotAssignAiScore() {
      assertThat(service.computeFullCandidates(embeddings, 0.7))
          .allSatisfy(p -> assertThat(p.getAiScore()).isZero());
    }
  }

  @Nested
  @DisplayName("Incremental candidates")
  class IncrementalCandidates {

    @Test
    @DisplayName("Should pair each changed note with every other note")
    void shouldPairChangedNotesWithAll() {
      List<PairScore> pairs = service.computeIncrementalCandidates(embeddings, List.of("C"), 0.0);

      assertThat(keys(pairs)).containsExactlyInAnyOrder("A:C", "B:C");
    }

    @Test
    @DisplayName("Should pair two changed notes only once")
    void shouldNotDuplicatePairsBetweenChangedNotes() {
      List<PairScore> pairs =
          service.computeIncrementalCandidates(embeddings, List.of("A", "B"), 0.0);

      assertThat(pairs).hasSize(3);
      assertThat(keys(pairs)).containsExactlyInAnyOrder("A:B", "A:C", "B:C");
    }

    @Test
    @DisplayName("Should ignore changed ids that have no embedding")
    void shouldIgnoreChangedIdsWithoutEmbedding() {
      List<PairScore> pairs =
          service.computeIncrementalCandidates(embeddings, List.of("missing"), 0.0);

      assertThat(pairs).isEmpty();
    }

    @Test
    @DisplayName("Should apply the threshold")
    void shouldApplyThreshold() {
      List<PairScore> pairs = service.computeIncrementalCandidates(embeddings, List.of("A"), 0.7);

      assertThat(keys(pairs)).containsExactly("A:B");
    }
  }

  @Test
  @DisplayName("Should compute a single pair and return null when a side is missing")
  void shouldComputeSinglePair() {
    PairScore pair = service.computePair(PairKey.of("B", "A"), embeddings);

    assertThat(pair.getId1()).isEqualTo("A");
    assertThat(pair.getSimilarityScore()).isCloseTo(0.8, within(1e-4));
    assertThat(service.computePair(PairKey.of("A", "Z"), embeddings)).isNull();
  }

  @Test
  @DisplayName("Should skip pairs whose embeddings differ in dimension")
  void shouldSkipMismatchedDimensions() {
    embeddings.put("D", new float[] {1f, 0f, 0f});

    List<PairScore> full = service.computeFullCandidates(embeddings, 0.0);
    List<PairScore> incremental =
        service.computeIncrementalCandidates(embeddings, List.of("D", "A"), 0.0);

    assertThat(keys(full)).containsExactlyInAnyOrder("A:B", "A:C", "B:C");
    assertThat(keys(incremental)).containsExactlyInAnyOrder("A:B", "A:C");
    assertThat(service.computePair(PairKey.of("A", "D"), embeddings)).isNull();
  }
}
