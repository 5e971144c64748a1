package com.notelinker.engine.service.cache;

import lombok.Builder;
import lombok.Value;

/** Optional thresholds and a result cap for score lookups. Null thresholds are not applied. */
@Value
@Builder
public class ScoreFilter {

  public static final int DEFAULT_LIMIT = 100;

  Double minSimilarity;
  Double minAiScore;
  @Builder.Default int limit = DEFAULT_LIMIT;

  public static ScoreFilter unfiltered() {
    return ScoreFilter.builder().limit(Integer.MAX_VALUE).build();
  }

  public static ScoreFilter top(double minSimilarity, double minAiScore, int limit) {
    return ScoreFilter.builder()
        .minSimilarity(minSimilarity)
        .minAiScore(minAiScore)
        .limit(limit)
        .build();
  }
}
