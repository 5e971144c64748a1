package com.notelinker.engine.dto.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One pair as presented to the LLM for relevance scoring. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoringPair {
  @JsonProperty("id_1")
  private String id1;

  @JsonProperty("id_2")
  private String id2;

  @JsonProperty("title_1")
  private String title1;

  @JsonProperty("title_2")
  private String title2;

  @JsonProperty("content_1")
  private String content1;

  @JsonProperty("content_2")
  private String content2;

  @JsonProperty("similarity_score")
  private double similarityScore;
}
