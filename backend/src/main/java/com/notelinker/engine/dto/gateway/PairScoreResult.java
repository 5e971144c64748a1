package com.notelinker.engine.dto.gateway;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PairScoreResult {
  @JsonProperty("pair_id")
  private Integer pairId;

  @JsonProperty("note_id_1")
  @JsonAlias({"id_1", "id1"})
  private String id1;

  @JsonProperty("note_id_2")
  @JsonAlias({"id_2", "id2"})
  private String id2;

  /** 0 to 10; null when the model gave none. */
  private Double score;

  private String reasoning;
}
