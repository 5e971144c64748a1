package com.notelinker.engine.dto.gateway;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaggingNote {
  @JsonProperty("note_id")
  private String id;

  private String title;
  private String content;

  @JsonProperty("existing_tags")
  @Builder.Default
  private List<String> existingTags = new ArrayList<>();
}
