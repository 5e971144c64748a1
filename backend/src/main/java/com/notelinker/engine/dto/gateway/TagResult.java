package com.notelinker.engine.dto.gateway;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonAlias;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TagResult {
  @JsonAlias({"note_id", "noteId"})
  private String id;

  @Builder.Default private List<String> tags = new ArrayList<>();

  private String reasoning;
}
