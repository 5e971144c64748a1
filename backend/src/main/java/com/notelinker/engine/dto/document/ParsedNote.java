package com.notelinker.engine.dto.document;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParsedNote {
  private Map<String, Object> frontMatter = new LinkedHashMap<>();
  private String body;
  private boolean hasFrontMatter;
  /** Front matter present but not valid YAML; such notes must not be rewritten. */
  private boolean malformed;
}
