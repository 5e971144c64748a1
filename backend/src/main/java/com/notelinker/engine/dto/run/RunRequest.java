package com.notelinker.engine.dto.run;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

  /** Vault-relative folder to scan; blank means the configured default. */
  @Pattern(regexp = "^(?!.*\\.\\.).*$", message = "path must not contain '..'")
  @JsonProperty("path")
  private String path;

  /** Null falls back to {@code linker.force-mode-default}. */
  @JsonProperty("force")
  private Boolean force;
}
