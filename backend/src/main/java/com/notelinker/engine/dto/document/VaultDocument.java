package com.notelinker.engine.dto.document;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A Markdown note found in the vault. {@code path} is vault-relative with forward slashes. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VaultDocument {
  private String path;
  private String title;
  private Instant modifiedAt;

  /** File name without directories or the {@code .md} extension. */
  public static String titleOf(String path) {
    String name = path.substring(path.lastIndexOf('/') + 1);
    return name.toLowerCase().endsWith(".md") ? name.substring(0, name.length() - 3) : name;
  }

  public static VaultDocument of(String path) {
    return VaultDocument.builder().path(path).title(titleOf(path)).build();
  }
}
