package com.notelinker.engine.service.document;

import java.util.List;
import java.util.Optional;

import com.notelinker.engine.dto.document.VaultDocument;

/** Access to the notes the engine reads and rewrites. */
public interface DocumentStore {

  String HASH_BOUNDARY = "<!-- HASH_BOUNDARY -->";

  /** Markdown notes under {@code scanPath}, minus excluded folders and patterns, sorted by path. */
  List<VaultDocument> scan(
      String scanPath, List<String> excludedFolders, List<String> excludedPatterns);

  Optional<VaultDocument> find(String path);

  String read(VaultDocument document);

  void write(VaultDocument document, String text);

  /** The user-authored body: after any front matter, before the hash boundary, trimmed. */
  String extractHashableBody(String text);

  /** Appends the hash boundary at the end of the note unless it already has one. */
  default String ensureHashBoundary(String text) {
    if (text.contains(HASH_BOUNDARY)) {
      return text;
    }
    String separator = !text.isEmpty() && !text.endsWith("\n") ? "\n\n" : "\n";
    return text + separator + HASH_BOUNDARY + "\n";
  }
}
