package com.notelinker.engine.service.orchestration;

import java.util.List;

import com.notelinker.engine.dto.document.VaultDocument;

/** Writes generated tags back into a note. Throws when the note could not be updated. */
@FunctionalInterface
public interface TagWriter {
  void writeTags(VaultDocument document, List<String> tags);
}
