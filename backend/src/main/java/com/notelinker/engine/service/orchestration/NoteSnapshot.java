package com.notelinker.engine.service.orchestration;

import com.notelinker.engine.dto.cache.DocumentRecord;
import com.notelinker.engine.dto.document.VaultDocument;

import lombok.AllArgsConstructor;
import lombok.Getter;

/** A cached note together with its current text, read once per batch. */
@Getter
@AllArgsConstructor
public class NoteSnapshot {
  private final DocumentRecord record;
  private final VaultDocument document;
  private final String text;
  /** Text between front matter and the hash boundary, trimmed. */
  private final String body;

  public String truncatedBody(int maxChars) {
    return body.length() > maxChars ? body.substring(0, maxChars) : body;
  }
}
