package com.notelinker.engine.service.orchestration;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.notelinker.engine.dto.cache.DocumentRecord;
import com.notelinker.engine.dto.document.VaultDocument;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.document.DocumentStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Resolves note ids to their cached record and current file contents. */
@Slf4j
@Component
@RequiredArgsConstructor
public class NoteLookup {

  private final CacheStore cacheStore;
  private final DocumentStore documentStore;

  public Optional<NoteSnapshot> load(String documentId) {
    Optional<DocumentRecord> record = cacheStore.getDocument(documentId);
    if (record.isEmpty()) {
      log.warn("Note {} is not in the cache", documentId);
      return Optional.empty();
    }
    Optional<VaultDocument> document = documentStore.find(record.get().getPath());
    if (document.isEmpty()) {
      log.warn("Note {} no longer exists at {}", documentId, record.get().getPath());
      return Optional.empty();
    }
    String text = documentStore.read(document.get());
    return Optional.of(
        new NoteSnapshot(
            record.get(), document.get(), text, documentStore.extractHashableBody(text)));
  }

  /** The note's path for log and journal labels, or the id when it is unknown. */
  public String label(String documentId) {
    return cacheStore.getDocument(documentId).map(DocumentRecord::getPath).orElse(documentId);
  }
}
