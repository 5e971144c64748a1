package com.notelinker.engine.service.document;

import java.util.List;

import org.springframework.stereotype.Component;

import com.notelinker.engine.dto.document.VaultDocument;
import com.notelinker.engine.service.orchestration.TagWriter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Replaces the {@code tags} list in a note's front matter, re-reading the note first. */
@Slf4j
@Component
@RequiredArgsConstructor
public class FrontMatterTagWriter implements TagWriter {

  private final DocumentStore documentStore;
  private final FrontMatterParser frontMatterParser;

  @Override
  public void writeTags(VaultDocument document, List<String> tags) {
    String current = documentStore.read(document);
    String updated = frontMatterParser.withTags(current, tags);
    if (!updated.equals(current)) {
      documentStore.write(document, updated);
      log.debug("Wrote {} tags to {}", tags.size(), document.getPath());
    }
  }
}
