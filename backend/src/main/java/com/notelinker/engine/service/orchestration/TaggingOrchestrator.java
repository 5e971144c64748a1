package com.notelinker.engine.service.orchestration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.BatchDescriptor;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.dto.gateway.TagResult;
import com.notelinker.engine.dto.gateway.TaggingNote;
import com.notelinker.engine.exception.ContentException;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.document.FrontMatterParser;
import com.notelinker.engine.service.failure.FailureJournalService;
import com.notelinker.engine.service.gateway.RemoteModelGateway;

import lombok.extern.slf4j.Slf4j;

/**
 * Generates tags in batches. Tags are staged in the cache first; {@code tags_generated_at} is only
 * set once the {@link TagWriter} has put them into the note.
 */
@Slf4j
@Service
public class TaggingOrchestrator extends BatchOrchestrator<String, TagResult> {

  private final RemoteModelGateway gateway;
  private final CacheStore cacheStore;
  private final NoteLookup noteLookup;
  private final FrontMatterParser frontMatterParser;
  private final TagWriter tagWriter;
  private final ApplicationProperties properties;

  public TaggingOrchestrator(
      FailureJournalService failureJournal,
      RemoteModelGateway gateway,
      CacheStore cacheStore,
      NoteLookup noteLookup,
      FrontMatterParser frontMatterParser,
      TagWriter tagWriter,
      ApplicationProperties properties) {
    super(failureJournal);
    this.gateway = gateway;
    this.cacheStore = cacheStore;
    this.noteLookup = noteLookup;
    this.frontMatterParser = frontMatterParser;
    this.tagWriter = tagWriter;
    this.properties = properties;
  }

  public BatchOutcome<TagResult> generateTags(List<String> documentIds, RunContext context) {
    context.transition(RunState.TAG_BATCHES);
    if (documentIds.isEmpty()) {
      log.info("No notes to tag");
      return new BatchOutcome<>(OperationType.TAGGING);
    }
    log.info(
        "Tagging {} notes in batches of {}",
        documentIds.size(),
        properties.getBatch().getTaggingSize());
    return runBatches(
        documentIds, properties.getBatch().getTaggingSize(), context, "Generating tags");
  }

  @Override
  protected OperationType operationType() {
    return OperationType.TAGGING;
  }

  @Override
  protected List<TagResult> processBatch(List<String> batch, RunContext context) {
    ApplicationProperties.Tags tagSettings = properties.getTags();
    int maxChars = properties.getLlm().getTaggingMaxChars();

    Map<String, NoteSnapshot> notes = new LinkedHashMap<>();
    List<TaggingNote> request = new ArrayList<>();
    for (String id : batch) {
      Optional<NoteSnapshot> note = noteLookup.load(id);
      if (note.isEmpty()) {
        continue;
      }
      notes.put(id, note.get());
      request.add(
          TaggingNote.builder()
              .id(id)
              .title(note.get().getDocument().getTitle())
              .content(note.get().truncatedBody(maxChars))
              .existingTags(frontMatterParser.getTags(note.get().getText()))
              .build());
    }
    if (request.isEmpty()) {
      return new ArrayList<>();
    }

    List<TagResult> results =
        gateway.tag(
            request,
            properties.getLlm().getTaggingPrompt(),
            tagSettings.getMinTags(),
            tagSettings.getMaxTags());

    List<TagResult> staged = new ArrayList<>();
    for (TagResult result : results) {
      if (result.getId() == null || !notes.containsKey(result.getId())) {
        log.warn("Ignoring tags for unexpected note id {}", result.getId());
        continue;
      }
      if (result.getTags().isEmpty()) {
        log.warn("No tags generated for {}", notes.get(result.getId()).getDocument().getPath());
        continue;
      }
      cacheStore.stageTags(result.getId(), result.getTags());
      staged.add(result);
    }
    cacheStore.flush();

    List<TagResult> committed = new ArrayList<>();
    for (TagResult result : staged) {
      NoteSnapshot note = notes.get(result.getId());
      try {
        tagWriter.writeTags(note.getDocument(), result.getTags());
      } catch (RuntimeException e) {
        log.error("Could not write tags to {}: {}", note.getDocument().getPath(), e.getMessage());
        failureJournal.recordFailure(
            OperationType.TAGGING,
            BatchDescriptor.builder()
                .batchNumber(1)
                .totalBatches(1)
                .itemKeys(List.of(result.getId()))
                .labels(List.of(note.getDocument().getPath()))
                .build(),
            new ContentException(
                "Could not write tags to " + note.getDocument().getPath(),
                result.getId(),
                e.getMessage()));
        continue;
      }
      cacheStore.markTagsCommitted(result.getId(), Instant.now());
      committed.add(result);
    }
    cacheStore.flush();
    log.debug("Committed tags for {} of {} notes", committed.size(), batch.size());
    return committed;
  }

  /** Only notes whose tags reached the file count as recovered. */
  @Override
  protected Collection<String> succeededKeys(List<String> batch, List<TagResult> results) {
    return results.stream().map(TagResult::getId).collect(Collectors.toList());
  }

  @Override
  protected String itemKey(String item) {
    return item;
  }

  @Override
  protected String itemLabel(String item) {
    return noteLookup.label(item);
  }
}
