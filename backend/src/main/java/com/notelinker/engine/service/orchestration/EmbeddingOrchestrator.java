package com.notelinker.engine.service.orchestration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.DocumentRecord;
import com.notelinker.engine.dto.cache.EmbeddingVector;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.failure.FailureJournalService;
import com.notelinker.engine.service.gateway.RemoteModelGateway;

import lombok.extern.slf4j.Slf4j;

/**
 * Embeds changed notes in batches. A note's content hash is only advanced once its new embedding
 * is stored, so a failed batch is picked up again on the next run.
 */
@Slf4j
@Service
public class EmbeddingOrchestrator extends BatchOrchestrator<EmbeddingTask, String> {

  private final RemoteModelGateway gateway;
  private final CacheStore cacheStore;
  private final ApplicationProperties properties;

  public EmbeddingOrchestrator(
      FailureJournalService failureJournal,
      RemoteModelGateway gateway,
      CacheStore cacheStore,
      ApplicationProperties properties) {
    super(failureJournal);
    this.gateway = gateway;
    this.cacheStore = cacheStore;
    this.properties = properties;
  }

  /** Model id stored alongside new vectors. */
  public String currentModel() {
    return gateway.getEmbeddingModel();
  }

  /** Returns the ids whose embeddings were stored. */
  public BatchOutcome<String> embedDocuments(List<EmbeddingTask> documents, RunContext context) {
    if (documents.isEmpty()) {
      log.info("All embeddings are up to date");
      return new BatchOutcome<>(OperationType.EMBEDDING);
    }
    log.info("Embedding {} changed notes", documents.size());
    return runBatches(
        documents, properties.getBatch().getEmbeddingSize(), context, "Embedding notes");
  }

  @Override
  protected OperationType operationType() {
    return OperationType.EMBEDDING;
  }

  @Override
  protected List<String> processBatch(List<EmbeddingTask> batch, RunContext context) {
    List<String> texts =
        batch.stream().map(EmbeddingTask::embeddingText).collect(Collectors.toList());
    List<float[]> vectors = gateway.embed(texts);
    String model = gateway.getEmbeddingModel();
    Instant now = Instant.now();

    List<String> stored = new ArrayList<>(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      EmbeddingTask task = batch.get(i);
      cacheStore.saveEmbedding(
          EmbeddingVector.builder()
              .documentId(task.getDocumentId())
              .vector(vectors.get(i))
              .model(model)
              .createdAt(now)
              .build());

      DocumentRecord existing =
          cacheStore
              .getDocument(task.getDocumentId())
              .orElseGet(
                  () -> DocumentRecord.builder().id(task.getDocumentId()).createdAt(now).build());
      cacheStore.upsertDocument(
          existing.toBuilder()
              .path(task.getPath())
              .title(task.getTitle())
              .contentHash(task.getContentHash())
              .modifiedAt(task.getModifiedAt())
              .embeddingUpdatedAt(now)
              .build());

      int invalidated = cacheStore.deleteScoresForDocument(task.getDocumentId());
      if (invalidated > 0) {
        log.debug("Dropped {} stale scores for {}", invalidated, task.getPath());
      }
      stored.add(task.getDocumentId());
    }
    cacheStore.flush();
    return stored;
  }

  @Override
  protected String itemKey(EmbeddingTask item) {
    return item.getDocumentId();
  }

  @Override
  protected String itemLabel(EmbeddingTask item) {
    return item.getPath();
  }
}
