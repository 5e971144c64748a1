package com.notelinker.engine.service.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.DocumentRecord;
import com.notelinker.engine.dto.cache.EmbeddingVector;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.exception.TransientException;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.failure.FailureJournalService;
import com.notelinker.engine.service.gateway.RemoteModelGateway;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingOrchestrator Tests")
class EmbeddingOrchestratorTest {

  @Mock private FailureJournalService failureJournal;
  @Mock private RemoteModelGateway gateway;
  @Mock private CacheStore cacheStore;

  private EmbeddingOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    orchestrator =
        new EmbeddingOrchestrator(failureJournal, gateway, cacheStore, new ApplicationProperties());
    lenient().when(gateway.getEmbeddingModel()).thenReturn("jina-embeddings-v3");
    lenient().when(cacheStore.getDocument(anyString())).thenReturn(Optional.empty());
  }

  private static EmbeddingTask task(String id, String body) {
    return EmbeddingTask.builder()
        .documentId(id)
        .path("notes/" + id + ".md")
        .title(id)
        .contentHash("hash-" + id)
        .body(body)
        .modifiedAt(Instant.parse("2024-01-01T00:00:00Z"))
        .build();
  }

  @Test
  @DisplayName("Should store vectors, advance the content hash and drop stale scores")
  void shouldStoreEmbeddingsAndAdvanceHash() {
    when(gateway.embed(anyList())).thenReturn(List.of(new float[] {1f, 0f}));

    BatchOutcome<String> outcome =
        orchestrator.embedDocuments(
            List.of(task("n1", "Some body")), RunContext.detached("embed", false));

    assertThat(outcome.getResults()).containsExactly("n1");
    ArgumentCaptor<EmbeddingVector> vector = ArgumentCaptor.forClass(EmbeddingVector.class);
    verify(cacheStore).saveEmbedding(vector.capture());
    assertThat(vector.getValue().getModel()).isEqualTo("jina-embeddings-v3");
    ArgumentCaptor<DocumentRecord> record = ArgumentCaptor.forClass(DocumentRecord.class);
    verify(cacheStore).upsertDocument(record.capture());
    assertThat(record.getValue().getContentHash()).isEqualTo("hash-n1");
    assertThat(record.getValue().getPath()).isEqualTo("notes/n1.md");
    assertThat(record.getValue().getEmbeddingUpdatedAt()).isNotNull();
    assertThat(record.getValue().getCreatedAt()).isNotNull();
    verify(cacheStore).deleteScoresForDocument("n1");
    verify(cacheStore).flush();
  }

  @Test
  @DisplayName("Should embed the title when the body is blank")
  void shouldFallBackToTitle() {
    when(gateway.embed(anyList())).thenReturn(List.of(new float[] {1f}));

    orchestrator.embedDocuments(List.of(task("Empty note", "  ")), RunContext.detached("e", false));

    verify(gateway).embed(List.of("Empty note"));
  }

  @Test
  @DisplayName("Should keep the old hash and journal the batch when embedding fails")
  void shouldJournalFailedBatch() {
    when(gateway.embed(anyList())).thenThrow(new TransientException("Rate limit exceeded", 429));

    BatchOutcome<String> outcome =
        orchestrator.embedDocuments(
            List.of(task("n1", "a"), task("n2", "b")), RunContext.detached("embed", false));

    assertThat(outcome.getResults()).isEmpty();
    assertThat(outcome.getFailedBatches()).isEqualTo(1);
    verify(cacheStore, never()).upsertDocument(any());
    verify(failureJournal)
        .recordFailure(
            eq(OperationType.EMBEDDING),
            argThat(
                batch ->
                    batch.getItemKeys().equals(List.of("n1", "n2"))
                        && batch.getLabels().equals(List.of("notes/n1.md", "notes/n2.md"))),
            any(TransientException.class));
  }
}
