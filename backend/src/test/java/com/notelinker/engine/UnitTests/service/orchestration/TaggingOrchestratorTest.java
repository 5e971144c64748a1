package com.notelinker.engine.service.orchestration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.dto.document.VaultDocument;
import com.notelinker.engine.dto.gateway.TagResult;
import com.notelinker.engine.dto.gateway.TaggingNote;
import com.notelinker.engine.exception.ContentException;
import com.notelinker.engine.fixtures.TestFixtures;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.document.FrontMatterParser;
import com.notelinker.engine.service.failure.FailureJournalService;
import com.notelinker.engine.service.gateway.RemoteModelGateway;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaggingOrchestrator Tests")
class TaggingOrchestratorTest {

  @Mock private FailureJournalService failureJournal;
  @Mock private RemoteModelGateway gateway;
  @Mock private CacheStore cacheStore;
  @Mock private NoteLookup noteLookup;
  @Mock private TagWriter tagWriter;

  private TaggingOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    ApplicationProperties properties = new ApplicationProperties();
    orchestrator =
        new TaggingOrchestrator(
            failureJournal,
            gateway,
            cacheStore,
            noteLookup,
            new FrontMatterParser(),
            tagWriter,
            properties);

    lenient().when(noteLookup.load(anyString())).thenAnswer(inv -> snapshot(inv.getArgument(0)));
    lenient().when(noteLookup.label(anyString())).thenAnswer(inv -> inv.getArgument(0) + ".md");
  }

  private static Optional<NoteSnapshot> snapshot(String id) {
    String text = "---\nnote_id: " + id + "\ntags:\n- old\n---\nAbout " + id + "\n";
    return Optional.of(
        new NoteSnapshot(
            TestFixtures.document(id, id + ".md"),
            VaultDocument.of(id + ".md"),
            text,
            "About " + id));
  }

  private static TagResult tags(String id, String... values) {
    return TagResult.builder().id(id).tags(List.of(values)).build();
  }

  @Test
  @DisplayName("Should stage, write and only then commit tags")
  void shouldCommitAfterWrite() {
    when(gateway.tag(anyList(), any(), anyInt(), anyInt()))
        .thenReturn(List.of(tags("n1", "java", "spring", "cache")));

    BatchOutcome<TagResult> outcome =
        orchestrator.generateTags(List.of("n1"), RunContext.detached("tags", false));

    assertThat(outcome.getResults()).extracting(TagResult::getId).containsExactly("n1");
    InOrder order = inOrder(cacheStore, tagWriter);
    order.verify(cacheStore).stageTags("n1", List.of("java", "spring", "cache"));
    order
        .verify(tagWriter)
        .writeTags(any(VaultDocument.class), eq(List.of("java", "spring", "cache")));
    order.verify(cacheStore).markTagsCommitted(eq("n1"), any());
    verify(failureJournal).resolveCoveredFailures(OperationType.TAGGING, List.of("n1"));
  }

  @Test
  @DisplayName("Should pass existing tags and settings to the model")
  void shouldSendExistingTags() {
    when(gateway.tag(anyList(), any(), anyInt(), anyInt())).thenReturn(List.of());
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<TaggingNote>> request = ArgumentCaptor.forClass(List.class);

    orchestrator.generateTags(List.of("n1", "n2"), RunContext.detached("tags", false));

    verify(gateway).tag(request.capture(), any(), eq(3), eq(5));
    assertThat(request.getValue()).hasSize(2);
    assertThat(request.getValue().get(0).getExistingTags()).containsExactly("old");
    assertThat(request.getValue().get(1).getContent()).isEqualTo("About n2");
  }

  @Test
  @DisplayName("Should leave the commit time unset and journal the note when writing fails")
  void shouldNotCommitWhenWriteFails() {
    when(gateway.tag(anyList(), any(), anyInt(), anyInt()))
        .thenReturn(List.of(tags("n1", "a", "b", "c"), tags("n2", "d", "e", "f")));
    lenient()
        .doThrow(new IllegalStateException("disk full"))
        .when(tagWriter)
        .writeTags(argThat(doc -> doc.getPath().equals("n1.md")), anyList());

    BatchOutcome<TagResult> outcome =
        orchestrator.generateTags(List.of("n1", "n2"), RunContext.detached("tags", false));

    assertThat(outcome.getResults()).extracting(TagResult::getId).containsExactly("n2");
    verify(cacheStore, never()).markTagsCommitted(eq("n1"), any());
    verify(cacheStore).markTagsCommitted(eq("n2"), any());
    verify(failureJournal)
        .recordFailure(
            eq(OperationType.TAGGING),
            argThat(batch -> batch.getItemKeys().equals(List.of("n1"))),
            any(ContentException.class));
    verify(failureJournal).resolveCoveredFailures(OperationType.TAGGING, List.of("n2"));
  }

  @Test
  @DisplayName("Should ignore results for unknown notes and empty tag lists")
  void shouldIgnoreUnusableResults() {
    when(gateway.tag(anyList(), any(), anyInt(), anyInt()))
        .thenReturn(List.of(tags("stranger", "x"), tags("n1")));

    BatchOutcome<TagResult> outcome =
        orchestrator.generateTags(List.of("n1"), RunContext.detached("tags", false));

    assertThat(outcome.getResults()).isEmpty();
    verify(cacheStore, never()).stageTags(anyString(), anyList());
    verify(tagWriter, never()).writeTags(any(), anyList());
  }

  @Test
  @DisplayName("Should move the run into the tagging state")
  void shouldTransitionState() {
    RunContext context = RunContext.detached("tags", false);

    orchestrator.generateTags(List.of(), context);

    assertThat(context.getState()).isEqualTo(RunState.TAG_BATCHES);
  }
}
