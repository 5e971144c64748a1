package com.notelinker.engine.service.workflow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collector;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.CleanupResult;
import com.notelinker.engine.dto.cache.DocumentRecord;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.dto.cache.PairKey;
import com.notelinker.engine.dto.cache.PairScore;
import com.notelinker.engine.dto.document.VaultDocument;
import com.notelinker.engine.dto.gateway.TagResult;
import com.notelinker.engine.dto.link.ReconcileResult;
import com.notelinker.engine.dto.run.HealthReport;
import com.notelinker.engine.dto.run.MaintenanceReport;
import com.notelinker.engine.dto.run.RunReport;
import com.notelinker.engine.dto.run.RunRequest;
import com.notelinker.engine.dto.run.RunStatus;
import com.notelinker.engine.exception.ContentException;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.document.ContentHasher;
import com.notelinker.engine.service.document.DocumentStore;
import com.notelinker.engine.service.document.FrontMatterParser;
import com.notelinker.engine.service.failure.FailureJournalService;
import com.notelinker.engine.service.link.LinkReconciliationService;
import com.notelinker.engine.service.orchestration.BatchOutcome;
import com.notelinker.engine.service.orchestration.EmbeddingOrchestrator;
import com.notelinker.engine.service.orchestration.EmbeddingTask;
import com.notelinker.engine.service.orchestration.NoteLookup;
import com.notelinker.engine.service.orchestration.NoteSnapshot;
import com.notelinker.engine.service.orchestration.RunContext;
import com.notelinker.engine.service.orchestration.RunCoordinator;
import com.notelinker.engine.service.orchestration.RunState;
import com.notelinker.engine.service.orchestration.ScoreFreshnessPolicy;
import com.notelinker.engine.service.orchestration.ScoringOrchestrator;
import com.notelinker.engine.service.orchestration.TaggingOrchestrator;
import com.notelinker.engine.service.similarity.CandidatePairService;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Composes scanning, embedding, scoring, link reconciliation and tagging into the runs exposed by
 * the API. Long runs go through {@link RunCoordinator#launch}; maintenance passes that touch the
 * cache or the notes run synchronously under the same lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkingWorkflowService {

  static final String PROCESS_VAULT = "Process vault";
  static final String RECALIBRATE_LINKS = "Recalibrate links";
  static final String RETRY_FAILURES = "Retry failures";
  static final String GENERATE_TAGS = "Generate tags";
  static final String SYNC_HASHES = "Sync hashes";
  static final String ADD_BOUNDARIES = "Add hash boundaries";
  static final String CLEAN_ORPHANS = "Clean orphaned data";
  static final String CLEAR_CACHE = "Clear cache";

  private final RunCoordinator runCoordinator;
  private final DocumentStore documentStore;
  private final FrontMatterParser frontMatterParser;
  private final ContentHasher contentHasher;
  private final CacheStore cacheStore;
  private final FailureJournalService failureJournal;
  private final CandidatePairService candidatePairService;
  private final ScoreFreshnessPolicy freshnessPolicy;
  private final EmbeddingOrchestrator embeddingOrchestrator;
  private final ScoringOrchestrator scoringOrchestrator;
  private final TaggingOrchestrator taggingOrchestrator;
  private final LinkReconciliationService linkReconciliationService;
  private final NoteLookup noteLookup;
  private final ApplicationProperties properties;

  // ---------------------------------------------------------------- asynchronous runs

  public RunStatus startProcessVault(RunRequest request) {
    return runCoordinator.launch(
        PROCESS_VAULT, resolveForce(request), context -> processVault(request, context));
  }

  public RunStatus startRecalibration() {
    return runCoordinator.launch(RECALIBRATE_LINKS, false, this::recalibrateLinks);
  }

  public RunStatus startRetryFailures() {
    return runCoordinator.launch(RETRY_FAILURES, false, this::retryFailures);
  }

  public RunStatus startTagGeneration(RunRequest request) {
    return runCoordinator.launch(
        GENERATE_TAGS, resolveForce(request), context -> generateTags(request, context));
  }

  /**
   * The full pipeline: prepare notes, embed what changed, score new candidate pairs plus journaled
   * failures, reconcile links of every affected note and tag notes that need it.
   */
  public RunReport processVault(RunRequest request, RunContext context) {
    RunReport report = new RunReport();
    boolean force = context.isForce();

    List<PreparedNote> notes = prepareNotes(scanPath(request), report, context);
    Set<String> scannedIds = notes.stream().map(PreparedNote::getId).collect(toOrderedSet());

    Map<String, String> embeddingModels = cacheStore.getEmbeddingModels();
    String currentModel = embeddingOrchestrator.currentModel();
    List<EmbeddingTask> tasks =
        notes.stream()
            .filter(note -> force || note.needsEmbedding(embeddingModels, currentModel))
            .map(PreparedNote::toEmbeddingTask)
            .collect(Collectors.toList());
    Set<String> changedIds = embed(tasks, report, context);

    context.transition(RunState.COMPUTE_CANDIDATES);
    Map<String, float[]> embeddings = cacheStore.getAllEmbeddings();
    double threshold = properties.getThresholds().getSimilarity();
    List<PairScore> candidates =
        force
            ? candidatePairService.computeFullCandidates(embeddings, threshold)
            : candidatePairService.computeIncrementalCandidates(embeddings, changedIds, threshold);
    report.setCandidatePairs(candidates.size());

    List<PairScore> scored = score(candidates, embeddings, force, report, context);

    Set<String> affected = force ? scannedIds : affectedNotes(changedIds, scored);
    reconcile(affected, report, context);

    if (properties.getTags().isEnabled()) {
      Set<String> toTag = new LinkedHashSet<>(changedIds);
      for (String id : scannedIds) {
        Optional<DocumentRecord> record = cacheStore.getDocument(id);
        boolean neverTagged = record.isPresent() && record.get().getTagsGeneratedAt() == null;
        if (force || (neverTagged && embeddings.containsKey(id))) {
          toTag.add(id);
        }
      }
      tag(toTag, report, context);
    } else {
      log.debug("Tag generation disabled");
    }

    return summarize(report);
  }

  /** Rewrites every note's link region from cached scores with the current thresholds. */
  public RunReport recalibrateLinks(RunContext context) {
    RunReport report = new RunReport();
    Set<String> all =
        cacheStore.getAllDocuments().stream().map(DocumentRecord::getId).collect(toOrderedSet());
    report.setDocumentsScanned(all.size());
    reconcile(all, report, context);
    return summarize(report);
  }

  /** Re-runs only what the failure journal lists, oldest failures included. */
  public RunReport retryFailures(RunContext context) {
    RunReport report = new RunReport();

    List<EmbeddingTask> tasks = new ArrayList<>();
    for (String documentId : failureJournal.getFailedItemKeys(OperationType.EMBEDDING)) {
      Optional<NoteSnapshot> note = noteLookup.load(documentId);
      if (note.isEmpty()) {
        dropVanished(OperationType.EMBEDDING, documentId);
        continue;
      }
      tasks.add(toEmbeddingTask(note.get()));
    }
    report.setRetriedItems(tasks.size());
    Set<String> changedIds = embed(tasks, report, context);

    context.transition(RunState.COMPUTE_CANDIDATES);
    Map<String, float[]> embeddings = cacheStore.getAllEmbeddings();
    List<PairScore> candidates =
        candidatePairService.computeIncrementalCandidates(
            embeddings, changedIds, properties.getThresholds().getSimilarity());
    report.setCandidatePairs(candidates.size());
    List<PairScore> scored = score(candidates, embeddings, false, report, context);
    reconcile(affectedNotes(changedIds, scored), report, context);

    Set<String> toTag = new LinkedHashSet<>();
    for (String documentId : failureJournal.getFailedItemKeys(OperationType.TAGGING)) {
      if (cacheStore.getDocument(documentId).isPresent()) {
        toTag.add(documentId);
      } else {
        dropVanished(OperationType.TAGGING, documentId);
      }
    }
    if (!toTag.isEmpty()) {
      tag(toTag, report, context);
    }
    return summarize(report);
  }

  /** Tags notes on their own; smart mode skips notes whose tags were already written. */
  public RunReport generateTags(RunRequest request, RunContext context) {
    RunReport report = new RunReport();
    List<PreparedNote> notes = prepareNotes(scanPath(request), report, context);
    Set<String> toTag = new LinkedHashSet<>();
    for (PreparedNote note : notes) {
      Optional<DocumentRecord> record = cacheStore.getDocument(note.getId());
      if (context.isForce() || (record.isPresent() && record.get().getTagsGeneratedAt() == null)) {
        toTag.add(note.getId());
      }
    }
    tag(toTag, report, context);
    return summarize(report);
  }

  // ---------------------------------------------------------------- maintenance

  /**
   * Records the current body hash of every note with an id, so unchanged-looking notes are not
   * re-embedded. Notes without an id are skipped.
   */
  public MaintenanceReport syncHashes(RunRequest request) {
    return runCoordinator.runNow(
        SYNC_HASHES,
        false,
        context -> {
          MaintenanceReport report = new MaintenanceReport(SYNC_HASHES);
          List<VaultDocument> documents = scan(scanPath(request));
          report.setScanned(documents.size());
          for (VaultDocument document : documents) {
            context.getCancellationToken().throwIfCancellationRequested();
            String text;
            String id;
            try {
              text = documentStore.read(document);
              id = frontMatterParser.getNoteId(text);
            } catch (ContentException e) {
              log.warn("Skipping {}: {}", document.getPath(), e.getMessage());
              report.setSkipped(report.getSkipped() + 1);
              continue;
            }
            if (id == null) {
              report.setSkipped(report.getSkipped() + 1);
              continue;
            }
            String hash = contentHasher.hash(documentStore.extractHashableBody(text));
            DocumentRecord record =
                cacheStore
                    .getDocument(id)
                    .orElseGet(
                        () -> DocumentRecord.builder().id(id).createdAt(Instant.now()).build());
            cacheStore.upsertDocument(
                record.toBuilder()
                    .path(document.getPath())
                    .title(document.getTitle())
                    .modifiedAt(document.getModifiedAt())
                    .contentHash(hash)
                    .build());
            report.setUpdated(report.getUpdated() + 1);
          }
          cacheStore.flush();
          log.info(
              "Synced hashes of {} notes ({} without id)",
              report.getUpdated(),
              report.getSkipped());
          return report;
        });
  }

  public MaintenanceReport addHashBoundaries() {
    return runCoordinator.runNow(
        ADD_BOUNDARIES,
        false,
        context -> {
          MaintenanceReport report = new MaintenanceReport(ADD_BOUNDARIES);
          List<VaultDocument> documents = scan(properties.getVault().getDefaultScanPath());
          report.setScanned(documents.size());
          for (VaultDocument document : documents) {
            String text;
            try {
              text = documentStore.read(document);
            } catch (ContentException e) {
              log.warn("Skipping {}: {}", document.getPath(), e.getMessage());
              report.setSkipped(report.getSkipped() + 1);
              continue;
            }
            String updated = documentStore.ensureHashBoundary(text);
            if (updated.equals(text)) {
              report.setSkipped(report.getSkipped() + 1);
            } else {
              documentStore.write(document, updated);
              report.setUpdated(report.getUpdated() + 1);
            }
          }
          log.info("Added hash boundary to {} notes", report.getUpdated());
          return report;
        });
  }

  /** Drops records of notes whose file is gone, then everything that referenced them. */
  public CleanupResult cleanOrphanedData() {
    return runCoordinator.runNow(
        CLEAN_ORPHANS,
        false,
        context -> {
          Set<String> livePaths =
              documentStore.scan("", List.of(), List.of()).stream()
                  .map(VaultDocument::getPath)
                  .collect(Collectors.toSet());
          int removed = 0;
          for (DocumentRecord record : cacheStore.getAllDocuments()) {
            if (!livePaths.contains(record.getPath())
                && cacheStore.deleteDocument(record.getId())) {
              log.info("Removed orphaned note {} ({})", record.getId(), record.getPath());
              removed++;
            }
          }
          CleanupResult result = cacheStore.cleanupOrphans();
          result.setDocuments(removed);
          cacheStore.flush();
          return result;
        });
  }

  /** Read-only comparison of cache and vault. */
  public HealthReport healthCheck() {
    List<VaultDocument> documents = documentStore.scan("", List.of(), List.of());
    Set<String> livePaths =
        documents.stream().map(VaultDocument::getPath).collect(Collectors.toSet());
    Set<String> embedded = cacheStore.getAllEmbeddings().keySet();

    int orphaned = 0;
    int withoutEmbedding = 0;
    for (DocumentRecord record : cacheStore.getAllDocuments()) {
      if (!livePaths.contains(record.getPath())) {
        orphaned++;
      } else if (!embedded.contains(record.getId())) {
        withoutEmbedding++;
      }
    }

    int missingIds = 0;
    int missingBoundaries = 0;
    int unreadable = 0;
    for (VaultDocument document : documents) {
      String text;
      try {
        text = documentStore.read(document);
      } catch (ContentException e) {
        unreadable++;
        continue;
      }
      if (frontMatterParser.getNoteId(text) == null) {
        missingIds++;
      }
      if (!text.contains(DocumentStore.HASH_BOUNDARY)) {
        missingBoundaries++;
      }
    }

    HealthReport report =
        HealthReport.builder()
            .statistics(cacheStore.getStatistics())
            .orphanedDocuments(orphaned)
            .missingNoteIds(missingIds)
            .missingBoundaries(missingBoundaries)
            .documentsWithoutEmbedding(withoutEmbedding)
            .build();
    if (orphaned > 0) {
      report.getIssues().add(orphaned + " cached notes no longer exist in the vault");
    }
    if (missingIds > 0) {
      report.getIssues().add(missingIds + " notes have no note_id");
    }
    if (unreadable > 0) {
      report.getIssues().add(unreadable + " notes are not valid UTF-8");
    }
    if (missingBoundaries > 0) {
      report.getIssues().add(missingBoundaries + " notes have no hash boundary");
    }
    if (withoutEmbedding > 0) {
      report.getIssues().add(withoutEmbedding + " cached notes have no embedding");
    }
    long unresolved = report.getStatistics().getUnresolvedFailures();
    if (unresolved > 0) {
      report.getIssues().add(unresolved + " unresolved failures waiting for retry");
    }
    return report;
  }

  public void clearCache() {
    runCoordinator.runNow(
        CLEAR_CACHE,
        false,
        context -> {
          cacheStore.clearAll();
          cacheStore.flush();
          return null;
        });
  }

  // ---------------------------------------------------------------- steps

  /**
   * Gives every scanned note an id and a hash boundary and keeps its cached path and title current.
   * The content hash is left for the embedding step to advance.
   */
  List<PreparedNote> prepareNotes(String scanPath, RunReport report, RunContext context) {
    List<VaultDocument> documents = scan(scanPath);
    report.setDocumentsScanned(documents.size());

    Map<String, PreparedNote> prepared = new LinkedHashMap<>();
    for (int i = 0; i < documents.size(); i++) {
      context.getCancellationToken().throwIfCancellationRequested();
      VaultDocument document = documents.get(i);
      String text;
      String updated;
      try {
        text = documentStore.read(document);
        updated = documentStore.ensureHashBoundary(frontMatterParser.ensureNoteId(text));
      } catch (ContentException e) {
        report.addWarning(document.getPath() + ": " + e.getReason() + "; note skipped");
        log.warn("Skipping {}: {}", document.getPath(), e.getMessage());
        continue;
      }
      if (!updated.equals(text)) {
        documentStore.write(document, updated);
        report.setDocumentsPrepared(report.getDocumentsPrepared() + 1);
      }

      String id = frontMatterParser.getNoteId(updated);
      if (prepared.containsKey(id)) {
        report.addWarning(
            "Duplicate note_id " + id + " in " + document.getPath() + "; note skipped");
        log.warn(
            "{} shares note_id {} with {}, skipping it",
            document.getPath(),
            id,
            prepared.get(id).getDocument().getPath());
        continue;
      }

      DocumentRecord record = registerDocument(id, document);
      String body = documentStore.extractHashableBody(updated);
      prepared.put(
          id, new PreparedNote(id, document, record, body, contentHasher.hash(body)));
      context.reportProgress("Preparing notes", i + 1, documents.size());
    }
    cacheStore.flush();
    log.info(
        "Prepared {} notes ({} files updated)", prepared.size(), report.getDocumentsPrepared());
    return new ArrayList<>(prepared.values());
  }

  private DocumentRecord registerDocument(String id, VaultDocument document) {
    Optional<DocumentRecord> atPath = cacheStore.getDocumentByPath(document.getPath());
    if (atPath.isPresent() && !atPath.get().getId().equals(id)) {
      log.warn(
          "{} changed its note_id from {} to {}", document.getPath(), atPath.get().getId(), id);
      cacheStore.deleteDocument(atPath.get().getId());
      cacheStore.cleanupOrphans();
    }

    Optional<DocumentRecord> existing = cacheStore.getDocument(id);
    if (existing.isPresent()
        && document.getPath().equals(existing.get().getPath())
        && document.getTitle().equals(existing.get().getTitle())) {
      return existing.get();
    }
    DocumentRecord record =
        existing
            .orElseGet(() -> DocumentRecord.builder().id(id).createdAt(Instant.now()).build())
            .toBuilder()
            .path(document.getPath())
            .title(document.getTitle())
            .modifiedAt(document.getModifiedAt())
            .build();
    cacheStore.upsertDocument(record);
    if (existing.isPresent()) {
      log.info("Note {} moved from {} to {}", id, existing.get().getPath(), document.getPath());
    }
    return record;
  }

  private Set<String> embed(List<EmbeddingTask> tasks, RunReport report, RunContext context) {
    BatchOutcome<String> outcome = embeddingOrchestrator.embedDocuments(tasks, context);
    absorb(report, outcome);
    report.setDocumentsEmbedded(outcome.getResults().size());
    return new LinkedHashSet<>(outcome.getResults());
  }

  /**
   * Adds journaled scoring failures to the candidates and drops fresh pairs. Journaled pairs are
   * always re-scored, whatever their age.
   */
  private List<PairScore> score(
      List<PairScore> candidates,
      Map<String, float[]> embeddings,
      boolean force,
      RunReport report,
      RunContext context) {
    Map<PairKey, PairScore> work = new LinkedHashMap<>();
    Set<PairKey> journaled = new HashSet<>();
    for (String key : failureJournal.getFailedItemKeys(OperationType.SCORING)) {
      PairKey pairKey;
      try {
        pairKey = PairKey.parse(key);
      } catch (IllegalArgumentException e) {
        log.warn("Ignoring malformed journaled pair key {}", key);
        continue;
      }
      PairScore pair = candidatePairService.computePair(pairKey, embeddings);
      if (pair != null) {
        work.put(pairKey, pair);
        journaled.add(pairKey);
      } else if (cacheStore.getDocument(pairKey.getFirst()).isEmpty()
          || cacheStore.getDocument(pairKey.getSecond()).isEmpty()) {
        dropVanished(OperationType.SCORING, key);
      }
    }
    if (!journaled.isEmpty()) {
      log.info("Re-scoring {} pairs from earlier failed batches", journaled.size());
      report.setRetriedItems(report.getRetriedItems() + journaled.size());
    }

    Instant now = Instant.now();
    int skipped = 0;
    for (PairScore candidate : candidates) {
      PairKey key = candidate.key();
      if (work.containsKey(key)) {
        continue;
      }
      Optional<PairScore> existing = cacheStore.getScore(key.getFirst(), key.getSecond());
      if (freshnessPolicy.shouldSkip(existing.orElse(null), force, now)) {
        skipped++;
        continue;
      }
      work.put(key, candidate);
    }
    report.setPairsSkipped(skipped);
    if (skipped > 0) {
      log.info("Skipping {} pairs scored within {}", skipped, properties.getFreshnessWindow());
    }

    BatchOutcome<PairScore> outcome =
        scoringOrchestrator.scorePairs(new ArrayList<>(work.values()), context);
    absorb(report, outcome);
    report.setPairsScored(outcome.getResults().size());
    return outcome.getResults();
  }

  /** Changed notes, members of freshly scored pairs and notes whose links point at a change. */
  Set<String> affectedNotes(Collection<String> changedIds, List<PairScore> scored) {
    Set<String> affected = new LinkedHashSet<>(changedIds);
    for (PairScore pair : scored) {
      affected.add(pair.getId1());
      affected.add(pair.getId2());
    }
    for (String changedId : changedIds) {
      affected.addAll(cacheStore.getSourcesLinkingTo(changedId));
    }
    return affected;
  }

  private void reconcile(Set<String> documentIds, RunReport report, RunContext context) {
    int done = 0;
    for (String documentId : documentIds) {
      context.getCancellationToken().throwIfCancellationRequested();
      ReconcileResult result = linkReconciliationService.reconcileDocument(documentId);
      report.setLinksAdded(report.getLinksAdded() + result.getAdded());
      report.setLinksRemoved(report.getLinksRemoved() + result.getRemoved());
      if (result.isChanged()) {
        report.setNotesReconciled(report.getNotesReconciled() + 1);
      }
      context.reportProgress("Reconciling links", ++done, documentIds.size());
    }
    cacheStore.flush();
    log.info(
        "Reconciled {} notes: {} links added, {} removed",
        documentIds.size(),
        report.getLinksAdded(),
        report.getLinksRemoved());
  }

  private void tag(Set<String> documentIds, RunReport report, RunContext context) {
    Set<String> ids = new LinkedHashSet<>(documentIds);
    for (String documentId : failureJournal.getFailedItemKeys(OperationType.TAGGING)) {
      if (cacheStore.getDocument(documentId).isPresent()) {
        ids.add(documentId);
      }
    }
    BatchOutcome<TagResult> outcome =
        taggingOrchestrator.generateTags(new ArrayList<>(ids), context);
    absorb(report, outcome);
    report.setNotesTagged(outcome.getResults().size());
  }

  private void dropVanished(OperationType type, String itemKey) {
    log.warn("Dropping journaled {} item {}: its note is gone", type.dbValue(), itemKey);
    failureJournal.resolveCoveredFailures(type, List.of(itemKey));
  }

  private void absorb(RunReport report, BatchOutcome<?> outcome) {
    report.setFailedBatches(report.getFailedBatches() + outcome.getFailedBatches());
    report.setSkippedItems(report.getSkippedItems() + outcome.getSkippedItems());
    if (outcome.hasFailures()) {
      report.addWarning(
          outcome.getFailedBatches()
              + " "
              + outcome.getOperation().dbValue()
              + " batches failed; use retry-failures to re-run them");
    }
  }

  private RunReport summarize(RunReport report) {
    cacheStore.flush();
    if (report.getFailedBatches() > 0) {
      log.warn("{} batches failed", report.getFailedBatches());
    }
    return report;
  }

  private EmbeddingTask toEmbeddingTask(NoteSnapshot note) {
    return EmbeddingTask.builder()
        .documentId(note.getRecord().getId())
        .path(note.getDocument().getPath())
        .title(note.getDocument().getTitle())
        .contentHash(contentHasher.hash(note.getBody()))
        .body(note.getBody())
        .modifiedAt(note.getDocument().getModifiedAt())
        .build();
  }

  private List<VaultDocument> scan(String scanPath) {
    ApplicationProperties.Vault vault = properties.getVault();
    return documentStore.scan(scanPath, vault.getExcludedFolders(), vault.getExcludedPatterns());
  }

  private String scanPath(RunRequest request) {
    if (request != null && request.getPath() != null && !request.getPath().isBlank()) {
      return request.getPath();
    }
    return properties.getVault().getDefaultScanPath();
  }

  private boolean resolveForce(RunRequest request) {
    if (request != null && request.getForce() != null) {
      return request.getForce();
    }
    return properties.isForceModeDefault();
  }

  private static Collector<String, ?, Set<String>> toOrderedSet() {
    return Collectors.toCollection(LinkedHashSet::new);
  }

  /** A scanned note with its id assigned and its current body hashed. */
  @Getter
  @AllArgsConstructor
  static final class PreparedNote {
    private final String id;
    private final VaultDocument document;
    private final DocumentRecord record;
    private final String body;
    private final String contentHash;

    /** True when the body changed, no vector is stored or it came from another model. */
    boolean needsEmbedding(Map<String, String> embeddingModels, String currentModel) {
      return !Objects.equals(contentHash, record.getContentHash())
          || !embeddingModels.containsKey(id)
          || !Objects.equals(embeddingModels.get(id), currentModel);
    }

    EmbeddingTask toEmbeddingTask() {
      return EmbeddingTask.builder()
          .documentId(id)
          .path(document.getPath())
          .title(document.getTitle())
          .contentHash(contentHash)
          .body(body)
          .modifiedAt(document.getModifiedAt())
          .build();
    }
  }
}
