package com.notelinker.engine.service.link;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.DocumentRecord;
import com.notelinker.engine.dto.cache.PairScore;
import com.notelinker.engine.dto.document.VaultDocument;
import com.notelinker.engine.dto.link.ReconcileResult;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.cache.ScoreFilter;
import com.notelinker.engine.service.document.DocumentStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the link region of each note in line with its scores. Everything after the hash boundary
 * belongs to this service; everything before it is never touched.
 *
 * <p>Links only go from the first member of a canonical pair to the second. The reverse direction
 * shows up as a backlink in the note editor.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LinkReconciliationService {

  private final CacheStore cacheStore;
  private final DocumentStore documentStore;
  private final ApplicationProperties properties;

  /** Targets for {@code documentId} by descending AI score, capped, without threshold checks. */
  public List<String> findBestLinks(String documentId, List<PairScore> scoredPairs) {
    return outgoing(documentId, scoredPairs).stream()
        .limit(properties.getLinks().getMaxPerNote())
        .map(PairScore::getId2)
        .collect(Collectors.toList());
  }

  /** Like {@link #findBestLinks} but keeping only pairs that clear both thresholds. */
  public Set<String> getDesiredTargetsFor(String documentId, List<PairScore> scoredPairs) {
    double minSimilarity = properties.getThresholds().getSimilarity();
    double minAiScore = properties.getThresholds().getMinAiScore();
    return outgoing(documentId, scoredPairs).stream()
        .filter(pair -> pair.getSimilarityScore() >= minSimilarity)
        .filter(pair -> pair.getAiScore() >= minAiScore)
        .limit(properties.getLinks().getMaxPerNote())
        .map(PairScore::getId2)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /** Stable sort, so equal scores keep their input order. */
  private List<PairScore> outgoing(String documentId, List<PairScore> scoredPairs) {
    List<PairScore> relevant =
        scoredPairs.stream()
            .filter(pair -> documentId.equals(pair.getId1()))
            .collect(Collectors.toCollection(ArrayList::new));
    relevant.sort(Comparator.comparingDouble(PairScore::getAiScore).reversed());
    return relevant;
  }

  /**
   * Rewrites the link region of {@code document} to list exactly {@code desiredTargetIds} and
   * replaces its ledger entries to match. A note without the hash boundary is left alone.
   */
  public ReconcileResult reconcileUsingLedger(
      VaultDocument document, String documentId, Collection<String> desiredTargetIds) {
    String text = documentStore.read(document);
    int boundary = text.indexOf(DocumentStore.HASH_BOUNDARY);
    if (boundary < 0) {
      log.debug("No hash boundary in {}, skipping link update", document.getPath());
      return ReconcileResult.unchanged();
    }

    Set<String> desired = new LinkedHashSet<>(desiredTargetIds);
    Set<String> current = cacheStore.getLinkTargets(documentId);
    int added = (int) desired.stream().filter(id -> !current.contains(id)).count();
    int removed = (int) current.stream().filter(id -> !desired.contains(id)).count();

    String head = text.substring(0, boundary + DocumentStore.HASH_BOUNDARY.length());
    String updated = head + renderLinkRegion(desired);
    if (!updated.equals(text)) {
      documentStore.write(document, updated);
    }
    if (added > 0 || removed > 0) {
      cacheStore.replaceLinkTargets(documentId, desired);
      log.info("Updated links in {}: +{} -{}", document.getPath(), added, removed);
    }
    return new ReconcileResult(added, removed);
  }

  /** Reconciles one note against its cached scores. Unknown or vanished notes are skipped. */
  public ReconcileResult reconcileDocument(String documentId) {
    Optional<DocumentRecord> record = cacheStore.getDocument(documentId);
    if (record.isEmpty()) {
      log.debug("Skipping link update for unknown note {}", documentId);
      return ReconcileResult.unchanged();
    }
    Optional<VaultDocument> document = documentStore.find(record.get().getPath());
    if (document.isEmpty()) {
      log.warn("Skipping link update for missing file {}", record.get().getPath());
      return ReconcileResult.unchanged();
    }
    List<PairScore> scores = cacheStore.getScoresForDocument(documentId, ScoreFilter.unfiltered());
    Set<String> desired =
        getDesiredTargetsFor(documentId, scores).stream()
            .filter(targetId -> cacheStore.getDocument(targetId).isPresent())
            .collect(Collectors.toCollection(LinkedHashSet::new));
    return reconcileUsingLedger(document.get(), documentId, desired);
  }

  /** {@code [[Display Name]]} for a note id: its title, else its file name, else the id. */
  public String formatWikiLink(String targetId) {
    Optional<DocumentRecord> target = cacheStore.getDocument(targetId);
    String name = targetId;
    if (target.isPresent()) {
      DocumentRecord record = target.get();
      if (record.getTitle() != null && !record.getTitle().isBlank()) {
        name = record.getTitle();
      } else if (record.getPath() != null) {
        name = VaultDocument.titleOf(record.getPath());
      }
    }
    return "[[" + name + "]]";
  }

  String renderLinkRegion(Collection<String> targetIds) {
    StringBuilder region = new StringBuilder("\n");
    for (String targetId : targetIds) {
      region.append("- ").append(formatWikiLink(targetId)).append('\n');
    }
    return region.toString();
  }
}
