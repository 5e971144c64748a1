package com.notelinker.engine.service.orchestration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.dto.cache.PairKey;
import com.notelinker.engine.dto.cache.PairScore;
import com.notelinker.engine.dto.gateway.PairScoreResult;
import com.notelinker.engine.dto.gateway.ScoringPair;
import com.notelinker.engine.service.cache.CacheStore;
import com.notelinker.engine.service.failure.FailureJournalService;
import com.notelinker.engine.service.gateway.LLMResponseParser;
import com.notelinker.engine.service.gateway.RemoteModelGateway;

import lombok.extern.slf4j.Slf4j;

/** Sends candidate pairs to the LLM in batches and writes each batch's scores through. */
@Slf4j
@Service
public class ScoringOrchestrator extends BatchOrchestrator<PairScore, PairScore> {

  private final RemoteModelGateway gateway;
  private final CacheStore cacheStore;
  private final NoteLookup noteLookup;
  private final ApplicationProperties properties;

  public ScoringOrchestrator(
      FailureJournalService failureJournal,
      RemoteModelGateway gateway,
      CacheStore cacheStore,
      NoteLookup noteLookup,
      ApplicationProperties properties) {
    super(failureJournal);
    this.gateway = gateway;
    this.cacheStore = cacheStore;
    this.noteLookup = noteLookup;
    this.properties = properties;
  }

  public BatchOutcome<PairScore> scorePairs(List<PairScore> candidates, RunContext context) {
    context.transition(RunState.SCORE_BATCHES);
    if (candidates.isEmpty()) {
      log.info("No pairs to score");
      return new BatchOutcome<>(OperationType.SCORING);
    }
    log.info(
        "Scoring {} pairs in batches of {}",
        candidates.size(),
        properties.getBatch().getScoringSize());
    return runBatches(
        candidates, properties.getBatch().getScoringSize(), context, "Scoring note pairs");
  }

  @Override
  protected OperationType operationType() {
    return OperationType.SCORING;
  }

  @Override
  protected List<PairScore> processBatch(List<PairScore> batch, RunContext context) {
    Map<String, Optional<NoteSnapshot>> notes = new HashMap<>();
    List<PairScore> sendable = new ArrayList<>();
    List<ScoringPair> request = new ArrayList<>();
    int maxChars = properties.getLlm().getScoringMaxChars();

    for (PairScore pair : batch) {
      Optional<NoteSnapshot> first = notes.computeIfAbsent(pair.getId1(), noteLookup::load);
      Optional<NoteSnapshot> second = notes.computeIfAbsent(pair.getId2(), noteLookup::load);
      if (first.isEmpty() || second.isEmpty()) {
        log.warn("Dropping pair {} because one of its notes is missing", pair.key());
        continue;
      }
      sendable.add(pair);
      request.add(
          ScoringPair.builder()
              .id1(pair.getId1())
              .id2(pair.getId2())
              .title1(first.get().getDocument().getTitle())
              .title2(second.get().getDocument().getTitle())
              .content1(first.get().truncatedBody(maxChars))
              .content2(second.get().truncatedBody(maxChars))
              .similarityScore(pair.getSimilarityScore())
              .build());
    }
    if (sendable.isEmpty()) {
      return new ArrayList<>();
    }

    List<PairScoreResult> results = gateway.score(request, properties.getLlm().getScoringPrompt());
    List<PairScore> merged = merge(sendable, results, gateway.getScoringModel(), Instant.now());

    cacheStore.batchSaveScores(merged);
    cacheStore.flush();
    return merged;
  }

  /**
   * Matches results to pairs by id, falling back to position when the counts agree and the result
   * at that position names no other pair. Pairs left without a usable score get the neutral score
   * and a note saying why.
   */
  List<PairScore> merge(
      List<PairScore> pairs, List<PairScoreResult> results, String model, Instant scoredAt) {
    Map<PairKey, PairScoreResult> byKey = new HashMap<>();
    for (PairScoreResult result : results) {
      PairKey key = keyOf(result);
      if (key != null) {
        byKey.putIfAbsent(key, result);
      }
    }
    boolean positional = results.size() == pairs.size();
    if (!positional) {
      log.warn(
          "Score count mismatch: {} results for {} pairs; unmatched pairs get a neutral score",
          results.size(),
          pairs.size());
    }

    List<PairScore> merged = new ArrayList<>(pairs.size());
    for (int i = 0; i < pairs.size(); i++) {
      PairScore pair = pairs.get(i);
      PairScoreResult result = byKey.get(pair.key());
      if (result == null && positional) {
        PairScoreResult candidate = results.get(i);
        PairKey candidateKey = keyOf(candidate);
        if (candidateKey == null || candidateKey.equals(pair.key())) {
          result = candidate;
        }
      }

      double score;
      String reasoning;
      if (result == null) {
        score = LLMResponseParser.NEUTRAL_SCORE;
        reasoning =
            "No score returned by model ("
                + results.size()
                + " results for "
                + pairs.size()
                + " pairs); neutral default applied";
      } else if (result.getScore() == null) {
        score = LLMResponseParser.NEUTRAL_SCORE;
        reasoning = "Model result had no score; neutral default applied";
      } else {
        score = Math.max(0.0, Math.min(10.0, result.getScore()));
        reasoning = result.getReasoning();
      }

      merged.add(
          pair.toBuilder()
              .aiScore(score)
              .reasoning(reasoning)
              .model(model)
              .lastScored(scoredAt)
              .build()
              .canonical());
    }
    return merged;
  }

  @Override
  protected String itemKey(PairScore item) {
    return item.key().toString();
  }

  @Override
  protected String itemLabel(PairScore item) {
    return noteLookup.label(item.getId1()) + " <-> " + noteLookup.label(item.getId2());
  }

  @Override
  protected boolean matchesItem(PairScore item, String itemId) {
    return itemKey(item).equals(itemId) || item.key().contains(itemId);
  }

  private static PairKey keyOf(PairScoreResult result) {
    if (result.getId1() == null
        || result.getId2() == null
        || result.getId1().equals(result.getId2())) {
      return null;
    }
    return PairKey.of(result.getId1(), result.getId2());
  }
}
