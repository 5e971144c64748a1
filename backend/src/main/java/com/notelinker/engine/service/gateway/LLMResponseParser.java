package com.notelinker.engine.service.gateway;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notelinker.engine.dto.gateway.PairScoreResult;
import com.notelinker.engine.dto.gateway.ScoringPair;
import com.notelinker.engine.dto.gateway.TagResult;
import com.notelinker.engine.dto.gateway.TaggingNote;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Pulls structured results out of free-form LLM replies. Models wrap JSON in code fences, prose or
 * an envelope object, so the parser tries each shape in turn and never throws on bad output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LLMResponseParser {

  public static final double NEUTRAL_SCORE = 5.0;
  public static final String PARSE_FAILURE_REASON = "failed to parse LLM response";

  private static final Pattern CODE_FENCE = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

  private final ObjectMapper objectMapper;

  public List<PairScoreResult> parseScores(String response, List<ScoringPair> pairs) {
    try {
      JsonNode items = extractItems(response, "scores", "results");
      List<PairScoreResult> results = new ArrayList<>();
      for (JsonNode item : items) {
        PairScoreResult result = objectMapper.treeToValue(item, PairScoreResult.class);
        fillIdsFromPairId(result, pairs);
        results.add(result);
      }
      if (!results.isEmpty() && results.stream().allMatch(r -> r.getPairId() != null)) {
        results.sort(Comparator.comparing(PairScoreResult::getPairId));
      }
      if (results.size() != pairs.size()) {
        log.warn("LLM returned {} scores for {} pairs", results.size(), pairs.size());
      }
      return results;
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.error("Failed to parse scoring response: {}", e.getMessage());
      log.debug("Unparseable scoring response: {}", abbreviate(response));
      return pairs.stream()
          .map(
              pair ->
                  PairScoreResult.builder()
                      .id1(pair.getId1())
                      .id2(pair.getId2())
                      .score(NEUTRAL_SCORE)
                      .reasoning(PARSE_FAILURE_REASON)
                      .build())
          .collect(Collectors.toList());
    }
  }

  public List<TagResult> parseTags(String response, List<TaggingNote> notes) {
    try {
      JsonNode items = extractItems(response, "results", "tags");
      List<TagResult> results = new ArrayList<>();
      for (JsonNode item : items) {
        TagResult result = objectMapper.treeToValue(item, TagResult.class);
        result.setTags(normaliseTags(result.getTags()));
        results.add(result);
      }
      return results;
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.error("Failed to parse tagging response: {}", e.getMessage());
      return notes.stream()
          .map(note -> TagResult.builder().id(note.getId()).tags(new ArrayList<>()).build())
          .collect(Collectors.toList());
    }
  }

  /** Finds the JSON array of results in a reply, unwrapping the first matching envelope field. */
  JsonNode extractItems(String response, String... envelopeFields) throws JsonProcessingException {
    if (response == null || response.isBlank()) {
      throw new IllegalArgumentException("Empty LLM response");
    }
    JsonNode root = objectMapper.readTree(extractJson(response));
    if (root.isArray()) {
      return root;
    }
    if (root.isObject()) {
      for (String field : envelopeFields) {
        if (root.path(field).isArray()) {
          return root.get(field);
        }
      }
      return objectMapper.createArrayNode().add(root);
    }
    throw new IllegalArgumentException("LLM response is not a JSON array or object");
  }

  static String extractJson(String response) {
    Matcher fence = CODE_FENCE.matcher(response);
    if (fence.find()) {
      return fence.group(1).trim();
    }
    int arrayStart = response.indexOf('[');
    int objectStart = response.indexOf('{');
    if (arrayStart >= 0 && (objectStart < 0 || arrayStart < objectStart)) {
      int arrayEnd = response.lastIndexOf(']');
      if (arrayEnd > arrayStart) {
        return response.substring(arrayStart, arrayEnd + 1);
      }
    }
    if (objectStart >= 0) {
      int objectEnd = response.lastIndexOf('}');
      if (objectEnd > objectStart) {
        return response.substring(objectStart, objectEnd + 1);
      }
    }
    return response.trim();
  }

  private static void fillIdsFromPairId(PairScoreResult result, List<ScoringPair> pairs) {
    Integer pairId = result.getPairId();
    if (pairId == null || pairId < 1 || pairId > pairs.size()) {
      return;
    }
    ScoringPair pair = pairs.get(pairId - 1);
    if (result.getId1() == null) {
      result.setId1(pair.getId1());
    }
    if (result.getId2() == null) {
      result.setId2(pair.getId2());
    }
  }

  private static List<String> normaliseTags(List<String> tags) {
    Set<String> cleaned = new LinkedHashSet<>();
    if (tags != null) {
      for (String tag : tags) {
        if (tag == null) {
          continue;
        }
        String trimmed = tag.trim();
        while (trimmed.startsWith("#")) {
          trimmed = trimmed.substring(1);
        }
        if (!trimmed.isBlank()) {
          cleaned.add(trimmed);
        }
      }
    }
    return new ArrayList<>(cleaned);
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return null;
    }
    return text.length() > 500 ? text.substring(0, 500) + "…" : text;
  }
}
