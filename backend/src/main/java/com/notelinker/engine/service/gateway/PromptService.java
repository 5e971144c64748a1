package com.notelinker.engine.service.gateway;

import java.util.List;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.notelinker.engine.dto.gateway.ScoringPair;
import com.notelinker.engine.dto.gateway.TaggingNote;

import lombok.RequiredArgsConstructor;

/** Builds the scoring and tagging prompts sent to whichever LLM is configured. */
@Service
@RequiredArgsConstructor
public class PromptService {

  public static final String DEFAULT_SCORING_PROMPT =
      "You evaluate how strongly pairs of personal notes are related. The notes may be knowledge"
          + " notes, poetry, creative drafts, prose or journal entries.\n\n"
          + "Give every pair an integer score from 0 to 10:\n"
          + "10: deep association. One note extends, answers or completes the other.\n"
          + "8-9: strong association. Shared core themes, emotions or imagery.\n"
          + "6-7: clear association. Reading them side by side adds something.\n"
          + "4-5: moderate association. Some shared elements, different main direction.\n"
          + "1-3: weak association. Only surface overlap.\n"
          + "0: unrelated.\n"
          + "The similarity_score is an embedding similarity hint, not a verdict.";

  public static final String DEFAULT_TAGGING_PROMPT =
      "You suggest tags for personal notes. Tags are short, lowercase, use hyphens instead of"
          + " spaces and describe the note's subject rather than its format. Reuse existing tags"
          + " where they still fit.";

  private final ObjectMapper objectMapper;

  public String buildScoringPrompt(List<ScoringPair> pairs, String customPrompt) {
    ArrayNode pairNodes = objectMapper.createArrayNode();
    for (int i = 0; i < pairs.size(); i++) {
      ScoringPair pair = pairs.get(i);
      ObjectNode node = pairNodes.addObject();
      node.put("pair_id", i + 1);
      node.set("note_1", note(pair.getId1(), pair.getTitle1(), pair.getContent1()));
      node.set("note_2", note(pair.getId2(), pair.getTitle2(), pair.getContent2()));
      node.put("similarity_score", Math.round(pair.getSimilarityScore() * 1000.0) / 1000.0);
    }
    ObjectNode payload = objectMapper.createObjectNode();
    payload.set("pairs", pairNodes);

    return basePrompt(customPrompt, DEFAULT_SCORING_PROMPT)
        + "\n\nScore the following note pairs, provided as JSON:\n\n```json\n"
        + toJson(payload)
        + "\n```\n\n"
        + "Respond with a JSON array with one element per pair_id. Each element must contain"
        + " pair_id, note_id_1, note_id_2 and score (0-10), and may contain a short reasoning:\n\n"
        + "[{\"pair_id\": 1, \"note_id_1\": \"id1\", \"note_id_2\": \"id2\","
        + " \"score\": 7}, ...]\n\n"
        + "Your response must be a valid JSON array with exactly "
        + pairs.size()
        + " elements.";
  }

  public String buildTaggingPrompt(
      List<TaggingNote> notes, String customPrompt, int minTags, int maxTags) {
    StringBuilder prompt =
        new StringBuilder(basePrompt(customPrompt, DEFAULT_TAGGING_PROMPT))
            .append("\n\nGenerate ")
            .append(minTags)
            .append('-')
            .append(maxTags)
            .append(" relevant tags for each note:\n\n");

    for (TaggingNote note : notes) {
      prompt.append("Note ID: ").append(note.getId()).append('\n');
      prompt.append("Title: ").append(note.getTitle()).append('\n');
      if (!note.getExistingTags().isEmpty()) {
        prompt
            .append("Existing tags: ")
            .append(String.join(", ", note.getExistingTags()))
            .append('\n');
      }
      prompt.append("Content:\n").append(note.getContent()).append("\n\n---\n\n");
    }

    prompt
        .append("Respond with a JSON object containing a \"results\" array:\n")
        .append("{\"results\": [{\"note_id\": \"<exact id from the input>\", \"tags\": [\"tag1\",")
        .append(" \"tag2\"]}, ...]}");
    return prompt.toString();
  }

  private ObjectNode note(String id, String title, String content) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("id", id);
    node.put("title", title);
    node.put("content", content);
    return node;
  }

  private static String basePrompt(String customPrompt, String defaultPrompt) {
    return customPrompt == null || customPrompt.isBlank() ? defaultPrompt : customPrompt;
  }

  private String toJson(ObjectNode payload) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialise prompt payload", e);
    }
  }
}
