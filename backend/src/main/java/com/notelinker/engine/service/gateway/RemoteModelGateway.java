package com.notelinker.engine.service.gateway;

import java.util.List;

import org.springframework.stereotype.Service;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.gateway.PairScoreResult;
import com.notelinker.engine.dto.gateway.ScoringPair;
import com.notelinker.engine.dto.gateway.TagResult;
import com.notelinker.engine.dto.gateway.TaggingNote;
import com.notelinker.engine.service.remote.RemoteCallExecutor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * The single entry point the orchestration layer uses for remote models. Every call runs under
 * the transport retry policy; vendor differences stay behind {@link LLMService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RemoteModelGateway {

  static final double SCORING_TEMPERATURE = 0.3;
  static final double TAGGING_TEMPERATURE = 0.5;

  private final JinaEmbeddingService embeddingService;
  private final LLMServiceSelector llmServiceSelector;
  private final PromptService promptService;
  private final LLMResponseParser responseParser;
  private final RemoteCallExecutor remoteCallExecutor;
  private final ApplicationProperties properties;

  public List<float[]> embed(List<String> texts) {
    return remoteCallExecutor.execute("Embedding request", () -> embeddingService.embed(texts));
  }

  public String getEmbeddingModel() {
    return embeddingService.getModel();
  }

  /** Scores pairs; the result may be shorter or longer than the input when the model misbehaves. */
  public List<PairScoreResult> score(List<ScoringPair> pairs, String customPrompt) {
    LLMService llm = llmServiceSelector.getLLMService();
    String prompt = promptService.buildScoringPrompt(pairs, customPrompt);
    log.debug(
        "Scoring {} pairs with {} ({} prompt chars)",
        pairs.size(),
        llm.getCurrentModelId(),
        prompt.length());
    String response =
        remoteCallExecutor.execute(
            "Scoring request",
            () -> llm.complete(prompt, SCORING_TEMPERATURE, properties.getLlm().getMaxTokens()));
    return responseParser.parseScores(response, pairs);
  }

  public List<TagResult> tag(
      List<TaggingNote> notes, String customPrompt, int minTags, int maxTags) {
    LLMService llm = llmServiceSelector.getLLMService();
    String prompt = promptService.buildTaggingPrompt(notes, customPrompt, minTags, maxTags);
    log.debug("Tagging {} notes with {}", notes.size(), llm.getCurrentModelId());
    String response =
        remoteCallExecutor.execute(
            "Tagging request",
            () -> llm.complete(prompt, TAGGING_TEMPERATURE, properties.getLlm().getMaxTokens()));
    return responseParser.parseTags(response, notes);
  }

  public String getScoringModel() {
    return llmServiceSelector.getLLMService().getCurrentModelId();
  }
}
