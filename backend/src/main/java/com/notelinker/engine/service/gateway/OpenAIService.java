package com.notelinker.engine.service.gateway;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.config.CoreConfig;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.LinkerException;

import lombok.extern.slf4j.Slf4j;

/**
 * Chat-completions client. Serves both {@code openai} and {@code custom}, the latter being any
 * OpenAI-compatible endpoint given in {@code linker.llm.api-url}.
 */
@Slf4j
@Service
public class OpenAIService implements LLMService {

  static final String OPENAI_API_URL = "https://api.openai.com/v1/chat/completions";
  static final String DEFAULT_MODEL = "gpt-4o-mini";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final ApplicationProperties properties;

  public OpenAIService(
      ObjectMapper objectMapper,
      @Qualifier(CoreConfig.LLM_REST_TEMPLATE) RestTemplate restTemplate,
      ApplicationProperties properties) {
    this.objectMapper = objectMapper;
    this.restTemplate = restTemplate;
    this.properties = properties;
  }

  @Override
  public String getProviderName() {
    return "openai";
  }

  @Override
  public boolean isConfigured() {
    String apiKey = properties.getLlm().getApiKey();
    return apiKey != null && !apiKey.isBlank();
  }

  @Override
  public String getCurrentModelId() {
    String model = properties.getLlm().getModel();
    return model == null || model.isBlank() ? DEFAULT_MODEL : model;
  }

  String endpoint() {
    String apiUrl = properties.getLlm().getApiUrl();
    return apiUrl == null || apiUrl.isBlank() ? OPENAI_API_URL : apiUrl;
  }

  @Override
  public String complete(String prompt, double temperature, int maxTokens) {
    if (!isConfigured()) {
      throw ConfigurationException.missingSetting(
          "linker.llm.api-key", "Set LLM_API_KEY to an OpenAI (or compatible) API key.");
    }

    var requestBody = objectMapper.createObjectNode();
    requestBody.put("model", getCurrentModelId());
    requestBody.put("max_tokens", maxTokens);
    requestBody.put("temperature", temperature);
    var message = objectMapper.createObjectNode();
    message.put("role", "user");
    message.put("content", prompt);
    requestBody.set("messages", objectMapper.createArrayNode().add(message));

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(properties.getLlm().getApiKey());

    log.debug(
        "OpenAI request model={}, promptChars={}, temperature={}",
        getCurrentModelId(),
        prompt.length(),
        temperature);

    ResponseEntity<String> response =
        restTemplate.exchange(
            endpoint(),
            HttpMethod.POST,
            new HttpEntity<>(requestBody.toString(), headers),
            String.class);

    return extractContent(response.getBody());
  }

  private String extractContent(String body) {
    if (body == null) {
      throw new LinkerException("Empty response from chat completions API");
    }
    try {
      JsonNode choices = objectMapper.readTree(body).path("choices");
      JsonNode content = choices.path(0).path("message").path("content");
      if (content.isMissingNode() || content.isNull()) {
        throw new LinkerException("Invalid response format from chat completions API");
      }
      log.debug("OpenAI response content length={} chars", content.asText().length());
      return content.asText();
    } catch (JsonProcessingException e) {
      throw new LinkerException("Unreadable response from chat completions API", e);
    }
  }
}
