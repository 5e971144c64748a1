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
import com.notelinker.engine.exception.LinkerException;

import lombok.extern.slf4j.Slf4j;

/**
 * Client for a local Ollama server through its OpenAI-compatible chat endpoint. No API key is
 * needed; one is sent as a bearer token only when set, for proxies that ask for it.
 */
@Slf4j
@Service
public class OllamaService implements LLMService {

  static final String DEFAULT_API_URL = "http://localhost:11434/v1/chat/completions";
  static final String DEFAULT_MODEL = "llama3.1";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final ApplicationProperties properties;

  public OllamaService(
      ObjectMapper objectMapper,
      @Qualifier(CoreConfig.LLM_REST_TEMPLATE) RestTemplate restTemplate,
      ApplicationProperties properties) {
    this.objectMapper = objectMapper;
    this.restTemplate = restTemplate;
    this.properties = properties;
  }

  @Override
  public String getProviderName() {
    return "ollama";
  }

  /** A local server needs no credentials, so there is nothing to configure up front. */
  @Override
  public boolean isConfigured() {
    return true;
  }

  @Override
  public String getCurrentModelId() {
    String model = properties.getLlm().getModel();
    return model == null || model.isBlank() ? DEFAULT_MODEL : model;
  }

  String endpoint() {
    String apiUrl = properties.getLlm().getApiUrl();
    return apiUrl == null || apiUrl.isBlank() ? DEFAULT_API_URL : apiUrl;
  }

  @Override
  public String complete(String prompt, double temperature, int maxTokens) {
    var requestBody = objectMapper.createObjectNode();
    requestBody.put("model", getCurrentModelId());
    requestBody.put("temperature", temperature);
    requestBody.put("stream", false);
    requestBody.set("options", objectMapper.createObjectNode().put("num_predict", maxTokens));
    var message = objectMapper.createObjectNode();
    message.put("role", "user");
    message.put("content", prompt);
    requestBody.set("messages", objectMapper.createArrayNode().add(message));

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    String apiKey = properties.getLlm().getApiKey();
    if (apiKey != null && !apiKey.isBlank()) {
      headers.setBearerAuth(apiKey);
    }

    log.debug("Ollama request model={}, promptChars={}", getCurrentModelId(), prompt.length());

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
      throw new LinkerException("Empty response from Ollama");
    }
    try {
      JsonNode root = objectMapper.readTree(body);
      JsonNode error = root.path("error");
      if (!error.isMissingNode() && !error.isNull()) {
        String detail = error.path("message").asText(error.asText());
        throw new LinkerException("Ollama API error: " + detail);
      }
      String content = root.path("choices").path(0).path("message").path("content").asText("");
      if (content.isEmpty()) {
        throw new LinkerException("Empty response from Ollama");
      }
      return content;
    } catch (JsonProcessingException e) {
      throw new LinkerException("Unreadable response from Ollama", e);
    }
  }
}
