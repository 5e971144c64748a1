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

/** Messages API client. */
@Slf4j
@Service
public class AnthropicService implements LLMService {

  static final String ANTHROPIC_API_URL = "https://api.anthropic.com/v1/messages";
  static final String API_VERSION = "2023-06-01";
  static final String DEFAULT_MODEL = "claude-3-5-haiku-latest";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final ApplicationProperties properties;

  public AnthropicService(
      ObjectMapper objectMapper,
      @Qualifier(CoreConfig.LLM_REST_TEMPLATE) RestTemplate restTemplate,
      ApplicationProperties properties) {
    this.objectMapper = objectMapper;
    this.restTemplate = restTemplate;
    this.properties = properties;
  }

  @Override
  public String getProviderName() {
    return "anthropic";
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

  @Override
  public String complete(String prompt, double temperature, int maxTokens) {
    if (!isConfigured()) {
      throw ConfigurationException.missingSetting(
          "linker.llm.api-key", "Set LLM_API_KEY to an Anthropic API key.");
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
    headers.set("x-api-key", properties.getLlm().getApiKey());
    headers.set("anthropic-version", API_VERSION);

    String apiUrl = properties.getLlm().getApiUrl();
    ResponseEntity<String> response =
        restTemplate.exchange(
            apiUrl == null || apiUrl.isBlank() ? ANTHROPIC_API_URL : apiUrl,
            HttpMethod.POST,
            new HttpEntity<>(requestBody.toString(), headers),
            String.class);

    if (response.getBody() == null) {
      throw new LinkerException("Empty response from Anthropic API");
    }
    try {
      JsonNode content = objectMapper.readTree(response.getBody()).path("content");
      StringBuilder text = new StringBuilder();
      for (JsonNode block : content) {
        if ("text".equals(block.path("type").asText())) {
          text.append(block.path("text").asText());
        }
      }
      if (text.length() == 0) {
        throw new LinkerException("No text content in Anthropic response");
      }
      return text.toString();
    } catch (JsonProcessingException e) {
      throw new LinkerException("Unreadable response from Anthropic API", e);
    }
  }
}
