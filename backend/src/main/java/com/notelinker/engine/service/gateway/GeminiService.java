package com.notelinker.engine.service.gateway;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.config.CoreConfig;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.LinkerException;

import lombok.extern.slf4j.Slf4j;

/** Generative Language API client. */
@Slf4j
@Service
public class GeminiService implements LLMService {

  static final String GEMINI_API_BASE = "https://generativelanguage.googleapis.com/v1beta/models";
  static final String DEFAULT_MODEL = "gemini-1.5-flash";

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final ApplicationProperties properties;

  public GeminiService(
      ObjectMapper objectMapper,
      @Qualifier(CoreConfig.LLM_REST_TEMPLATE) RestTemplate restTemplate,
      ApplicationProperties properties) {
    this.objectMapper = objectMapper;
    this.restTemplate = restTemplate;
    this.properties = properties;
  }

  @Override
  public String getProviderName() {
    return "gemini";
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
          "linker.llm.api-key", "Set LLM_API_KEY to a Google AI Studio API key.");
    }

    var requestBody = objectMapper.createObjectNode();
    var part = objectMapper.createObjectNode().put("text", prompt);
    var content = objectMapper.createObjectNode();
    content.set("parts", objectMapper.createArrayNode().add(part));
    requestBody.set("contents", objectMapper.createArrayNode().add(content));
    var generationConfig = objectMapper.createObjectNode();
    generationConfig.put("temperature", temperature);
    generationConfig.put("maxOutputTokens", maxTokens);
    requestBody.set("generationConfig", generationConfig);

    String apiUrl = properties.getLlm().getApiUrl();
    String base = apiUrl == null || apiUrl.isBlank() ? GEMINI_API_BASE : apiUrl;
    String url =
        UriComponentsBuilder.fromUriString(base + "/" + getCurrentModelId() + ":generateContent")
            .queryParam("key", properties.getLlm().getApiKey())
            .toUriString();

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);

    ResponseEntity<String> response =
        restTemplate.exchange(
            url, HttpMethod.POST, new HttpEntity<>(requestBody.toString(), headers), String.class);

    if (response.getBody() == null) {
      throw new LinkerException("Empty response from Gemini API");
    }
    try {
      JsonNode text =
          objectMapper
              .readTree(response.getBody())
              .path("candidates")
              .path(0)
              .path("content")
              .path("parts")
              .path(0)
              .path("text");
      if (text.isMissingNode()) {
        throw new LinkerException("No text content in Gemini response");
      }
      return text.asText();
    } catch (JsonProcessingException e) {
      throw new LinkerException("Unreadable response from Gemini API", e);
    }
  }
}
