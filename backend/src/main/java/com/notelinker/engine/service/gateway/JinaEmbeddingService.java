package com.notelinker.engine.service.gateway;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.config.CoreConfig;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.LinkerException;

import lombok.extern.slf4j.Slf4j;

/** Embedding client for the Jina AI embeddings endpoint. One request per call, no retries. */
@Slf4j
@Service
public class JinaEmbeddingService {

  private final ObjectMapper objectMapper;
  private final RestTemplate restTemplate;
  private final ApplicationProperties properties;

  public JinaEmbeddingService(
      ObjectMapper objectMapper,
      @Qualifier(CoreConfig.EMBEDDING_REST_TEMPLATE) RestTemplate restTemplate,
      ApplicationProperties properties) {
    this.objectMapper = objectMapper;
    this.restTemplate = restTemplate;
    this.properties = properties;
  }

  public boolean isConfigured() {
    String apiKey = properties.getEmbedding().getApiKey();
    return apiKey != null && !apiKey.isBlank();
  }

  public String getModel() {
    return properties.getEmbedding().getModel();
  }

  /** Embeds each text after truncating it to the configured character limit. */
  public List<float[]> embed(List<String> texts) {
    if (!isConfigured()) {
      throw ConfigurationException.missingSetting(
          "linker.embedding.api-key", "Set JINA_API_KEY to a Jina AI API key.");
    }
    if (texts.isEmpty()) {
      return new ArrayList<>();
    }

    int maxChars = properties.getEmbedding().getMaxChars();
    var requestBody = objectMapper.createObjectNode();
    requestBody.put("model", getModel());
    ArrayNode input = requestBody.putArray("input");
    for (String text : texts) {
      input.add(text.length() > maxChars ? text.substring(0, maxChars) : text);
    }

    HttpHeaders headers = new HttpHeaders();
    headers.setContentType(MediaType.APPLICATION_JSON);
    headers.setBearerAuth(properties.getEmbedding().getApiKey());

    log.debug("Requesting {} embeddings from {}", texts.size(), getModel());
    ResponseEntity<String> response =
        restTemplate.exchange(
            properties.getEmbedding().getApiUrl(),
            HttpMethod.POST,
            new HttpEntity<>(requestBody.toString(), headers),
            String.class);

    List<float[]> vectors = parseVectors(response.getBody());
    if (vectors.size() != texts.size()) {
      throw new LinkerException(
          "Embedding API returned " + vectors.size() + " vectors for " + texts.size() + " inputs");
    }
    return vectors;
  }

  private List<float[]> parseVectors(String body) {
    if (body == null) {
      throw new LinkerException("Empty response from embedding API");
    }
    try {
      List<JsonNode> data = new ArrayList<>();
      objectMapper.readTree(body).path("data").forEach(data::add);
      data.sort(Comparator.comparingInt(node -> node.path("index").asInt()));

      List<float[]> vectors = new ArrayList<>(data.size());
      for (JsonNode item : data) {
        JsonNode embedding = item.path("embedding");
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
          vector[i] = (float) embedding.get(i).asDouble();
        }
        vectors.add(vector);
      }
      return vectors;
    } catch (JsonProcessingException e) {
      throw new LinkerException("Unreadable response from embedding API", e);
    }
  }
}
