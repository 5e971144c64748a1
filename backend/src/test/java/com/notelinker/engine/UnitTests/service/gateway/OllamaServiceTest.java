package com.notelinker.engine.service.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.exception.LinkerException;
import com.notelinker.engine.fixtures.TestFixtures;

@DisplayName("OllamaService Tests")
class OllamaServiceTest {

  private static final String REPLY = "{\"choices\": [{\"message\": {\"content\": \"ok\"}}]}";

  private ApplicationProperties properties;
  private MockRestServiceServer server;
  private OllamaService service;

  @BeforeEach
  void setUp() {
    properties = new ApplicationProperties();
    properties.getLlm().setProvider("ollama");
    RestTemplate restTemplate = new RestTemplate();
    server = MockRestServiceServer.bindTo(restTemplate).build();
    service = new OllamaService(TestFixtures.objectMapper(), restTemplate, properties);
  }

  @Test
  @DisplayName("Should call the local server without credentials")
  void shouldCompleteWithoutApiKey() {
    server
        .expect(requestTo(OllamaService.DEFAULT_API_URL))
        .andExpect(method(HttpMethod.POST))
        .andExpect(headerDoesNotExist(HttpHeaders.AUTHORIZATION))
        .andExpect(jsonPath("$.model").value(OllamaService.DEFAULT_MODEL))
        .andExpect(jsonPath("$.stream").value(false))
        .andExpect(jsonPath("$.options.num_predict").value(256))
        .andExpect(jsonPath("$.messages[0].content").value("Tag these"))
        .andRespond(withSuccess(REPLY, MediaType.APPLICATION_JSON));

    assertThat(service.isConfigured()).isTrue();
    assertThat(service.complete("Tag these", 0.5, 256)).isEqualTo("ok");
    server.verify();
  }

  @Test
  @DisplayName("Should use the configured endpoint, model and optional key")
  void shouldHonourSettings() {
    properties.getLlm().setApiUrl("http://gpu-box:11434/v1/chat/completions");
    properties.getLlm().setModel("qwen2.5");
    properties.getLlm().setApiKey("proxy-key");
    server
        .expect(requestTo("http://gpu-box:11434/v1/chat/completions"))
        .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer proxy-key"))
        .andExpect(jsonPath("$.model").value("qwen2.5"))
        .andRespond(withSuccess(REPLY, MediaType.APPLICATION_JSON));

    assertThat(service.complete("hi", 0.3, 10)).isEqualTo("ok");
    server.verify();
  }

  @Test
  @DisplayName("Should surface an error object returned by the server")
  void shouldReportServerError() {
    server
        .expect(requestTo(OllamaService.DEFAULT_API_URL))
        .andRespond(
            withSuccess(
                "{\"error\": {\"message\": \"model 'llama3.1' not found\"}}",
                MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> service.complete("hi", 0.3, 10))
        .isInstanceOf(LinkerException.class)
        .hasMessageContaining("not found");
  }

  @Test
  @DisplayName("Should reject an empty reply")
  void shouldRejectEmptyReply() {
    server
        .expect(requestTo(OllamaService.DEFAULT_API_URL))
        .andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));

    assertThatThrownBy(() -> service.complete("hi", 0.3, 10))
        .isInstanceOf(LinkerException.class)
        .hasMessageContaining("Empty response");
  }
}
