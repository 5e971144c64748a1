package com.notelinker.engine.service.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.fixtures.TestFixtures;

@DisplayName("GeminiService Tests")
class GeminiServiceTest {

  @Test
  @DisplayName("Should call generateContent for the model with the key as a query parameter")
  void shouldCompletePrompt() {
    ApplicationProperties properties = new ApplicationProperties();
    properties.getLlm().setApiKey("g-key");
    RestTemplate restTemplate = new RestTemplate();
    MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
    GeminiService service =
        new GeminiService(TestFixtures.objectMapper(), restTemplate, properties);

    server
        .expect(
            requestTo(
                GeminiService.GEMINI_API_BASE
                    + "/"
                    + GeminiService.DEFAULT_MODEL
                    + ":generateContent?key=g-key"))
        .andExpect(jsonPath("$.contents[0].parts[0].text").value("prompt"))
        .andExpect(jsonPath("$.generationConfig.maxOutputTokens").value(64))
        .andRespond(
            withSuccess(
                "{\"candidates\": [{\"content\": {\"parts\": [{\"text\": \"reply\"}]}}]}",
                MediaType.APPLICATION_JSON));

    assertThat(service.complete("prompt", 0.5, 64)).isEqualTo("reply");
    server.verify();
  }
}
