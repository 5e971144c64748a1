package com.notelinker.engine.service.gateway;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestTemplate;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.fixtures.TestFixtures;

@ExtendWith(MockitoExtension.class)
@DisplayName("LLMServiceSelector Tests")
class LLMServiceSelectorTest {

  @Mock private LLMService openAi;
  @Mock private LLMService anthropic;

  private ApplicationProperties properties;
  private LLMServiceSelector selector;

  @BeforeEach
  void setUp() {
    lenient().when(openAi.getProviderName()).thenReturn("openai");
    lenient().when(openAi.isConfigured()).thenReturn(true);
    lenient().when(anthropic.getProviderName()).thenReturn("anthropic");
    lenient().when(anthropic.isConfigured()).thenReturn(false);
    properties = new ApplicationProperties();
    selector = new LLMServiceSelector(List.of(openAi, anthropic), properties);
  }

  @Test
  @DisplayName("Should return the configured provider")
  void shouldSelectByName() {
    properties.getLlm().setProvider("OpenAI");

    assertThat(selector.getLLMService()).isSameAs(openAi);
    assertThat(selector.isConfigured()).isTrue();
  }

  @Test
  @DisplayName("Should serve the custom provider with the OpenAI-compatible client")
  void shouldMapCustomToOpenAi() {
    properties.getLlm().setProvider("custom");
    properties.getLlm().setApiUrl("http://localhost:8000/v1/chat/completions");

    assertThat(selector.getLLMService()).isSameAs(openAi);
    assertThat(selector.getActiveProvider()).isEqualTo("custom");
  }

  @Test
  @DisplayName("Should select the local Ollama server without an API key")
  void shouldSelectOllamaWithoutKey() {
    properties.getLlm().setProvider("ollama");
    OllamaService ollama =
        new OllamaService(TestFixtures.objectMapper(), new RestTemplate(), properties);
    LLMServiceSelector withOllama =
        new LLMServiceSelector(List.of(openAi, anthropic, ollama), properties);

    assertThat(withOllama.getLLMService()).isSameAs(ollama);
    assertThat(withOllama.isConfigured()).isTrue();
  }

  @Test
  @DisplayName("Should require an endpoint URL for the custom provider")
  void shouldRequireCustomUrl() {
    properties.getLlm().setProvider("custom");

    assertThatThrownBy(() -> selector.getLLMService())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("linker.llm.api-url");
    assertThat(selector.isConfigured()).isFalse();
  }

  @Test
  @DisplayName("Should not fall back when the selected provider is not configured")
  void shouldNotFallBack() {
    properties.getLlm().setProvider("anthropic");

    assertThatThrownBy(() -> selector.getLLMService())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("linker.llm.api-key");
  }

  @Test
  @DisplayName("Should reject an unknown provider name")
  void shouldRejectUnknownProvider() {
    properties.getLlm().setProvider("mistral");

    assertThatThrownBy(() -> selector.getLLMService())
        .isInstanceOf(ConfigurationException.class)
        .hasMessageContaining("Unknown LLM provider: mistral");
  }
}
