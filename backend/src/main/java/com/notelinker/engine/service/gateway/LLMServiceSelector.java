package com.notelinker.engine.service.gateway;

import java.util.List;

import org.springframework.stereotype.Service;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.exception.ConfigurationException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Picks the provider named by {@code linker.llm.provider}. {@code custom} is served by the
 * OpenAI-compatible client; {@code ollama} talks to a local server without a key. There is no
 * fallback to another vendor: the configured one either works or the run stops with a
 * configuration error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LLMServiceSelector {

  static final String CUSTOM_PROVIDER = "custom";

  private final List<LLMService> services;
  private final ApplicationProperties properties;

  public LLMService getLLMService() {
    String provider = properties.getLlm().getProvider();
    String lookup = CUSTOM_PROVIDER.equalsIgnoreCase(provider) ? "openai" : provider;

    if (CUSTOM_PROVIDER.equalsIgnoreCase(provider)
        && (properties.getLlm().getApiUrl() == null || properties.getLlm().getApiUrl().isBlank())) {
      throw ConfigurationException.missingSetting(
          "linker.llm.api-url", "The custom provider needs an OpenAI-compatible endpoint URL.");
    }

    LLMService service =
        services.stream()
            .filter(candidate -> candidate.getProviderName().equalsIgnoreCase(lookup))
            .findFirst()
            .orElseThrow(
                () ->
                    new ConfigurationException(
                        "Unknown LLM provider: " + provider,
                        0,
                        "Set linker.llm.provider to openai, anthropic, gemini, bedrock,"
                            + " ollama or custom."));

    if (!service.isConfigured()) {
      throw ConfigurationException.missingSetting(
          "linker.llm.api-key", "Provider '" + provider + "' is selected but not configured.");
    }
    log.debug("Using {} for LLM calls (model {})", provider, service.getCurrentModelId());
    return service;
  }

  public String getActiveProvider() {
    return properties.getLlm().getProvider();
  }

  /** Whether {@link #getLLMService()} would succeed with the current settings. */
  public boolean isConfigured() {
    try {
      getLLMService();
      return true;
    } catch (ConfigurationException e) {
      log.debug("LLM provider not usable: {}", e.getMessage());
      return false;
    }
  }
}
