package com.notelinker.engine.service.gateway;

/**
 * Common contract of the LLM providers. Implementations make exactly one request per call and let
 * failures propagate; retrying is the caller's job.
 */
public interface LLMService {

  /**
   * Sends a single-turn prompt and returns the model's text reply.
   *
   * @throws com.notelinker.engine.exception.ConfigurationException when settings are incomplete
   */
  String complete(String prompt, double temperature, int maxTokens);

  /** Provider key as used in {@code linker.llm.provider}. */
  String getProviderName();

  String getCurrentModelId();

  boolean isConfigured();
}
