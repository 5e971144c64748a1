package com.notelinker.engine.exception;

import lombok.Getter;

/**
 * A failure the user has to fix in settings. Never retried; aborts the run that hit it.
 *
 * <p>{@code status} is the HTTP status that revealed the problem, or 0 when it was detected
 * locally (for example a missing API key).
 */
@Getter
public class ConfigurationException extends LinkerException {

  private final int status;
  private final String guidance;

  public ConfigurationException(String message, int status, String guidance) {
    super(message);
    this.status = status;
    this.guidance = guidance;
  }

  public static ConfigurationException missingSetting(String setting, String guidance) {
    return new ConfigurationException("Missing required setting: " + setting, 0, guidance);
  }
}
