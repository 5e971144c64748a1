package com.notelinker.engine.config;

import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class DebugLoggingConfigurer {

  static final String ENGINE_LOGGER = "com.notelinker";

  private final ApplicationProperties properties;
  private final LoggingSystem loggingSystem;

  @EventListener(ApplicationReadyEvent.class)
  public void applyDebugLogging() {
    if (properties.isDebugLogging()) {
      loggingSystem.setLogLevel(ENGINE_LOGGER, LogLevel.DEBUG);
      log.info("Debug logging enabled for {}", ENGINE_LOGGER);
    }
  }
}
