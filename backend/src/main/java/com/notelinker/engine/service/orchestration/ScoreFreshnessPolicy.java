package com.notelinker.engine.service.orchestration;

import java.time.Duration;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.PairScore;

import lombok.RequiredArgsConstructor;

/** Decides whether an already-scored pair can be left alone in smart mode. */
@Component
@RequiredArgsConstructor
public class ScoreFreshnessPolicy {

  private final ApplicationProperties properties;

  /**
   * True only in smart mode for a pair scored within the freshness window. Journaled failures are
   * handled by the caller and never reach this check.
   */
  public boolean shouldSkip(PairScore existing, boolean force, Instant now) {
    if (force || existing == null || existing.getLastScored() == null) {
      return false;
    }
    Duration age = Duration.between(existing.getLastScored(), now);
    return age.compareTo(properties.getFreshnessWindow()) < 0;
  }
}
