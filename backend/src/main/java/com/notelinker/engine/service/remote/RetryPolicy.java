package com.notelinker.engine.service.remote;

import java.time.Duration;

import com.notelinker.engine.exception.LinkerException;
import com.notelinker.engine.exception.TransientException;

/** Exponential backoff: attempt {@code n} (zero based) waits {@code 2^n * baseDelay}. */
public class RetryPolicy {

  private final int maxAttempts;
  private final Duration baseDelay;

  public RetryPolicy(int maxAttempts, Duration baseDelay) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
    this.baseDelay = baseDelay;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long delayFor(int attempt) {
    return (1L << attempt) * baseDelay.toMillis();
  }

  public boolean shouldRetry(LinkerException failure, int attempt) {
    return failure instanceof TransientException && attempt < maxAttempts - 1;
  }
}
