package com.notelinker.engine.service.remote;

import java.util.concurrent.Callable;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.exception.LinkerException;
import com.notelinker.engine.exception.TransientException;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a single remote call under the retry policy. Only transient failures are retried;
 * everything else is classified and rethrown on the first attempt.
 */
@Slf4j
@Component
public class RemoteCallExecutor {

  /** Pause between attempts; replaced in tests. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(long millis) throws InterruptedException;
  }

  private final RetryPolicy retryPolicy;
  private final ErrorClassifier errorClassifier;
  private final Sleeper sleeper;

  @Autowired
  public RemoteCallExecutor(ApplicationProperties properties, ErrorClassifier errorClassifier) {
    this(
        new RetryPolicy(
            properties.getRetry().getMaxAttempts(), properties.getRetry().getBaseDelay()),
        errorClassifier,
        Thread::sleep);
  }

  public RemoteCallExecutor(
      RetryPolicy retryPolicy, ErrorClassifier errorClassifier, Sleeper sleeper) {
    this.retryPolicy = retryPolicy;
    this.errorClassifier = errorClassifier;
    this.sleeper = sleeper;
  }

  public <T> T execute(String operation, Callable<T> call) {
    int attempt = 0;
    while (true) {
      try {
        return call.call();
      } catch (Exception e) {
        LinkerException classified = errorClassifier.classify(e);
        if (!retryPolicy.shouldRetry(classified, attempt)) {
          if (classified instanceof TransientException) {
            log.warn(
                "{} failed after {} attempt(s): {}",
                operation,
                attempt + 1,
                classified.getMessage());
            throw ((TransientException) classified).withAttempts(attempt + 1);
          }
          throw classified;
        }
        long delay = retryPolicy.delayFor(attempt);
        log.warn(
            "{} attempt {}/{} failed: {}. Retrying in {} ms",
            operation,
            attempt + 1,
            retryPolicy.getMaxAttempts(),
            classified.getMessage(),
            delay);
        pause(delay);
        attempt++;
      }
    }
  }

  private void pause(long delay) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new LinkerException("Interrupted during retry", ie);
    }
  }
}
