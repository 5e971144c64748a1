package com.notelinker.engine.exception;

import com.notelinker.engine.service.remote.TransportFailure;

import lombok.Getter;

/** A failure that may go away on its own: rate limits, server errors and network trouble. */
@Getter
public class TransientException extends LinkerException {

  private final int status;
  private final TransportFailure transportFailure;
  private final int attempts;

  public TransientException(String message, int status) {
    this(message, status, null, 0, null);
  }

  public TransientException(
      String message,
      int status,
      TransportFailure transportFailure,
      int attempts,
      Throwable cause) {
    super(message, cause);
    this.status = status;
    this.transportFailure = transportFailure;
    this.attempts = attempts;
  }

  public TransientException withAttempts(int attemptCount) {
    return new TransientException(getMessage(), status, transportFailure, attemptCount, getCause());
  }
}
