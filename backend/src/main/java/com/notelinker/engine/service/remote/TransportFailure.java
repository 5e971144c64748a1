package com.notelinker.engine.service.remote;

import java.io.EOFException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;

/** Network-level failure categories, derived once from the I/O exception that caused them. */
public enum TransportFailure {
  TIMEOUT("Request timed out"),
  CONNECTION_RESET("Connection closed by remote host"),
  DNS("Host name could not be resolved"),
  UNREACHABLE("Unable to reach API");

  private final String description;

  TransportFailure(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

  /** Walks the cause chain and returns the first recognised category. */
  public static TransportFailure from(Throwable failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof SocketTimeoutException || current instanceof HttpTimeoutException) {
        return TIMEOUT;
      }
      if (current instanceof UnknownHostException) {
        return DNS;
      }
      // ConnectException extends SocketException, so it has to be checked first
      if (current instanceof ConnectException) {
        return UNREACHABLE;
      }
      if (current instanceof SocketException || current instanceof EOFException) {
        return CONNECTION_RESET;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return UNREACHABLE;
  }
}
