package com.notelinker.engine.exception;

/** Base type for every failure the linking engine raises on purpose. */
public class LinkerException extends RuntimeException {

  public LinkerException(String message) {
    super(message);
  }

  public LinkerException(String message, Throwable cause) {
    super(message, cause);
  }
}
