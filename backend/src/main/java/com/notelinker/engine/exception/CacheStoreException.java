package com.notelinker.engine.exception;

public class CacheStoreException extends LinkerException {

  public CacheStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
