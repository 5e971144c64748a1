package com.notelinker.engine.exception;

public class ResourceNotFoundException extends LinkerException {

  public ResourceNotFoundException(String message) {
    super(message);
  }
}
