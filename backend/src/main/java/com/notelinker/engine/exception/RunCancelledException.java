package com.notelinker.engine.exception;

public class RunCancelledException extends LinkerException {

  public RunCancelledException() {
    super("Task cancelled by user");
  }
}
