package com.notelinker.engine.exception;

import lombok.Getter;

@Getter
public class RunInProgressException extends LinkerException {

  private final String runningTask;

  public RunInProgressException(String runningTask) {
    super(
        "Another task is already running: "
            + runningTask
            + ". Please wait for it to complete or cancel it first.");
    this.runningTask = runningTask;
  }
}
