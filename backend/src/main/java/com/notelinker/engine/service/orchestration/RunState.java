package com.notelinker.engine.service.orchestration;

public enum RunState {
  IDLE,
  COMPUTE_CANDIDATES,
  SCORE_BATCHES,
  TAG_BATCHES,
  DONE,
  CANCELLED,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == CANCELLED || this == FAILED;
  }
}
