package com.notelinker.engine.service.orchestration;

import com.notelinker.engine.exception.RunCancelledException;

/** Cooperative cancellation flag, polled between batches. */
@FunctionalInterface
public interface CancellationToken {

  CancellationToken NONE = () -> false;

  boolean isCancellationRequested();

  default void throwIfCancellationRequested() {
    if (isCancellationRequested()) {
      throw new RunCancelledException();
    }
  }
}
