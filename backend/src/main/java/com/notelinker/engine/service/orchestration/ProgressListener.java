package com.notelinker.engine.service.orchestration;

@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (step, completed, total) -> {};

  void onProgress(String step, int completed, int total);
}
