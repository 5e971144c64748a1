package com.notelinker.engine.service.orchestration;

import java.time.Instant;
import java.util.UUID;

import com.notelinker.engine.dto.run.RunStatus;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * State of one run: its mode, cancellation flag and progress. Written by the run thread, read by
 * status requests through {@link #snapshot()}.
 */
@Slf4j
public class RunContext {

  @Getter private final String runId;
  @Getter private final String taskName;
  @Getter private final boolean force;
  @Getter private final Instant startedAt;
  private final ProgressListener progressListener;

  private volatile boolean cancellationRequested;
  private RunState state = RunState.IDLE;
  private String progressStep;
  private int progressCompleted;
  private int progressTotal;
  private Instant finishedAt;
  private String message;
  private String guidance;
  private Object result;

  public RunContext(String taskName, boolean force, ProgressListener progressListener) {
    this.runId = UUID.randomUUID().toString().substring(0, 8);
    this.taskName = taskName;
    this.force = force;
    this.startedAt = Instant.now();
    this.progressListener = progressListener;
  }

  /** A context for work started outside the coordinator, such as tests and one-off calls. */
  public static RunContext detached(String taskName, boolean force) {
    return new RunContext(taskName, force, ProgressListener.NONE);
  }

  public CancellationToken getCancellationToken() {
    return () -> cancellationRequested;
  }

  public void requestCancellation() {
    cancellationRequested = true;
  }

  public boolean isCancellationRequested() {
    return cancellationRequested;
  }

  public synchronized RunState getState() {
    return state;
  }

  public synchronized void transition(RunState next) {
    if (state.isTerminal()) {
      throw new IllegalStateException("Run " + runId + " already finished as " + state);
    }
    log.debug("Run {} {} -> {}", runId, state, next);
    state = next;
  }

  public void reportProgress(String step, int completed, int total) {
    synchronized (this) {
      progressStep = step;
      progressCompleted = completed;
      progressTotal = total;
    }
    progressListener.onProgress(step, completed, total);
  }

  synchronized void finish(
      RunState terminal, String finalMessage, String finalGuidance, Object value) {
    state = terminal;
    finishedAt = Instant.now();
    message = finalMessage;
    guidance = finalGuidance;
    result = value;
  }

  public synchronized RunStatus snapshot() {
    return RunStatus.builder()
        .runId(runId)
        .taskName(taskName)
        .force(force)
        .state(state)
        .startedAt(startedAt)
        .finishedAt(finishedAt)
        .progressStep(progressStep)
        .progressCompleted(progressCompleted)
        .progressTotal(progressTotal)
        .cancellationRequested(cancellationRequested)
        .message(message)
        .guidance(guidance)
        .result(result)
        .build();
  }
}
