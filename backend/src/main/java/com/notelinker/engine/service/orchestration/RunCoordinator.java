package com.notelinker.engine.service.orchestration;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.notelinker.engine.config.CoreConfig;
import com.notelinker.engine.dto.run.RunStatus;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.RunCancelledException;
import com.notelinker.engine.exception.RunInProgressException;

import lombok.extern.slf4j.Slf4j;

/**
 * Enforces one active run at a time. The cache's score index and dirty flag assume a single
 * writer, so every entry point that mutates the cache goes through here.
 */
@Slf4j
@Service
public class RunCoordinator {

  static final String RUN_ID_MDC_KEY = "runId";

  private final Executor runExecutor;
  private final AtomicReference<RunContext> active = new AtomicReference<>();
  private volatile RunContext lastRun;

  public RunCoordinator(@Qualifier(CoreConfig.RUN_EXECUTOR) Executor runExecutor) {
    this.runExecutor = runExecutor;
  }

  /** Starts {@code body} on the run executor and returns immediately. */
  public RunStatus launch(String taskName, boolean force, Function<RunContext, ?> body) {
    RunContext context = acquire(taskName, force);
    try {
      runExecutor.execute(
          () -> {
            try {
              execute(context, body);
            } catch (RuntimeException e) {
              // Already recorded on the run status and logged by execute
              log.debug("Background run {} ended with {}", context.getRunId(), e.toString());
            }
          });
    } catch (RejectedExecutionException e) {
      active.compareAndSet(context, null);
      throw new RunInProgressException(taskName);
    }
    return context.snapshot();
  }

  /** Runs {@code body} on the calling thread, rethrowing whatever ended it. */
  public <T> T runNow(String taskName, boolean force, Function<RunContext, T> body) {
    return execute(acquire(taskName, force), body);
  }

  /** Requests cooperative cancellation; false when nothing is running. */
  public boolean cancel() {
    RunContext context = active.get();
    if (context == null) {
      return false;
    }
    context.requestCancellation();
    log.info("Cancellation requested for run {} ({})", context.getRunId(), context.getTaskName());
    return true;
  }

  public boolean isRunning() {
    return active.get() != null;
  }

  public Optional<RunStatus> getCurrentRun() {
    return Optional.ofNullable(active.get()).map(RunContext::snapshot);
  }

  public Optional<RunStatus> getLastRun() {
    return Optional.ofNullable(lastRun).map(RunContext::snapshot);
  }

  private RunContext acquire(String taskName, boolean force) {
    RunContext context =
        new RunContext(
            taskName,
            force,
            (step, completed, total) -> log.debug("{}: {}/{}", step, completed, total));
    if (!active.compareAndSet(null, context)) {
      RunContext running = active.get();
      throw new RunInProgressException(running != null ? running.getTaskName() : taskName);
    }
    return context;
  }

  private <T> T execute(RunContext context, Function<RunContext, T> body) {
    MDC.put(RUN_ID_MDC_KEY, context.getRunId());
    log.info(
        "Run {} started: {} (force={})",
        context.getRunId(),
        context.getTaskName(),
        context.isForce());
    try {
      T result = body.apply(context);
      context.finish(RunState.DONE, "Completed", null, result);
      log.info("Run {} completed", context.getRunId());
      return result;
    } catch (RunCancelledException e) {
      context.finish(RunState.CANCELLED, e.getMessage(), null, null);
      log.warn("Run {} cancelled", context.getRunId());
      throw e;
    } catch (ConfigurationException e) {
      context.finish(RunState.FAILED, e.getMessage(), e.getGuidance(), null);
      log.error("Run {} aborted: {} ({})", context.getRunId(), e.getMessage(), e.getGuidance());
      throw e;
    } catch (RuntimeException e) {
      context.finish(RunState.FAILED, e.getMessage(), null, null);
      log.error("Run {} failed", context.getRunId(), e);
      throw e;
    } finally {
      lastRun = context;
      active.compareAndSet(context, null);
      MDC.remove(RUN_ID_MDC_KEY);
    }
  }
}
