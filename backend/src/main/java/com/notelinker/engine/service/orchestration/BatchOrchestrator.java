package com.notelinker.engine.service.orchestration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import com.notelinker.engine.dto.cache.BatchDescriptor;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.ContentException;
import com.notelinker.engine.exception.RunCancelledException;
import com.notelinker.engine.service.failure.FailureJournalService;

import lombok.extern.slf4j.Slf4j;

/**
 * Shared batch loop for embedding, scoring and tagging. Batches run one after another; each
 * successful batch is persisted by {@link #processBatch} before the next one starts.
 *
 * <p>Failure handling: a configuration error or a cancellation ends the run; a content error naming
 * one item drops that item and re-sends the rest; any other error is journaled against the whole
 * batch and the loop moves on.
 */
@Slf4j
public abstract class BatchOrchestrator<T, R> {

  protected final FailureJournalService failureJournal;

  protected BatchOrchestrator(FailureJournalService failureJournal) {
    this.failureJournal = failureJournal;
  }

  protected abstract OperationType operationType();

  /** Sends one batch and persists its results. Must flush the cache before returning. */
  protected abstract List<R> processBatch(List<T> batch, RunContext context);

  /** Key recorded in the failure journal for {@code item}. */
  protected abstract String itemKey(T item);

  /** Human-readable form of {@code item}, normally note paths. */
  protected abstract String itemLabel(T item);

  /** Whether a content error's item id refers to {@code item}. */
  protected boolean matchesItem(T item, String itemId) {
    return itemKey(item).equals(itemId);
  }

  /** Keys whose earlier failures this batch has now made good. */
  protected Collection<String> succeededKeys(List<T> batch, List<R> results) {
    return keysOf(batch);
  }

  protected BatchOutcome<R> runBatches(
      List<T> items, int batchSize, RunContext context, String progressStep) {
    BatchOutcome<R> outcome = new BatchOutcome<>(operationType());
    BatchIterator<T> batches =
        new BatchIterator<>(items, batchSize, context.getCancellationToken());
    outcome.setTotalBatches(batches.getTotalBatches());

    while (batches.hasNext()) {
      List<T> batch = batches.next();
      runBatch(batch, batches.getBatchNumber(), batches.getTotalBatches(), context, outcome);
      context.reportProgress(progressStep, batches.getBatchNumber(), batches.getTotalBatches());
    }

    if (outcome.hasFailures()) {
      log.warn(
          "{} of {} {} batches failed; they are journaled for the next run",
          outcome.getFailedBatches(),
          outcome.getTotalBatches(),
          operationType().dbValue());
    }
    return outcome;
  }

  private void runBatch(
      List<T> batch,
      int batchNumber,
      int totalBatches,
      RunContext context,
      BatchOutcome<R> outcome) {
    List<T> pending = new ArrayList<>(batch);
    while (!pending.isEmpty()) {
      try {
        List<R> results = processBatch(pending, context);
        outcome.getResults().addAll(results);
        failureJournal.resolveCoveredFailures(operationType(), succeededKeys(pending, results));
        log.debug(
            "{} batch {}/{} done ({} items)",
            operationType().dbValue(),
            batchNumber,
            totalBatches,
            pending.size());
        return;
      } catch (ConfigurationException | RunCancelledException e) {
        throw e;
      } catch (ContentException e) {
        T offending = findItem(pending, e.getItemId());
        if (offending == null || pending.size() == 1) {
          recordBatchFailure(pending, batchNumber, totalBatches, e, outcome);
          return;
        }
        log.warn("Skipping unprocessable item {}: {}", itemLabel(offending), e.getReason());
        failureJournal.recordFailure(
            operationType(), descriptor(List.of(offending), batchNumber, totalBatches), e);
        outcome.setSkippedItems(outcome.getSkippedItems() + 1);
        pending.remove(offending);
      } catch (RuntimeException e) {
        recordBatchFailure(pending, batchNumber, totalBatches, e, outcome);
        return;
      }
    }
  }

  private void recordBatchFailure(
      List<T> batch,
      int batchNumber,
      int totalBatches,
      RuntimeException error,
      BatchOutcome<R> outcome) {
    outcome.setFailedBatches(outcome.getFailedBatches() + 1);
    log.error(
        "{} batch {}/{} failed: {}",
        operationType().dbValue(),
        batchNumber,
        totalBatches,
        error.getMessage(),
        error);
    failureJournal.recordFailure(
        operationType(), descriptor(batch, batchNumber, totalBatches), error);
  }

  protected BatchDescriptor descriptor(List<T> batch, int batchNumber, int totalBatches) {
    return BatchDescriptor.builder()
        .batchNumber(batchNumber)
        .totalBatches(totalBatches)
        .itemKeys(keysOf(batch))
        .labels(batch.stream().map(this::itemLabel).collect(Collectors.toList()))
        .build();
  }

  protected List<String> keysOf(List<T> batch) {
    return batch.stream().map(this::itemKey).collect(Collectors.toList());
  }

  private T findItem(List<T> batch, String itemId) {
    if (itemId == null) {
      return null;
    }
    return batch.stream().filter(item -> matchesItem(item, itemId)).findFirst().orElse(null);
  }
}
