package com.notelinker.engine.service.orchestration;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.google.common.collect.Lists;

/**
 * Fixed-size batches over a work list. The cancellation token is checked before each batch is
 * handed out, so a cancelled run stops between batches and never inside one.
 */
public class BatchIterator<T> implements Iterator<List<T>> {

  private final List<List<T>> batches;
  private final CancellationToken cancellationToken;
  private int position;

  public BatchIterator(List<T> items, int batchSize, CancellationToken cancellationToken) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
    }
    this.batches = Lists.partition(items, batchSize);
    this.cancellationToken = cancellationToken;
  }

  @Override
  public boolean hasNext() {
    return position < batches.size();
  }

  /**
   * @throws com.notelinker.engine.exception.RunCancelledException if cancellation was requested
   */
  @Override
  public List<T> next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    cancellationToken.throwIfCancellationRequested();
    return batches.get(position++);
  }

  /** One-based number of the batch most recently returned by {@link #next()}. */
  public int getBatchNumber() {
    return position;
  }

  public int getTotalBatches() {
    return batches.size();
  }
}
