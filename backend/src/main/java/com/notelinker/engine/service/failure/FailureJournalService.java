package com.notelinker.engine.service.failure;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.hash.Hashing;
import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.BatchDescriptor;
import com.notelinker.engine.dto.cache.FailureRecord;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.exception.ConfigurationException;
import com.notelinker.engine.exception.ContentException;
import com.notelinker.engine.exception.TransientException;
import com.notelinker.engine.service.cache.CacheStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Journal of batches that failed and must be retried. Records are keyed by operation type and item
 * keys, so recording the same batch twice overwrites instead of duplicating.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailureJournalService {

  private final CacheStore cacheStore;
  private final ObjectMapper objectMapper;
  private final ApplicationProperties properties;

  public FailureRecord recordFailure(OperationType type, BatchDescriptor batch, Throwable error) {
    FailureRecord failure =
        FailureRecord.builder()
            .id(failureId(type, batch.getItemKeys()))
            .timestamp(Instant.now())
            .operationType(type)
            .batch(batch)
            .errorDetail(describe(error))
            .resolved(false)
            .build();
    cacheStore.saveFailure(failure);
    cacheStore.flush();
    log.warn(
        "Recorded {} failure for batch {}/{} ({} items): {}",
        type.dbValue(),
        batch.getBatchNumber(),
        batch.getTotalBatches(),
        batch.getItemKeys().size(),
        error.getMessage());
    return failure;
  }

  public List<FailureRecord> getUnresolvedFailures() {
    return cacheStore.getUnresolvedFailures();
  }

  public List<FailureRecord> getUnresolvedFailures(OperationType type) {
    return cacheStore.getUnresolvedFailures().stream()
        .filter(failure -> failure.getOperationType() == type)
        .collect(Collectors.toList());
  }

  /** Union of the item keys of every unresolved failure of {@code type}. */
  public Set<String> getFailedItemKeys(OperationType type) {
    Set<String> keys = new LinkedHashSet<>();
    getUnresolvedFailures(type).forEach(failure -> keys.addAll(failure.getBatch().getItemKeys()));
    return keys;
  }

  public List<FailureRecord> getRecentFailures(int limit) {
    return cacheStore.getFailures(limit);
  }

  public long getUnresolvedCount() {
    return cacheStore.getUnresolvedFailures().size();
  }

  public boolean deleteFailure(String id) {
    return cacheStore.deleteFailure(id);
  }

  /** Marks a failure as handled without deleting it, so it ages out through cleanup. */
  public boolean resolveFailure(String id) {
    return cacheStore.resolveFailure(id);
  }

  /**
   * Deletes every unresolved failure of {@code type} that shares at least one item key with a batch
   * that just succeeded.
   *
   * @return number of records deleted
   */
  public int resolveCoveredFailures(OperationType type, Collection<String> succeededKeys) {
    if (succeededKeys.isEmpty()) {
      return 0;
    }
    Set<String> succeeded = new HashSet<>(succeededKeys);
    int deleted = 0;
    for (FailureRecord failure : getUnresolvedFailures(type)) {
      boolean covered = failure.getBatch().getItemKeys().stream().anyMatch(succeeded::contains);
      if (covered && cacheStore.deleteFailure(failure.getId())) {
        deleted++;
      }
    }
    if (deleted > 0) {
      cacheStore.flush();
      log.info("Cleared {} {} failure record(s) after a successful batch", deleted, type.dbValue());
    }
    return deleted;
  }

  /** Removes resolved records older than the configured retention. */
  public int cleanupOldFailures() {
    return cleanupOldFailures(properties.getFailures().getRetention());
  }

  public int cleanupOldFailures(Duration retention) {
    int deleted = cacheStore.deleteResolvedFailuresBefore(Instant.now().minus(retention));
    if (deleted > 0) {
      log.info("Removed {} resolved failure record(s) older than {}", deleted, retention);
    }
    return deleted;
  }

  static String failureId(OperationType type, Collection<String> itemKeys) {
    String material = type.dbValue() + "|" + String.join(",", new TreeSet<>(itemKeys));
    String digest = Hashing.sha256().hashString(material, UTF_8).toString();
    return type.dbValue() + "-" + digest.substring(0, 24);
  }

  private String describe(Throwable error) {
    ObjectNode detail = objectMapper.createObjectNode();
    detail.put("message", error.getMessage());
    detail.put("type", error.getClass().getSimpleName());
    if (error instanceof TransientException) {
      TransientException transientError = (TransientException) error;
      detail.put("status", transientError.getStatus());
      detail.put("attempts", transientError.getAttempts());
      if (transientError.getTransportFailure() != null) {
        detail.put("transport", transientError.getTransportFailure().name());
      }
    } else if (error instanceof ConfigurationException) {
      detail.put("status", ((ConfigurationException) error).getStatus());
      detail.put("guidance", ((ConfigurationException) error).getGuidance());
    } else if (error instanceof ContentException) {
      detail.put("item", ((ContentException) error).getItemId());
      detail.put("reason", ((ContentException) error).getReason());
    }
    return detail.toString();
  }
}
