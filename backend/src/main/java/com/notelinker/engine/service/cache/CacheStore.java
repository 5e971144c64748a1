package com.notelinker.engine.service.cache;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import org.springframework.stereotype.Repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notelinker.engine.config.ApplicationProperties;
import com.notelinker.engine.dto.cache.BatchDescriptor;
import com.notelinker.engine.dto.cache.CacheStatistics;
import com.notelinker.engine.dto.cache.CleanupResult;
import com.notelinker.engine.dto.cache.DocumentRecord;
import com.notelinker.engine.dto.cache.EmbeddingVector;
import com.notelinker.engine.dto.cache.FailureRecord;
import com.notelinker.engine.dto.cache.LinkLedgerEntry;
import com.notelinker.engine.dto.cache.OperationType;
import com.notelinker.engine.dto.cache.PairScore;
import com.notelinker.engine.exception.CacheStoreException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable cache of note metadata, embeddings, pair scores, the link ledger and the failure log.
 *
 * <p>The data lives in a private in-memory H2 database. Mutations only mark the store dirty;
 * {@link #flush()} serializes the whole database to a SQL script when something changed, and the
 * script is replayed on the next start. All methods are synchronized: one run writes at a time.
 */
@Slf4j
@Repository
public class CacheStore {

  private static final String[] SCHEMA = {
    "CREATE TABLE IF NOT EXISTS documents ("
        + "id VARCHAR PRIMARY KEY, "
        + "path VARCHAR NOT NULL UNIQUE, "
        + "content_hash VARCHAR, "
        + "created_at BIGINT NOT NULL, "
        + "modified_at BIGINT, "
        + "title VARCHAR, "
        + "tags_json VARCHAR, "
        + "embedding_updated_at BIGINT, "
        + "tags_generated_at BIGINT)",
    "CREATE TABLE IF NOT EXISTS embeddings ("
        + "document_id VARCHAR PRIMARY KEY, "
        + "vector BLOB NOT NULL, "
        + "model VARCHAR, "
        + "created_at BIGINT NOT NULL)",
    "CREATE TABLE IF NOT EXISTS pair_scores ("
        + "id_1 VARCHAR NOT NULL, "
        + "id_2 VARCHAR NOT NULL, "
        + "similarity_score DOUBLE PRECISION NOT NULL, "
        + "ai_score DOUBLE PRECISION, "
        + "model VARCHAR, "
        + "reasoning VARCHAR, "
        + "updated_at BIGINT NOT NULL, "
        + "PRIMARY KEY (id_1, id_2), "
        + "CHECK (id_1 < id_2))",
    "CREATE TABLE IF NOT EXISTS link_ledger ("
        + "source_id VARCHAR NOT NULL, "
        + "target_id VARCHAR NOT NULL, "
        + "inserted_at BIGINT NOT NULL, "
        + "PRIMARY KEY (source_id, target_id))",
    "CREATE TABLE IF NOT EXISTS failure_log ("
        + "id VARCHAR PRIMARY KEY, "
        + "timestamp BIGINT NOT NULL, "
        + "operation_type VARCHAR NOT NULL, "
        + "batch_info_json VARCHAR, "
        + "error_message VARCHAR, "
        + "resolved BOOLEAN DEFAULT FALSE NOT NULL)",
    "CREATE INDEX IF NOT EXISTS idx_documents_path ON documents(path)",
    "CREATE INDEX IF NOT EXISTS idx_pair_scores_similarity ON pair_scores(similarity_score)",
    "CREATE INDEX IF NOT EXISTS idx_pair_scores_id_1 ON pair_scores(id_1)",
    "CREATE INDEX IF NOT EXISTS idx_pair_scores_id_2 ON pair_scores(id_2)",
    "CREATE INDEX IF NOT EXISTS idx_failure_log_timestamp ON failure_log(timestamp)"
  };

  private static final String DOCUMENT_COLUMNS =
      "id, path, content_hash, created_at, modified_at, title, tags_json, embedding_updated_at,"
          + " tags_generated_at";

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

  @FunctionalInterface
  private interface SqlWork<T> {
    T apply(Connection connection) throws SQLException;
  }

  private final ApplicationProperties properties;
  private final ObjectMapper objectMapper;
  private final ScoreIndex scoreIndex = new ScoreIndex();

  private Connection connection;
  private boolean dirty;
  private boolean indexValid;

  public CacheStore(ApplicationProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  @PostConstruct
  public synchronized void init() {
    String url = "jdbc:h2:mem:linker-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1";
    try {
      connection = DriverManager.getConnection(url, "sa", "");
      Path scriptPath = scriptPath();
      if (properties.getCache().isPersistent() && Files.exists(scriptPath)) {
        try (Statement statement = connection.createStatement()) {
          statement.execute("RUNSCRIPT FROM '" + sqlLiteral(scriptPath) + "'");
        }
        log.info("Loaded linker cache from {}", scriptPath);
      } else {
        log.info("Starting with an empty linker cache");
      }
      createSchema();
      dirty = false;
      indexValid = false;
    } catch (SQLException e) {
      throw new CacheStoreException("Failed to initialise cache database", e);
    }
  }

  private void createSchema() throws SQLException {
    try (Statement statement = connection.createStatement()) {
      for (String ddl : SCHEMA) {
        statement.execute(ddl);
      }
    }
  }

  // ---------------------------------------------------------------- documents

  public synchronized void upsertDocument(DocumentRecord document) {
    withConnection(
        "upsert document " + document.getId(),
        conn -> {
          try (PreparedStatement ps =
              conn.prepareStatement(
                  "MERGE INTO documents ("
                      + DOCUMENT_COLUMNS
                      + ") KEY (id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            Instant createdAt =
                document.getCreatedAt() != null ? document.getCreatedAt() : Instant.now();
            ps.setString(1, document.getId());
            ps.setString(2, document.getPath());
            ps.setString(3, document.getContentHash());
            ps.setLong(4, createdAt.toEpochMilli());
            setInstant(ps, 5, document.getModifiedAt());
            ps.setString(6, document.getTitle());
            ps.setString(7, toJson(document.getTags()));
            setInstant(ps, 8, document.getEmbeddingUpdatedAt());
            setInstant(ps, 9, document.getTagsGeneratedAt());
            ps.executeUpdate();
          }
          return null;
        });
    markDirty();
  }

  public synchronized Optional<DocumentRecord> getDocument(String id) {
    return withConnection(
        "get document " + id,
        conn ->
            querySingleDocument(
                conn, "SELECT " + DOCUMENT_COLUMNS + " FROM documents WHERE id = ?", id));
  }

  public synchronized Optional<DocumentRecord> getDocumentByPath(String path) {
    return withConnection(
        "get document by path " + path,
        conn ->
            querySingleDocument(
                conn, "SELECT " + DOCUMENT_COLUMNS + " FROM documents WHERE path = ?", path));
  }

  public synchronized List<DocumentRecord> getAllDocuments() {
    return withConnection(
        "list documents",
        conn -> {
          List<DocumentRecord> documents = new ArrayList<>();
          try (Statement statement = conn.createStatement();
              ResultSet rs =
                  statement.executeQuery(
                      "SELECT " + DOCUMENT_COLUMNS + " FROM documents ORDER BY path")) {
            while (rs.next()) {
              documents.add(mapDocument(rs));
            }
          }
          return documents;
        });
  }

  public synchronized boolean deleteDocument(String id) {
    int deleted = executeUpdate("delete document " + id, "DELETE FROM documents WHERE id = ?", id);
    if (deleted > 0) {
      markDirty();
    }
    return deleted > 0;
  }

  /** Stores freshly generated tags without claiming they reached the note yet. */
  public synchronized void stageTags(String documentId, List<String> tags) {
    int updated =
        executeUpdate(
            "stage tags for " + documentId,
            "UPDATE documents SET tags_json = ? WHERE id = ?",
            toJson(tags),
            documentId);
    if (updated == 0) {
      log.warn("Cannot stage tags for unknown document {}", documentId);
      return;
    }
    markDirty();
  }

  public synchronized void markTagsCommitted(String documentId, Instant committedAt) {
    executeUpdate(
        "commit tags for " + documentId,
        "UPDATE documents SET tags_generated_at = ? WHERE id = ?",
        committedAt.toEpochMilli(),
        documentId);
    markDirty();
  }

  // ---------------------------------------------------------------- embeddings

  public synchronized void saveEmbedding(EmbeddingVector embedding) {
    withConnection(
        "save embedding " + embedding.getDocumentId(),
        conn -> {
          try (PreparedStatement ps =
              conn.prepareStatement(
                  "MERGE INTO embeddings (document_id, vector, model, created_at) KEY (document_id)"
                      + " VALUES (?, ?, ?, ?)")) {
            Instant createdAt =
                embedding.getCreatedAt() != null ? embedding.getCreatedAt() : Instant.now();
            ps.setString(1, embedding.getDocumentId());
            ps.setBytes(2, FloatVectorCodec.encode(embedding.getVector()));
            ps.setString(3, embedding.getModel());
            ps.setLong(4, createdAt.toEpochMilli());
            ps.executeUpdate();
          }
          return null;
        });
    markDirty();
  }

  public synchronized Optional<EmbeddingVector> getEmbedding(String documentId) {
    return withConnection(
        "get embedding " + documentId,
        conn -> {
          try (PreparedStatement ps =
              conn.prepareStatement(
                  "SELECT document_id, vector, model, created_at FROM embeddings"
                      + " WHERE document_id = ?")) {
            ps.setString(1, documentId);
            try (ResultSet rs = ps.executeQuery()) {
              return rs.next() ? Optional.of(mapEmbedding(rs)) : Optional.<EmbeddingVector>empty();
            }
          }
        });
  }

  /** All vectors keyed by note id, in a stable order. */
  public synchronized Map<String, float[]> getAllEmbeddings() {
    return withConnection(
        "list embeddings",
        conn -> {
          Map<String, float[]> embeddings = new LinkedHashMap<>();
          try (Statement statement = conn.createStatement();
              ResultSet rs =
                  statement.executeQuery(
                      "SELECT document_id, vector FROM embeddings ORDER BY document_id")) {
            while (rs.next()) {
              embeddings.put(rs.getString(1), FloatVectorCodec.decode(rs.getBytes(2)));
            }
          }
          return embeddings;
        });
  }

  /** The model that produced each stored vector, keyed by note id. */
  public synchronized Map<String, String> getEmbeddingModels() {
    return withConnection(
        "list embedding models",
        conn -> {
          Map<String, String> models = new LinkedHashMap<>();
          try (Statement statement = conn.createStatement();
              ResultSet rs =
                  statement.executeQuery(
                      "SELECT document_id, model FROM embeddings ORDER BY document_id")) {
            while (rs.next()) {
              models.put(rs.getString(1), rs.getString(2));
            }
          }
          return models;
        });
  }

  public synchronized boolean deleteEmbedding(String documentId) {
    int deleted =
        executeUpdate(
            "delete embedding " + documentId,
            "DELETE FROM embeddings WHERE document_id = ?",
            documentId);
    if (deleted > 0) {
      markDirty();
    }
    return deleted > 0;
  }

  // ---------------------------------------------------------------- pair scores

  public synchronized void saveScore(PairScore score) {
    batchSaveScores(Collections.singletonList(score));
  }

  /** Writes scores in one JDBC batch. Pairs are canonicalised before writing. */
  public synchronized void batchSaveScores(Collection<PairScore> scores) {
    if (scores.isEmpty()) {
      return;
    }
    List<PairScore> canonical =
        scores.stream().map(PairScore::canonical).collect(Collectors.toList());
    withConnection(
        "save " + canonical.size() + " scores",
        conn -> {
          try (PreparedStatement ps =
              conn.prepareStatement(
                  "MERGE INTO pair_scores (id_1, id_2, similarity_score, ai_score, model,"
                      + " reasoning, updated_at) KEY (id_1, id_2) VALUES (?, ?, ?, ?, ?, ?, ?)")) {
            for (PairScore score : canonical) {
              if (score.getLastScored() == null) {
                score.setLastScored(Instant.now());
              }
              ps.setString(1, score.getId1());
              ps.setString(2, score.getId2());
              ps.setDouble(3, score.getSimilarityScore());
              ps.setDouble(4, score.getAiScore());
              ps.setString(5, score.getModel());
              ps.setString(6, score.getReasoning());
              ps.setLong(7, score.getLastScored().toEpochMilli());
              ps.addBatch();
            }
            ps.executeBatch();
          }
          return null;
        });
    if (indexValid) {
      canonical.forEach(scoreIndex::put);
    }
    markDirty();
  }

  public synchronized Optional<PairScore> getScore(String a, String b) {
    ensureScoreIndex();
    return Optional.ofNullable(scoreIndex.get(a, b));
  }

  /**
   * Scores touching {@code documentId}, served from the in-memory index, ordered by descending
   * similarity and capped at the filter's limit.
   */
  public synchronized List<PairScore> getScoresForDocument(String documentId, ScoreFilter filter) {
    ensureScoreIndex();
    return scoreIndex.scoresFor(documentId).stream()
        .filter(
            score ->
                filter.getMinSimilarity() == null
                    || score.getSimilarityScore() >= filter.getMinSimilarity())
        .filter(
            score ->
                filter.getMinAiScore() == null || score.getAiScore() >= filter.getMinAiScore())
        .sorted(Comparator.comparingDouble(PairScore::getSimilarityScore).reversed())
        .limit(filter.getLimit())
        .collect(Collectors.toList());
  }

  public synchronized List<PairScore> getScoresForDocument(String documentId) {
    return getScoresForDocument(documentId, ScoreFilter.builder().build());
  }

  public synchronized List<PairScore> getTopScoresForDocument(String documentId) {
    return getScoresForDocument(documentId, ScoreFilter.top(0.7, 5, 50));
  }

  public synchronized List<PairScore> getAllScores() {
    return withConnection(
        "list scores",
        conn -> {
          List<PairScore> scores = new ArrayList<>();
          try (Statement statement = conn.createStatement();
              ResultSet rs =
                  statement.executeQuery(
                      "SELECT id_1, id_2, similarity_score, ai_score, model, reasoning, updated_at"
                          + " FROM pair_scores ORDER BY similarity_score DESC")) {
            while (rs.next()) {
              scores.add(mapScore(rs));
            }
          }
          return scores;
        });
  }

  /** Drops every score touching {@code documentId}; used when its content changes. */
  public synchronized int deleteScoresForDocument(String documentId) {
    int deleted =
        executeUpdate(
            "delete scores for " + documentId,
            "DELETE FROM pair_scores WHERE id_1 = ? OR id_2 = ?",
            documentId,
            documentId);
    if (deleted > 0) {
      if (indexValid) {
        scoreIndex.removeDocument(documentId);
      }
      markDirty();
    }
    return deleted;
  }

  /** Forces the next score lookup to reload the index from the table. */
  public synchronized void invalidateScoreIndex() {
    scoreIndex.clear();
    indexValid = false;
  }

  private void ensureScoreIndex() {
    if (indexValid) {
      return;
    }
    scoreIndex.clear();
    getAllScores().forEach(scoreIndex::put);
    indexValid = true;
    log.debug("Rebuilt score index for {} notes", scoreIndex.documentCount());
  }

  // ---------------------------------------------------------------- link ledger

  /** Records a link; an existing entry keeps its original insertion time. */
  public synchronized boolean addLinkEntry(String sourceId, String targetId) {
    boolean inserted =
        withConnection(
            "add ledger entry " + sourceId + " -> " + targetId,
            conn -> {
              if (ledgerEntryExists(conn, sourceId, targetId)) {
                return false;
              }
              try (PreparedStatement ps =
                  conn.prepareStatement(
                      "INSERT INTO link_ledger (source_id, target_id, inserted_at)"
                          + " VALUES (?, ?, ?)")) {
                ps.setString(1, sourceId);
                ps.setString(2, targetId);
                ps.setLong(3, Instant.now().toEpochMilli());
                ps.executeUpdate();
              }
              return true;
            });
    if (inserted) {
      markDirty();
    }
    return inserted;
  }

  public synchronized boolean removeLinkEntry(String sourceId, String targetId) {
    int deleted =
        executeUpdate(
            "remove ledger entry " + sourceId + " -> " + targetId,
            "DELETE FROM link_ledger WHERE source_id = ? AND target_id = ?",
            sourceId,
            targetId);
    if (deleted > 0) {
      markDirty();
    }
    return deleted > 0;
  }

  public synchronized List<LinkLedgerEntry> getLinkEntries(String sourceId) {
    return withConnection(
        "list ledger entries for " + sourceId,
        conn -> {
          List<LinkLedgerEntry> entries = new ArrayList<>();
          try (PreparedStatement ps =
              conn.prepareStatement(
                  "SELECT source_id, target_id, inserted_at FROM link_ledger WHERE source_id = ?"
                      + " ORDER BY inserted_at, target_id")) {
            ps.setString(1, sourceId);
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) {
                entries.add(
                    LinkLedgerEntry.builder()
                        .sourceId(rs.getString(1))
                        .targetId(rs.getString(2))
                        .insertedAt(Instant.ofEpochMilli(rs.getLong(3)))
                        .build());
              }
            }
          }
          return entries;
        });
  }

  public synchronized Set<String> getLinkTargets(String sourceId) {
    return getLinkEntries(sourceId).stream()
        .map(LinkLedgerEntry::getTargetId)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  public synchronized Set<String> getSourcesLinkingTo(String targetId) {
    return withConnection(
        "list ledger sources for " + targetId,
        conn -> {
          Set<String> sources = new LinkedHashSet<>();
          try (PreparedStatement ps =
              conn.prepareStatement("SELECT source_id FROM link_ledger WHERE target_id = ?")) {
            ps.setString(1, targetId);
            try (ResultSet rs = ps.executeQuery()) {
              while (rs.next()) {
                sources.add(rs.getString(1));
              }
            }
          }
          return sources;
        });
  }

  /** Makes the ledger of {@code sourceId} exactly {@code targetIds}, keeping surviving entries. */
  public synchronized void replaceLinkTargets(String sourceId, Collection<String> targetIds) {
    Set<String> current = getLinkTargets(sourceId);
    for (String existing : current) {
      if (!targetIds.contains(existing)) {
        removeLinkEntry(sourceId, existing);
      }
    }
    for (String target : targetIds) {
      if (!current.contains(target)) {
        addLinkEntry(sourceId, target);
      }
    }
  }

  private boolean ledgerEntryExists(Connection conn, String sourceId, String targetId)
      throws SQLException {
    try (PreparedStatement ps =
        conn.prepareStatement(
            "SELECT 1 FROM link_ledger WHERE source_id = ? AND target_id = ?")) {
      ps.setString(1, sourceId);
      ps.setString(2, targetId);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }

  // ---------------------------------------------------------------- failure log

  /** Inserts or overwrites a failure record by id. */
  public synchronized void saveFailure(FailureRecord failure) {
    withConnection(
        "save failure " + failure.getId(),
        conn -> {
          try (PreparedStatement ps =
              conn.prepareStatement(
                  "MERGE INTO failure_log (id, timestamp, operation_type, batch_info_json,"
                      + " error_message, resolved) KEY (id) VALUES (?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, failure.getId());
            ps.setLong(2, failure.getTimestamp().toEpochMilli());
            ps.setString(3, failure.getOperationType().dbValue());
            ps.setString(4, toJson(failure.getBatch()));
            ps.setString(5, failure.getErrorDetail());
            ps.setBoolean(6, failure.isResolved());
            ps.executeUpdate();
          }
          return null;
        });
    markDirty();
  }

  /** Most recent failures first. */
  public synchronized List<FailureRecord> getFailures(int limit) {
    return queryFailures(
        "SELECT * FROM failure_log ORDER BY timestamp DESC LIMIT " + Math.max(0, limit));
  }

  public synchronized List<FailureRecord> getUnresolvedFailures() {
    return queryFailures("SELECT * FROM failure_log WHERE resolved = FALSE ORDER BY timestamp");
  }

  public synchronized boolean resolveFailure(String id) {
    int updated =
        executeUpdate(
            "resolve failure " + id, "UPDATE failure_log SET resolved = TRUE WHERE id = ?", id);
    if (updated > 0) {
      markDirty();
    }
    return updated > 0;
  }

  public synchronized boolean deleteFailure(String id) {
    int deleted = executeUpdate("delete failure " + id, "DELETE FROM failure_log WHERE id = ?", id);
    if (deleted > 0) {
      markDirty();
    }
    return deleted > 0;
  }

  public synchronized int deleteResolvedFailuresBefore(Instant cutoff) {
    int deleted =
        executeUpdate(
            "purge resolved failures",
            "DELETE FROM failure_log WHERE resolved = TRUE AND timestamp < ?",
            cutoff.toEpochMilli());
    if (deleted > 0) {
      markDirty();
    }
    return deleted;
  }

  private List<FailureRecord> queryFailures(String sql) {
    return withConnection(
        "list failures",
        conn -> {
          List<FailureRecord> failures = new ArrayList<>();
          try (Statement statement = conn.createStatement();
              ResultSet rs = statement.executeQuery(sql)) {
            while (rs.next()) {
              failures.add(mapFailure(rs));
            }
          }
          return failures;
        });
  }

  // ---------------------------------------------------------------- maintenance

  public synchronized CacheStatistics getStatistics() {
    return withConnection(
        "read statistics",
        conn ->
            CacheStatistics.builder()
                .documents(count(conn, "SELECT COUNT(*) FROM documents"))
                .embeddings(count(conn, "SELECT COUNT(*) FROM embeddings"))
                .scores(count(conn, "SELECT COUNT(*) FROM pair_scores"))
                .ledgerEntries(count(conn, "SELECT COUNT(*) FROM link_ledger"))
                .failures(count(conn, "SELECT COUNT(*) FROM failure_log"))
                .unresolvedFailures(
                    count(conn, "SELECT COUNT(*) FROM failure_log WHERE resolved = FALSE"))
                .build());
  }

  /** Deletes embeddings, scores and ledger rows that reference notes no longer in the cache. */
  public synchronized CleanupResult cleanupOrphans() {
    CleanupResult result =
        withConnection(
            "clean orphans",
            conn -> {
              try (Statement statement = conn.createStatement()) {
                int embeddings =
                    statement.executeUpdate(
                        "DELETE FROM embeddings"
                            + " WHERE document_id NOT IN (SELECT id FROM documents)");
                int scores =
                    statement.executeUpdate(
                        "DELETE FROM pair_scores WHERE id_1 NOT IN (SELECT id FROM documents)"
                            + " OR id_2 NOT IN (SELECT id FROM documents)");
                int ledger =
                    statement.executeUpdate(
                        "DELETE FROM link_ledger WHERE source_id NOT IN (SELECT id FROM documents)"
                            + " OR target_id NOT IN (SELECT id FROM documents)");
                return CleanupResult.builder()
                    .embeddings(embeddings)
                    .scores(scores)
                    .ledgerEntries(ledger)
                    .build();
              }
            });
    if (result.total() > 0) {
      invalidateScoreIndex();
      markDirty();
      log.info(
          "Removed orphans: {} embeddings, {} scores, {} ledger entries",
          result.getEmbeddings(),
          result.getScores(),
          result.getLedgerEntries());
    }
    return result;
  }

  public synchronized void clearAll() {
    withConnection(
        "clear cache",
        conn -> {
          try (Statement statement = conn.createStatement()) {
            for (String table :
                List.of("documents", "embeddings", "pair_scores", "link_ledger", "failure_log")) {
              statement.executeUpdate("DELETE FROM " + table);
            }
          }
          return null;
        });
    invalidateScoreIndex();
    markDirty();
    log.info("Cleared all cached data");
  }

  // ---------------------------------------------------------------- durability

  public synchronized boolean isDirty() {
    return dirty;
  }

  /**
   * Writes the database to its script file if anything changed since the last flush.
   *
   * @return whether a write happened
   */
  public synchronized boolean flush() {
    if (!dirty) {
      return false;
    }
    if (!properties.getCache().isPersistent()) {
      dirty = false;
      return false;
    }
    Path target = scriptPath();
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      if (target.getParent() != null) {
        Files.createDirectories(target.getParent());
      }
      try (Statement statement = connection.createStatement()) {
        statement.execute("SCRIPT TO '" + sqlLiteral(temp) + "'");
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      dirty = false;
      log.debug("Flushed linker cache to {}", target);
      return true;
    } catch (SQLException | IOException e) {
      throw new CacheStoreException("Failed to write cache to " + target, e);
    }
  }

  @PreDestroy
  public synchronized void close() {
    if (connection == null) {
      return;
    }
    try {
      flush();
    } finally {
      try {
        try (Statement statement = connection.createStatement()) {
          statement.execute("SHUTDOWN");
        }
        connection.close();
      } catch (SQLException e) {
        log.warn("Failed to close cache database: {}", e.getMessage());
      }
      connection = null;
    }
  }

  private void markDirty() {
    dirty = true;
  }

  private Path scriptPath() {
    return Paths.get(properties.getCache().getPath()).toAbsolutePath();
  }

  // ---------------------------------------------------------------- helpers

  private <T> T withConnection(String action, SqlWork<T> work) {
    if (connection == null) {
      throw new IllegalStateException("Cache store is not open");
    }
    try {
      return work.apply(connection);
    } catch (SQLException e) {
      throw new CacheStoreException("Cache operation failed: " + action, e);
    }
  }

  private int executeUpdate(String action, String sql, Object... params) {
    return withConnection(
        action,
        conn -> {
          try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
              ps.setObject(i + 1, params[i]);
            }
            return ps.executeUpdate();
          }
        });
  }

  private Optional<DocumentRecord> querySingleDocument(Connection conn, String sql, String param)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      ps.setString(1, param);
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next() ? Optional.of(mapDocument(rs)) : Optional.empty();
      }
    }
  }

  private long count(Connection conn, String sql) throws SQLException {
    try (Statement statement = conn.createStatement();
        ResultSet rs = statement.executeQuery(sql)) {
      return rs.next() ? rs.getLong(1) : 0L;
    }
  }

  private DocumentRecord mapDocument(ResultSet rs) throws SQLException {
    return DocumentRecord.builder()
        .id(rs.getString("id"))
        .path(rs.getString("path"))
        .contentHash(rs.getString("content_hash"))
        .createdAt(getInstant(rs, "created_at"))
        .modifiedAt(getInstant(rs, "modified_at"))
        .title(rs.getString("title"))
        .tags(fromJsonList(rs.getString("tags_json")))
        .embeddingUpdatedAt(getInstant(rs, "embedding_updated_at"))
        .tagsGeneratedAt(getInstant(rs, "tags_generated_at"))
        .build();
  }

  private EmbeddingVector mapEmbedding(ResultSet rs) throws SQLException {
    return EmbeddingVector.builder()
        .documentId(rs.getString("document_id"))
        .vector(FloatVectorCodec.decode(rs.getBytes("vector")))
        .model(rs.getString("model"))
        .createdAt(getInstant(rs, "created_at"))
        .build();
  }

  private PairScore mapScore(ResultSet rs) throws SQLException {
    return PairScore.builder()
        .id1(rs.getString("id_1"))
        .id2(rs.getString("id_2"))
        .similarityScore(rs.getDouble("similarity_score"))
        .aiScore(rs.getDouble("ai_score"))
        .model(rs.getString("model"))
        .reasoning(rs.getString("reasoning"))
        .lastScored(getInstant(rs, "updated_at"))
        .build();
  }

  private FailureRecord mapFailure(ResultSet rs) throws SQLException {
    String batchJson = rs.getString("batch_info_json");
    BatchDescriptor batch;
    try {
      batch =
          batchJson == null
              ? new BatchDescriptor()
              : objectMapper.readValue(batchJson, BatchDescriptor.class);
    } catch (JsonProcessingException e) {
      log.warn("Unreadable batch info on failure {}: {}", rs.getString("id"), e.getMessage());
      batch = new BatchDescriptor();
    }
    return FailureRecord.builder()
        .id(rs.getString("id"))
        .timestamp(getInstant(rs, "timestamp"))
        .operationType(OperationType.fromDbValue(rs.getString("operation_type")))
        .batch(batch)
        .errorDetail(rs.getString("error_message"))
        .resolved(rs.getBoolean("resolved"))
        .build();
  }

  private static void setInstant(PreparedStatement ps, int index, Instant value)
      throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.BIGINT);
    } else {
      ps.setLong(index, value.toEpochMilli());
    }
  }

  private static Instant getInstant(ResultSet rs, String column) throws SQLException {
    long value = rs.getLong(column);
    return rs.wasNull() ? null : Instant.ofEpochMilli(value);
  }

  private String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new CacheStoreException("Failed to serialise " + value.getClass().getSimpleName(), e);
    }
  }

  private List<String> fromJsonList(String json) {
    if (json == null || json.isBlank()) {
      return new ArrayList<>();
    }
    try {
      return objectMapper.readValue(json, STRING_LIST);
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unreadable tags column: {}", e.getMessage());
      return new ArrayList<>();
    }
  }

  private static String sqlLiteral(Path path) {
    return path.toString().replace("'", "''");
  }
}
