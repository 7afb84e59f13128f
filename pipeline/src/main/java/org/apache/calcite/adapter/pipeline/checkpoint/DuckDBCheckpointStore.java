/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.adapter.pipeline.checkpoint;

import org.apache.calcite.adapter.pipeline.util.DuckDBUtil;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * DuckDB-based checkpoint store.
 *
 * <p>Stores checkpoints in {@code .pipeline_checkpoints.duckdb} under the
 * work directory, table {@code run_checkpoint}. External orchestration can
 * query the file directly:
 * <pre>{@code
 * SELECT stage, status, input_fingerprint FROM run_checkpoint
 * WHERE pipeline = 'transactions' ORDER BY started_at DESC;
 * }</pre>
 */
public class DuckDBCheckpointStore implements CheckpointStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBCheckpointStore.class);

  /** SQL resource path prefix. */
  private static final String SQL_RESOURCE_PATH =
      "org/apache/calcite/adapter/pipeline/checkpoint/";

  /** Database file name within the work directory. */
  public static final String DATABASE_FILE = ".pipeline_checkpoints.duckdb";

  private static final String SELECT_COLUMNS = "SELECT pipeline, stage, input_fingerprint, "
      + "output_fingerprint, status, started_at, completed_at, detail FROM run_checkpoint ";

  /** Path to the DuckDB database file. */
  private final Path dbPath;

  /** Shared connection, guarded by {@link #connectionLock}. */
  private Connection connection;

  private final Object connectionLock = new Object();

  private DuckDBCheckpointStore(Path dbPath) {
    this.dbPath = dbPath;
  }

  /**
   * Opens (creating if needed) the checkpoint store of a work directory.
   *
   * @throws IOException If the database cannot be created
   */
  public static DuckDBCheckpointStore open(Path workDirectory) throws IOException {
    Files.createDirectories(workDirectory);
    DuckDBCheckpointStore store = new DuckDBCheckpointStore(workDirectory.resolve(DATABASE_FILE));
    try {
      store.executeSqlResource("create_run_checkpoint.sql");
    } catch (SQLException e) {
      store.close();
      throw new IOException("Failed to initialize checkpoint store at "
          + store.dbPath + ": " + e.getMessage(), e);
    }
    LOGGER.info("Initialized DuckDB checkpoint store at {}", store.dbPath);
    return store;
  }

  public Path getDatabasePath() {
    return dbPath;
  }

  /**
   * Get or create the database connection.
   */
  private Connection getConnection() throws SQLException {
    synchronized (connectionLock) {
      if (connection == null || connection.isClosed()) {
        connection = DuckDBUtil.open(dbPath);
      }
      return connection;
    }
  }

  /**
   * Execute SQL with automatic retry on busy database.
   */
  private void executeWithRetry(String sql) throws SQLException {
    int maxRetries = 3;
    int retryDelayMs = 100;

    for (int attempt = 1; attempt <= maxRetries; attempt++) {
      try {
        synchronized (connectionLock) {
          try (Statement stmt = getConnection().createStatement()) {
            stmt.execute(sql);
          }
        }
        return;
      } catch (SQLException e) {
        if (attempt == maxRetries) {
          throw e;
        }
        LOGGER.debug("Database busy, retrying ({}/{}): {}", attempt, maxRetries, e.getMessage());
        try {
          Thread.sleep((long) retryDelayMs * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }

  /**
   * Load SQL from a resource file.
   */
  private String loadSqlResource(String resourceName) throws SQLException {
    String resourcePath = SQL_RESOURCE_PATH + resourceName;
    try (InputStream is = getClass().getClassLoader().getResourceAsStream(resourcePath)) {
      if (is == null) {
        throw new SQLException("SQL resource not found: " + resourcePath);
      }
      try (BufferedReader reader = new BufferedReader(
          new InputStreamReader(is, StandardCharsets.UTF_8))) {
        StringBuilder sb = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
          sb.append(line).append("\n");
        }
        return sb.toString();
      }
    } catch (IOException e) {
      throw new SQLException("Failed to load SQL resource: " + resourcePath, e);
    }
  }

  /**
   * Execute SQL statements from a resource file.
   */
  private void executeSqlResource(String resourceName) throws SQLException {
    String sql = loadSqlResource(resourceName);
    LOGGER.debug("Executing SQL resource {}", resourceName);
    for (String statement : sql.split(";")) {
      // Remove comment lines first, then check if anything remains
      StringBuilder sqlBuilder = new StringBuilder();
      for (String line : statement.trim().split("\n")) {
        String trimmedLine = line.trim();
        if (!trimmedLine.isEmpty() && !trimmedLine.startsWith("--")) {
          sqlBuilder.append(line).append("\n");
        }
      }
      String cleanSql = sqlBuilder.toString().trim();
      if (!cleanSql.isEmpty()) {
        executeWithRetry(cleanSql);
      }
    }
  }

  @Override public void recordStart(String pipeline, String stage, String inputFingerprint)
      throws IOException {
    upsert(pipeline, stage, inputFingerprint, null, CheckpointStatus.RUNNING,
        System.currentTimeMillis(), null, null);
    LOGGER.debug("Checkpoint {}/{} RUNNING for input {}", pipeline, stage, inputFingerprint);
  }

  @Override public void recordSuccess(String pipeline, String stage, String inputFingerprint,
      String outputFingerprint, @Nullable String detail) throws IOException {
    complete(pipeline, stage, inputFingerprint, outputFingerprint, CheckpointStatus.SUCCEEDED,
        detail);
  }

  @Override public void recordFailure(String pipeline, String stage, String inputFingerprint,
      String detail) throws IOException {
    complete(pipeline, stage, inputFingerprint, null, CheckpointStatus.FAILED, detail);
  }

  private void complete(String pipeline, String stage, String inputFingerprint,
      @Nullable String outputFingerprint, CheckpointStatus status, @Nullable String detail)
      throws IOException {
    long now = System.currentTimeMillis();
    Checkpoint existing = find(pipeline, stage, inputFingerprint);
    long startedAt = existing != null ? existing.getStartedAt() : now;
    upsert(pipeline, stage, inputFingerprint, outputFingerprint, status, startedAt, now, detail);
    LOGGER.debug("Checkpoint {}/{} {} for input {}", pipeline, stage, status, inputFingerprint);
  }

  private void upsert(String pipeline, String stage, String inputFingerprint,
      @Nullable String outputFingerprint, CheckpointStatus status, long startedAt,
      @Nullable Long completedAt, @Nullable String detail) throws IOException {
    String sql = "INSERT INTO run_checkpoint "
        + "(pipeline, stage, input_fingerprint, output_fingerprint, status, started_at, "
        + "completed_at, detail) VALUES (?, ?, ?, ?, ?, ?, ?, ?) "
        + "ON CONFLICT (pipeline, stage, input_fingerprint) DO UPDATE SET "
        + "output_fingerprint = EXCLUDED.output_fingerprint, "
        + "status = EXCLUDED.status, "
        + "started_at = EXCLUDED.started_at, "
        + "completed_at = EXCLUDED.completed_at, "
        + "detail = EXCLUDED.detail";
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, pipeline);
        stmt.setString(2, stage);
        stmt.setString(3, inputFingerprint);
        if (outputFingerprint == null) {
          stmt.setNull(4, Types.VARCHAR);
        } else {
          stmt.setString(4, outputFingerprint);
        }
        stmt.setString(5, status.name());
        stmt.setLong(6, startedAt);
        if (completedAt == null) {
          stmt.setNull(7, Types.BIGINT);
        } else {
          stmt.setLong(7, completedAt);
        }
        if (detail == null) {
          stmt.setNull(8, Types.VARCHAR);
        } else {
          stmt.setString(8, detail);
        }
        stmt.executeUpdate();
      } catch (SQLException e) {
        throw new IOException("Error writing checkpoint " + pipeline + "/" + stage + ": "
            + e.getMessage(), e);
      }
    }
  }

  @Override public @Nullable Checkpoint find(String pipeline, String stage,
      String inputFingerprint) throws IOException {
    String sql = SELECT_COLUMNS + "WHERE pipeline = ? AND stage = ? AND input_fingerprint = ?";
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, pipeline);
        stmt.setString(2, stage);
        stmt.setString(3, inputFingerprint);
        try (ResultSet rs = stmt.executeQuery()) {
          return rs.next() ? toCheckpoint(rs) : null;
        }
      } catch (SQLException e) {
        throw new IOException("Error reading checkpoint " + pipeline + "/" + stage + ": "
            + e.getMessage(), e);
      }
    }
  }

  @Override public List<Checkpoint> list(String pipeline) throws IOException {
    String sql = SELECT_COLUMNS + "WHERE pipeline = ? ORDER BY started_at DESC, stage";
    List<Checkpoint> result = new ArrayList<>();
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, pipeline);
        try (ResultSet rs = stmt.executeQuery()) {
          while (rs.next()) {
            result.add(toCheckpoint(rs));
          }
        }
      } catch (SQLException e) {
        throw new IOException("Error listing checkpoints of " + pipeline + ": "
            + e.getMessage(), e);
      }
    }
    return result;
  }

  /** Deletes every checkpoint of a pipeline, forcing a full re-run. */
  public int invalidateAll(String pipeline) throws IOException {
    String sql = "DELETE FROM run_checkpoint WHERE pipeline = ?";
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, pipeline);
        int deleted = stmt.executeUpdate();
        if (deleted > 0) {
          LOGGER.info("Invalidated {} checkpoint(s) of {}", deleted, pipeline);
        }
        return deleted;
      } catch (SQLException e) {
        throw new IOException("Error invalidating checkpoints of " + pipeline + ": "
            + e.getMessage(), e);
      }
    }
  }

  private static Checkpoint toCheckpoint(ResultSet rs) throws SQLException {
    long completed = rs.getLong("completed_at");
    Long completedAt = rs.wasNull() ? null : completed;
    return new Checkpoint(
        rs.getString("pipeline"),
        rs.getString("stage"),
        rs.getString("input_fingerprint"),
        rs.getString("output_fingerprint"),
        CheckpointStatus.valueOf(rs.getString("status")),
        rs.getLong("started_at"),
        completedAt,
        rs.getString("detail"));
  }

  @Override public void close() throws IOException {
    synchronized (connectionLock) {
      if (connection != null) {
        try {
          connection.close();
          LOGGER.debug("Closed checkpoint store at {}", dbPath);
        } catch (SQLException e) {
          throw new IOException("Error closing checkpoint store at " + dbPath, e);
        } finally {
          connection = null;
        }
      }
    }
  }

  @Override public String toString() {
    return "DuckDBCheckpointStore{" + dbPath + "}";
  }
}
