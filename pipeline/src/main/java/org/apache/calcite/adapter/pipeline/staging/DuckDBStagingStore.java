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
package org.apache.calcite.adapter.pipeline.staging;

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.schema.ColumnSpec;
import org.apache.calcite.adapter.pipeline.schema.Schema;
import org.apache.calcite.adapter.pipeline.util.DuckDBUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Persistent tables in a DuckDB file under the pipeline's work directory.
 *
 * <p>Holds the staged raw relation and the transformed feature relation so
 * that a restarted run can pick them up without re-reading the source. Every
 * table carries a leading {@code __row_index} column and is always read back
 * ordered by it.
 */
public class DuckDBStagingStore implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBStagingStore.class);

  /** Name of the row order column. */
  public static final String ROW_INDEX_COLUMN = "__row_index";

  /** Database file name within the work directory. */
  public static final String DATABASE_FILE = ".pipeline_staging.duckdb";

  private static final int INSERT_BATCH_SIZE = 1000;

  private final Path dbPath;
  private final Object connectionLock = new Object();
  private Connection connection;

  public DuckDBStagingStore(Path workDirectory) throws IOException {
    Files.createDirectories(workDirectory);
    this.dbPath = workDirectory.resolve(DATABASE_FILE);
  }

  public Path getDatabasePath() {
    return dbPath;
  }

  private Connection getConnection() throws SQLException {
    synchronized (connectionLock) {
      if (connection == null || connection.isClosed()) {
        connection = DuckDBUtil.open(dbPath);
        DuckDBUtil.applySettings(connection, 0);
      }
      return connection;
    }
  }

  /** Creates (or empties) a table for the schema. */
  public void reset(String table, Schema schema) throws SQLException {
    String sql = DuckDBUtil.createTableSql(table, schema,
        DuckDBUtil.quoteIdentifier(ROW_INDEX_COLUMN) + " BIGINT");
    synchronized (connectionLock) {
      try (Statement stmt = getConnection().createStatement()) {
        stmt.execute(sql);
      }
    }
    LOGGER.debug("Reset staging table {} with columns {}", table, schema.names());
  }

  /**
   * Appends a batch. {@code rowIndexes[i]} is stored as the order key of row
   * {@code i}.
   */
  public void append(String table, RecordBatch batch, long[] rowIndexes) throws SQLException {
    if (rowIndexes.length != batch.rowCount()) {
      throw new IllegalArgumentException("Expected " + batch.rowCount()
          + " row indexes, got " + rowIndexes.length);
    }
    Schema schema = batch.getSchema();
    String sql = DuckDBUtil.insertSql(table, schema, ROW_INDEX_COLUMN);
    synchronized (connectionLock) {
      Connection conn = getConnection();
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try (PreparedStatement stmt = conn.prepareStatement(sql)) {
        for (int r = 0; r < batch.rowCount(); r++) {
          stmt.setLong(1, rowIndexes[r]);
          for (int c = 0; c < schema.size(); c++) {
            DuckDBUtil.bind(stmt, c + 2, schema.get(c).getType(), batch.value(r, c));
          }
          stmt.addBatch();
          if ((r + 1) % INSERT_BATCH_SIZE == 0) {
            stmt.executeBatch();
          }
        }
        stmt.executeBatch();
        conn.commit();
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    }
  }

  /** Replaces a table with a batch, numbering rows from 1. */
  public void replace(String table, RecordBatch batch) throws SQLException {
    reset(table, batch.getSchema());
    long[] rowIndexes = new long[batch.rowCount()];
    for (int i = 0; i < rowIndexes.length; i++) {
      rowIndexes[i] = i + 1;
    }
    append(table, batch, rowIndexes);
  }

  /**
   * Replaces {@code table} with {@code source}, which is renamed in place.
   * Readers see either the old table or the new one.
   */
  public void swap(String source, String table) throws SQLException {
    synchronized (connectionLock) {
      Connection conn = getConnection();
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try (Statement stmt = conn.createStatement()) {
        stmt.execute("DROP TABLE IF EXISTS " + DuckDBUtil.quoteIdentifier(table));
        stmt.execute("ALTER TABLE " + DuckDBUtil.quoteIdentifier(source) + " RENAME TO "
            + DuckDBUtil.quoteIdentifier(table));
        conn.commit();
      } catch (SQLException e) {
        conn.rollback();
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    }
    LOGGER.debug("Swapped staging table {} into {}", source, table);
  }

  /** Drops a table if it exists. */
  public void drop(String table) throws SQLException {
    synchronized (connectionLock) {
      try (Statement stmt = getConnection().createStatement()) {
        stmt.execute("DROP TABLE IF EXISTS " + DuckDBUtil.quoteIdentifier(table));
      }
    }
    LOGGER.debug("Dropped staging table {}", table);
  }

  /** Reads a table in row order. */
  public RecordBatch read(String table, Schema schema) throws SQLException {
    StringBuilder columns = new StringBuilder();
    for (ColumnSpec column : schema.getColumns()) {
      if (columns.length() > 0) {
        columns.append(", ");
      }
      columns.append(DuckDBUtil.quoteIdentifier(column.getName()));
    }
    String sql = "SELECT " + columns + " FROM " + DuckDBUtil.quoteIdentifier(table)
        + " ORDER BY " + DuckDBUtil.quoteIdentifier(ROW_INDEX_COLUMN);
    List<Object[]> rows = new ArrayList<>();
    synchronized (connectionLock) {
      try (Statement stmt = getConnection().createStatement();
           ResultSet rs = stmt.executeQuery(sql)) {
        while (rs.next()) {
          Object[] row = new Object[schema.size()];
          for (int c = 0; c < schema.size(); c++) {
            row[c] = DuckDBUtil.read(rs, c + 1, schema.get(c).getType());
          }
          rows.add(row);
        }
      }
    }
    LOGGER.debug("Read {} rows from staging table {}", rows.size(), table);
    return RecordBatch.of(schema, rows);
  }

  /** Returns whether a table exists. */
  public boolean exists(String table) throws SQLException {
    String sql = "SELECT count(*) FROM information_schema.tables WHERE table_name = ?";
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, table);
        try (ResultSet rs = stmt.executeQuery()) {
          return rs.next() && rs.getLong(1) > 0;
        }
      }
    }
  }

  /** Returns the names of the tables starting with a prefix, sorted. */
  public List<String> tables(String prefix) throws SQLException {
    String sql = "SELECT table_name FROM information_schema.tables"
        + " WHERE starts_with(table_name, ?) ORDER BY table_name";
    List<String> names = new ArrayList<>();
    synchronized (connectionLock) {
      try (PreparedStatement stmt = getConnection().prepareStatement(sql)) {
        stmt.setString(1, prefix);
        try (ResultSet rs = stmt.executeQuery()) {
          while (rs.next()) {
            names.add(rs.getString(1));
          }
        }
      }
    }
    return names;
  }

  /** Returns the number of rows in a table. */
  public long count(String table) throws SQLException {
    String sql = "SELECT count(*) FROM " + DuckDBUtil.quoteIdentifier(table);
    synchronized (connectionLock) {
      try (Statement stmt = getConnection().createStatement();
           ResultSet rs = stmt.executeQuery(sql)) {
        return rs.next() ? rs.getLong(1) : 0L;
      }
    }
  }

  @Override public void close() throws SQLException {
    synchronized (connectionLock) {
      if (connection != null) {
        connection.close();
        connection = null;
        LOGGER.debug("Closed staging store at {}", dbPath);
      }
    }
  }
}
