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
package org.apache.calcite.adapter.pipeline.util;

import org.apache.calcite.adapter.pipeline.schema.ColumnSpec;
import org.apache.calcite.adapter.pipeline.schema.ColumnType;
import org.apache.calcite.adapter.pipeline.schema.Schema;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;

/**
 * Helpers for talking to embedded DuckDB over JDBC: connections, settings,
 * quoting, DDL and typed binding of {@link ColumnType} values.
 */
public final class DuckDBUtil {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBUtil.class);

  private DuckDBUtil() {
  }

  /** Opens an in-memory DuckDB database. */
  public static Connection openInMemory() throws SQLException {
    return DriverManager.getConnection("jdbc:duckdb:");
  }

  /** Opens (creating if needed) a DuckDB database file. */
  public static Connection open(Path databaseFile) throws SQLException {
    String jdbcUrl = jdbcUrl(databaseFile);
    Connection conn = DriverManager.getConnection(jdbcUrl);
    LOGGER.debug("Opened DuckDB connection to {}", databaseFile);
    return conn;
  }

  public static String jdbcUrl(Path databaseFile) {
    return "jdbc:duckdb:" + databaseFile.toAbsolutePath();
  }

  /**
   * Applies thread and ordering settings. Insertion order is always kept so
   * that files written by COPY preserve row order.
   */
  public static void applySettings(Connection conn, int threads) throws SQLException {
    try (Statement stmt = conn.createStatement()) {
      if (threads > 0) {
        stmt.execute("SET threads=" + threads);
      }
      stmt.execute("SET preserve_insertion_order=true");
    }
    LOGGER.debug("Applied DuckDB settings: threads={}, preserve_insertion_order=true", threads);
  }

  /** Quotes a string literal for SQL. */
  public static String quoteLiteral(String literal) {
    return "'" + literal.replace("'", "''") + "'";
  }

  /** Quotes an identifier for SQL. */
  public static String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  /**
   * Builds {@code CREATE OR REPLACE TABLE} for a schema, optionally prefixed
   * by extra column definitions.
   */
  public static String createTableSql(String table, Schema schema, String... leadingColumns) {
    StringBuilder sql = new StringBuilder("CREATE OR REPLACE TABLE ")
        .append(quoteIdentifier(table)).append(" (");
    boolean first = true;
    for (String leading : leadingColumns) {
      if (!first) {
        sql.append(", ");
      }
      sql.append(leading);
      first = false;
    }
    for (ColumnSpec column : schema.getColumns()) {
      if (!first) {
        sql.append(", ");
      }
      sql.append(quoteIdentifier(column.getName())).append(' ').append(column.getType().sqlName());
      first = false;
    }
    return sql.append(')').toString();
  }

  /**
   * Builds an {@code INSERT} with one placeholder per schema column, plus
   * the given number of leading placeholders.
   */
  public static String insertSql(String table, Schema schema, String... leadingColumns) {
    StringBuilder names = new StringBuilder();
    StringBuilder values = new StringBuilder();
    for (String leading : leadingColumns) {
      names.append(quoteIdentifier(leading)).append(", ");
      values.append("?, ");
    }
    for (int i = 0; i < schema.size(); i++) {
      ColumnSpec column = schema.get(i);
      if (i > 0) {
        names.append(", ");
        values.append(", ");
      }
      names.append(quoteIdentifier(column.getName()));
      values.append(column.getType() == ColumnType.DATE ? "CAST(? AS DATE)" : "?");
    }
    return "INSERT INTO " + quoteIdentifier(table) + " (" + names + ") VALUES (" + values + ")";
  }

  /** Binds a value of the given type; DATE is bound as ISO text. */
  public static void bind(PreparedStatement stmt, int index, ColumnType type,
      @Nullable Object value) throws SQLException {
    if (value == null) {
      stmt.setNull(index, type == ColumnType.DATE ? java.sql.Types.VARCHAR : type.getJdbcType());
      return;
    }
    switch (type) {
    case BOOLEAN:
      stmt.setBoolean(index, (Boolean) value);
      break;
    case INTEGER:
      stmt.setInt(index, (Integer) value);
      break;
    case BIGINT:
      stmt.setLong(index, (Long) value);
      break;
    case DOUBLE:
      stmt.setDouble(index, (Double) value);
      break;
    case VARCHAR:
      stmt.setString(index, (String) value);
      break;
    case DATE:
      stmt.setString(index, value.toString());
      break;
    default:
      throw new SQLException("Unsupported column type " + type);
    }
  }

  /** Reads a value of the given type from the current result set row. */
  public static @Nullable Object read(ResultSet rs, int index, ColumnType type)
      throws SQLException {
    Object value;
    switch (type) {
    case BOOLEAN:
      value = rs.getBoolean(index);
      break;
    case INTEGER:
      value = rs.getInt(index);
      break;
    case BIGINT:
      value = rs.getLong(index);
      break;
    case DOUBLE:
      value = rs.getDouble(index);
      break;
    case VARCHAR:
      value = rs.getString(index);
      break;
    case DATE:
      String text = rs.getString(index);
      value = text == null ? null : LocalDate.parse(text);
      break;
    default:
      throw new SQLException("Unsupported column type " + type);
    }
    return rs.wasNull() ? null : value;
  }
}
