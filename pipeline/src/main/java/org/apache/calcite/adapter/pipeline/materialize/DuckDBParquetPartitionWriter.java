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
package org.apache.calcite.adapter.pipeline.materialize;

import org.apache.calcite.adapter.pipeline.batch.RecordBatch;
import org.apache.calcite.adapter.pipeline.schema.ColumnSpec;
import org.apache.calcite.adapter.pipeline.schema.Schema;
import org.apache.calcite.adapter.pipeline.util.DuckDBUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Writes partition files as Parquet through DuckDB's {@code COPY}.
 *
 * <p>Each call loads the rows into a table of a private in-memory DuckDB
 * database and copies them out in order:
 * <pre>{@code
 * COPY (SELECT ... FROM part ORDER BY __ord) TO '<file>'
 *   (FORMAT PARQUET, COMPRESSION zstd, KV_METADATA {pipeline_schema: '...'})
 * }</pre>
 */
public class DuckDBParquetPartitionWriter implements PartitionFileWriter {
  private static final Logger LOGGER = LoggerFactory.getLogger(DuckDBParquetPartitionWriter.class);

  private static final String TABLE = "part";
  private static final String ORDER_COLUMN = "__ord";

  private final String compression;

  public DuckDBParquetPartitionWriter(String compression) {
    this.compression = compression.toLowerCase(Locale.ROOT);
  }

  public String getCompression() {
    return compression;
  }

  @Override public void write(RecordBatch rows, String file, Map<String, String> metadata)
      throws IOException {
    Schema schema = rows.getSchema();
    try (Connection conn = DuckDBUtil.openInMemory()) {
      DuckDBUtil.applySettings(conn, 1);
      try (Statement stmt = conn.createStatement()) {
        stmt.execute(DuckDBUtil.createTableSql(TABLE, schema,
            DuckDBUtil.quoteIdentifier(ORDER_COLUMN) + " BIGINT"));
      }
      conn.setAutoCommit(false);
      try (PreparedStatement insert =
               conn.prepareStatement(DuckDBUtil.insertSql(TABLE, schema, ORDER_COLUMN))) {
        for (int r = 0; r < rows.rowCount(); r++) {
          insert.setLong(1, r);
          for (int c = 0; c < schema.size(); c++) {
            DuckDBUtil.bind(insert, c + 2, schema.get(c).getType(), rows.value(r, c));
          }
          insert.addBatch();
        }
        insert.executeBatch();
      }
      conn.commit();
      conn.setAutoCommit(true);

      String sql = buildCopySql(schema, file, metadata);
      LOGGER.debug("Partition COPY SQL:\n{}", sql);
      try (Statement stmt = conn.createStatement()) {
        stmt.execute(sql);
      }
      LOGGER.debug("Wrote {} rows to {}", rows.rowCount(), file);
    } catch (SQLException e) {
      String errorMsg = String.format("DuckDB Parquet write failed for '%s': %s",
          file, e.getMessage());
      throw new IOException(errorMsg, e);
    }
  }

  String buildCopySql(Schema schema, String file, Map<String, String> metadata) {
    StringBuilder sql = new StringBuilder("COPY (SELECT ");
    boolean first = true;
    for (ColumnSpec column : schema.getColumns()) {
      if (!first) {
        sql.append(", ");
      }
      sql.append(DuckDBUtil.quoteIdentifier(column.getName()));
      first = false;
    }
    sql.append(" FROM ").append(DuckDBUtil.quoteIdentifier(TABLE))
        .append(" ORDER BY ").append(DuckDBUtil.quoteIdentifier(ORDER_COLUMN))
        .append(") TO ").append(DuckDBUtil.quoteLiteral(file))
        .append(" (FORMAT PARQUET, COMPRESSION ").append(compression);
    if (!metadata.isEmpty()) {
      sql.append(", KV_METADATA {");
      first = true;
      for (Map.Entry<String, String> entry : metadata.entrySet()) {
        if (!first) {
          sql.append(", ");
        }
        sql.append(entry.getKey()).append(": ").append(DuckDBUtil.quoteLiteral(entry.getValue()));
        first = false;
      }
      sql.append('}');
    }
    return sql.append(')').toString();
  }

  /**
   * Reads the key/value metadata of a Parquet file.
   *
   * @throws IOException If the file cannot be read
   */
  public static Map<String, String> readMetadata(String file) throws IOException {
    Map<String, String> metadata = new LinkedHashMap<>();
    String sql = "SELECT decode(key), decode(value) FROM parquet_kv_metadata("
        + DuckDBUtil.quoteLiteral(file) + ")";
    try (Connection conn = DuckDBUtil.openInMemory();
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      while (rs.next()) {
        metadata.put(rs.getString(1), rs.getString(2));
      }
    } catch (SQLException e) {
      throw new IOException("Cannot read Parquet metadata of " + file + ": " + e.getMessage(), e);
    }
    return metadata;
  }

  @Override public String toString() {
    return "DuckDBParquetPartitionWriter{compression=" + compression + "}";
  }
}
