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
package org.apache.calcite.adapter.pipeline.analytics;

import org.apache.calcite.adapter.pipeline.util.DuckDBUtil;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Queryable view over the promoted partition files of a sink.
 *
 * <p>The view lives in the DuckDB database {@code <sink>/_analytics.duckdb}
 * and is named after the pipeline. A refresh replaces the view definition
 * in one statement with one that lists exactly the files passed in, so
 * readers only ever see promoted files.
 */
public class AnalyticsRelation {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsRelation.class);

  /** Database file name within the sink. */
  public static final String DATABASE_FILE = "_analytics.duckdb";

  private final Path databaseFile;
  private final String viewName;

  public AnalyticsRelation(Path databaseFile, String viewName) {
    this.databaseFile = databaseFile;
    this.viewName = viewName;
  }

  /** Returns the relation for a sink directory. */
  public static AnalyticsRelation forSink(String sink, String viewName) {
    return new AnalyticsRelation(Paths.get(sink).resolve(DATABASE_FILE), viewName);
  }

  public Path getDatabaseFile() {
    return databaseFile;
  }

  public String getViewName() {
    return viewName;
  }

  /**
   * Re-points the view at a set of Parquet files. An empty set drops the
   * view.
   *
   * @throws IOException If the view cannot be replaced
   */
  public void refresh(List<String> files) throws IOException {
    String sql = files.isEmpty()
        ? "DROP VIEW IF EXISTS " + DuckDBUtil.quoteIdentifier(viewName)
        : buildViewSql(files);
    Path parent = databaseFile.toAbsolutePath().getParent();
    Files.createDirectories(parent);
    try (Connection conn = DuckDBUtil.open(databaseFile);
         Statement stmt = conn.createStatement()) {
      LOGGER.debug("Analytics view SQL:\n{}", sql);
      stmt.execute(sql);
    } catch (SQLException e) {
      String errorMsg = String.format("Cannot refresh analytics view '%s' in %s: %s",
          viewName, databaseFile, e.getMessage());
      throw new IOException(errorMsg, e);
    }
    LOGGER.info("Analytics view {} now covers {} files", viewName, files.size());
  }

  String buildViewSql(List<String> files) {
    StringBuilder list = new StringBuilder();
    for (String file : files) {
      if (list.length() > 0) {
        list.append(", ");
      }
      list.append(DuckDBUtil.quoteLiteral(Paths.get(file).toAbsolutePath().toString()));
    }
    return "CREATE OR REPLACE VIEW " + DuckDBUtil.quoteIdentifier(viewName)
        + " AS SELECT * FROM read_parquet([" + list
        + "], union_by_name = true, hive_partitioning = false)";
  }

  /** Returns whether the view exists. */
  public boolean exists() throws IOException {
    if (!Files.exists(databaseFile)) {
      return false;
    }
    String sql = "SELECT count(*) FROM information_schema.tables WHERE table_name = "
        + DuckDBUtil.quoteLiteral(viewName);
    try (Connection conn = DuckDBUtil.open(databaseFile);
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      return rs.next() && rs.getLong(1) > 0;
    } catch (SQLException e) {
      throw new IOException("Cannot inspect " + databaseFile + ": " + e.getMessage(), e);
    }
  }

  /** Counts the rows visible through the view. */
  public long count() throws IOException {
    String sql = "SELECT count(*) FROM " + DuckDBUtil.quoteIdentifier(viewName);
    try (Connection conn = DuckDBUtil.open(databaseFile);
         Statement stmt = conn.createStatement();
         ResultSet rs = stmt.executeQuery(sql)) {
      return rs.next() ? rs.getLong(1) : 0L;
    } catch (SQLException e) {
      throw new IOException("Cannot count rows of analytics view '" + viewName + "': "
          + e.getMessage(), e);
    }
  }

  @Override public String toString() {
    return "AnalyticsRelation{" + viewName + " @ " + databaseFile + "}";
  }
}
