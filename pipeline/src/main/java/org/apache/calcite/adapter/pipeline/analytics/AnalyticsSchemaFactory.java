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

import org.apache.calcite.adapter.jdbc.JdbcSchema;
import org.apache.calcite.adapter.pipeline.util.DuckDBUtil;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import javax.sql.DataSource;

/**
 * Exposes the analytics database of a sink to Calcite as a JDBC schema, so
 * that external tools can query the view through {@code jdbc:calcite:}.
 *
 * <p>Model operand: either {@code database} (path of the DuckDB file) or
 * {@code sink} (sink directory holding {@code _analytics.duckdb}).
 *
 * <pre>{@code
 * {
 *   "version": "1.0",
 *   "defaultSchema": "analytics",
 *   "schemas": [{
 *     "name": "analytics",
 *     "type": "custom",
 *     "factory": "org.apache.calcite.adapter.pipeline.analytics.AnalyticsSchemaFactory",
 *     "operand": { "sink": "/data/features" }
 *   }]
 * }
 * }</pre>
 */
@SuppressWarnings("UnusedDeclaration")
public class AnalyticsSchemaFactory implements SchemaFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnalyticsSchemaFactory.class);

  /** Public singleton, per factory contract. */
  public static final AnalyticsSchemaFactory INSTANCE = new AnalyticsSchemaFactory();

  private static final String DRIVER = "org.duckdb.DuckDBDriver";

  /** DuckDB's default schema, which holds the views. */
  private static final String DUCKDB_SCHEMA = "main";

  @Override public Schema create(SchemaPlus parentSchema, String name,
      Map<String, Object> operand) {
    Path database;
    if (operand.get("database") != null) {
      database = Paths.get(operand.get("database").toString());
    } else if (operand.get("sink") != null) {
      database = Paths.get(operand.get("sink").toString()).resolve(AnalyticsRelation.DATABASE_FILE);
    } else {
      throw new IllegalArgumentException("Analytics schema '" + name
          + "' needs a 'database' or 'sink' operand");
    }
    return create(parentSchema, name, database);
  }

  /** Creates a JDBC schema over a DuckDB analytics database file. */
  public static JdbcSchema create(SchemaPlus parentSchema, String name, Path database) {
    String url = DuckDBUtil.jdbcUrl(database.toAbsolutePath());
    LOGGER.info("Creating analytics schema '{}' over {}", name, url);
    DataSource dataSource = JdbcSchema.dataSource(url, DRIVER, null, null);
    return JdbcSchema.create(parentSchema, name, dataSource, null, DUCKDB_SCHEMA);
  }
}
