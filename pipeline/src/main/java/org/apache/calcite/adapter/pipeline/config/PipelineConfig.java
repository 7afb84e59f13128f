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
package org.apache.calcite.adapter.pipeline.config;

import org.apache.calcite.adapter.pipeline.run.RetryPolicy;
import org.apache.calcite.adapter.pipeline.staging.MalformedRowPolicy;
import org.apache.calcite.adapter.pipeline.transform.TransactionFeatures;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration of one feature pipeline.
 *
 * <h3>YAML Configuration Example</h3>
 * <pre>{@code
 * name: transactions
 * source: data/train_transaction.csv
 * sink: out/transactions
 * workDirectory: work
 * chunkSize: 10000
 * concurrency: 4
 * malformedRowPolicy: QUARANTINE
 * retry:
 *   maxAttempts: 3
 *   initialBackoffMs: 200
 *   multiplier: 2.0
 *   maxBackoffMs: 5000
 * stageTimeoutMs: 600000
 * writeAttempts: 2
 * compression: zstd
 * partition:
 *   columns: [txn_date, isFraud]
 * features:
 *   originDate: 2017-12-01
 *   entityKey: card1
 * rules:
 *   - name: amount_non_negative
 *     type: range
 *     column: TransactionAmt
 *     min: 0
 *     severity: CRITICAL
 * }</pre>
 *
 * <p>When {@code rules} is absent the default transaction rules apply. The
 * object is immutable and handed to every node of a run.
 */
public class PipelineConfig {
  public static final int DEFAULT_CHUNK_SIZE = 10000;
  public static final int DEFAULT_CONCURRENCY = 4;
  public static final int DEFAULT_WRITE_ATTEMPTS = 2;
  public static final String DEFAULT_COMPRESSION = "zstd";
  public static final Duration DEFAULT_STAGE_TIMEOUT = Duration.ofMinutes(10);
  public static final RetryPolicy DEFAULT_RETRY =
      new RetryPolicy(3, Duration.ofMillis(200), 2.0, Duration.ofMillis(5000));
  public static final List<String> DEFAULT_PARTITION_COLUMNS = ImmutableList.of("txn_date");
  public static final String DEFAULT_ENTITY_KEY = "card1";

  private final String name;
  private final Path source;
  private final String sink;
  private final Path workDirectory;
  private final int chunkSize;
  private final int concurrency;
  private final MalformedRowPolicy malformedRowPolicy;
  private final RetryPolicy retryPolicy;
  private final Duration stageTimeout;
  private final int writeAttempts;
  private final String compression;
  private final List<String> partitionColumns;
  private final LocalDate originDate;
  private final String entityKey;
  private final @Nullable List<Map<String, Object>> rules;

  private PipelineConfig(Builder builder) {
    this.name = builder.name;
    this.source = builder.source;
    this.sink = builder.sink;
    this.workDirectory = builder.workDirectory;
    this.chunkSize = builder.chunkSize;
    this.concurrency = builder.concurrency;
    this.malformedRowPolicy = builder.malformedRowPolicy;
    this.retryPolicy = builder.retryPolicy;
    this.stageTimeout = builder.stageTimeout;
    this.writeAttempts = builder.writeAttempts;
    this.compression = builder.compression;
    this.partitionColumns = ImmutableList.copyOf(builder.partitionColumns);
    this.originDate = builder.originDate;
    this.entityKey = builder.entityKey;
    this.rules = builder.rules == null ? null : copyRules(builder.rules);
  }

  private static List<Map<String, Object>> copyRules(List<Map<String, Object>> rules) {
    ImmutableList.Builder<Map<String, Object>> copy = ImmutableList.builder();
    for (Map<String, Object> rule : rules) {
      copy.add(ImmutableMap.copyOf(rule));
    }
    return copy.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a configuration from a map, as parsed from YAML or JSON.
   * Relative paths are resolved against {@code baseDirectory}.
   */
  @SuppressWarnings("unchecked")
  public static PipelineConfig fromMap(Map<String, Object> map, Path baseDirectory) {
    Builder builder = builder();
    Object nameObj = map.get("name");
    if (nameObj instanceof String) {
      builder.name((String) nameObj);
    }
    Object sourceObj = map.get("source");
    if (sourceObj instanceof String) {
      builder.source(baseDirectory.resolve((String) sourceObj));
    }
    Object sinkObj = map.get("sink");
    if (sinkObj instanceof String) {
      builder.sink(baseDirectory.resolve((String) sinkObj).toString());
    }
    Object workObj = map.get("workDirectory");
    if (workObj instanceof String) {
      builder.workDirectory(baseDirectory.resolve((String) workObj));
    }

    Object chunkObj = map.get("chunkSize");
    if (chunkObj instanceof Number) {
      builder.chunkSize(((Number) chunkObj).intValue());
    }
    Object concurrencyObj = map.get("concurrency");
    if (concurrencyObj instanceof Number) {
      builder.concurrency(((Number) concurrencyObj).intValue());
    }
    Object policyObj = map.get("malformedRowPolicy");
    if (policyObj instanceof String) {
      builder.malformedRowPolicy(
          MalformedRowPolicy.valueOf(((String) policyObj).toUpperCase(Locale.ROOT)));
    }
    Object retryObj = map.get("retry");
    if (retryObj instanceof Map) {
      builder.retryPolicy(retryFromMap((Map<String, Object>) retryObj));
    }
    Object timeoutObj = map.get("stageTimeoutMs");
    if (timeoutObj instanceof Number) {
      builder.stageTimeout(Duration.ofMillis(((Number) timeoutObj).longValue()));
    }
    Object writeAttemptsObj = map.get("writeAttempts");
    if (writeAttemptsObj instanceof Number) {
      builder.writeAttempts(((Number) writeAttemptsObj).intValue());
    }
    Object compressionObj = map.get("compression");
    if (compressionObj instanceof String) {
      builder.compression((String) compressionObj);
    }

    Object partitionObj = map.get("partition");
    if (partitionObj instanceof Map) {
      Object columnsObj = ((Map<String, Object>) partitionObj).get("columns");
      if (columnsObj instanceof Collection) {
        List<String> columns = new ArrayList<>();
        for (Object column : (Collection<?>) columnsObj) {
          columns.add(String.valueOf(column));
        }
        builder.partitionColumns(columns);
      }
    }

    Object featuresObj = map.get("features");
    if (featuresObj instanceof Map) {
      Map<String, Object> features = (Map<String, Object>) featuresObj;
      Object originObj = features.get("originDate");
      if (originObj != null) {
        builder.originDate(LocalDate.parse(String.valueOf(originObj)));
      }
      Object keyObj = features.get("entityKey");
      if (keyObj instanceof String) {
        builder.entityKey((String) keyObj);
      }
    }

    Object rulesObj = map.get("rules");
    if (rulesObj instanceof List) {
      List<Map<String, Object>> rules = new ArrayList<>();
      for (Object rule : (List<?>) rulesObj) {
        if (!(rule instanceof Map)) {
          throw new IllegalArgumentException("Each rule must be a map, got: " + rule);
        }
        rules.add((Map<String, Object>) rule);
      }
      builder.rules(rules);
    }
    return builder.build();
  }

  /** Creates a configuration from a map, resolving paths against the working directory. */
  public static PipelineConfig fromMap(Map<String, Object> map) {
    return fromMap(map, Paths.get(""));
  }

  private static RetryPolicy retryFromMap(Map<String, Object> map) {
    int maxAttempts = DEFAULT_RETRY.getMaxAttempts();
    Duration initial = DEFAULT_RETRY.getInitialBackoff();
    double multiplier = DEFAULT_RETRY.getMultiplier();
    Duration max = DEFAULT_RETRY.getMaxBackoff();
    Object maxAttemptsObj = map.get("maxAttempts");
    if (maxAttemptsObj instanceof Number) {
      maxAttempts = ((Number) maxAttemptsObj).intValue();
    }
    Object initialObj = map.get("initialBackoffMs");
    if (initialObj instanceof Number) {
      initial = Duration.ofMillis(((Number) initialObj).longValue());
    }
    Object multiplierObj = map.get("multiplier");
    if (multiplierObj instanceof Number) {
      multiplier = ((Number) multiplierObj).doubleValue();
    }
    Object maxObj = map.get("maxBackoffMs");
    if (maxObj instanceof Number) {
      max = Duration.ofMillis(((Number) maxObj).longValue());
    }
    return new RetryPolicy(maxAttempts, initial, multiplier, max);
  }

  public String getName() {
    return name;
  }

  /** CSV file to ingest. */
  public Path getSource() {
    return source;
  }

  /** Root directory of the partitioned output. */
  public String getSink() {
    return sink;
  }

  /** Directory for the staging database, checkpoints and quarantine files. */
  public Path getWorkDirectory() {
    return workDirectory;
  }

  public Path getQuarantineDirectory() {
    return workDirectory.resolve("quarantine");
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public MalformedRowPolicy getMalformedRowPolicy() {
    return malformedRowPolicy;
  }

  public RetryPolicy getRetryPolicy() {
    return retryPolicy;
  }

  public Duration getStageTimeout() {
    return stageTimeout;
  }

  /** Attempts per partition write. */
  public int getWriteAttempts() {
    return writeAttempts;
  }

  public String getCompression() {
    return compression;
  }

  public List<String> getPartitionColumns() {
    return partitionColumns;
  }

  public LocalDate getOriginDate() {
    return originDate;
  }

  public String getEntityKey() {
    return entityKey;
  }

  /** Rule definitions, or null to use the default transaction rules. */
  public @Nullable List<Map<String, Object>> getRules() {
    return rules;
  }

  @Override public String toString() {
    return "PipelineConfig{name=" + name + ", source=" + source + ", sink=" + sink
        + ", workDirectory=" + workDirectory + ", policy=" + malformedRowPolicy
        + ", partitionColumns=" + partitionColumns + "}";
  }

  /**
   * Builder for PipelineConfig.
   */
  public static class Builder {
    private String name;
    private Path source;
    private String sink;
    private Path workDirectory;
    private int chunkSize = DEFAULT_CHUNK_SIZE;
    private int concurrency = DEFAULT_CONCURRENCY;
    private MalformedRowPolicy malformedRowPolicy = MalformedRowPolicy.FAIL_FAST;
    private RetryPolicy retryPolicy = DEFAULT_RETRY;
    private Duration stageTimeout = DEFAULT_STAGE_TIMEOUT;
    private int writeAttempts = DEFAULT_WRITE_ATTEMPTS;
    private String compression = DEFAULT_COMPRESSION;
    private List<String> partitionColumns = DEFAULT_PARTITION_COLUMNS;
    private LocalDate originDate = TransactionFeatures.DEFAULT_ORIGIN_DATE;
    private String entityKey = DEFAULT_ENTITY_KEY;
    private @Nullable List<Map<String, Object>> rules;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder source(Path source) {
      this.source = source;
      return this;
    }

    public Builder sink(String sink) {
      this.sink = sink;
      return this;
    }

    public Builder workDirectory(Path workDirectory) {
      this.workDirectory = workDirectory;
      return this;
    }

    public Builder chunkSize(int chunkSize) {
      this.chunkSize = chunkSize;
      return this;
    }

    public Builder concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    public Builder malformedRowPolicy(MalformedRowPolicy malformedRowPolicy) {
      this.malformedRowPolicy = malformedRowPolicy;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder stageTimeout(Duration stageTimeout) {
      this.stageTimeout = stageTimeout;
      return this;
    }

    public Builder writeAttempts(int writeAttempts) {
      this.writeAttempts = writeAttempts;
      return this;
    }

    public Builder compression(String compression) {
      this.compression = compression;
      return this;
    }

    public Builder partitionColumns(List<String> partitionColumns) {
      this.partitionColumns = partitionColumns;
      return this;
    }

    public Builder originDate(LocalDate originDate) {
      this.originDate = originDate;
      return this;
    }

    public Builder entityKey(String entityKey) {
      this.entityKey = entityKey;
      return this;
    }

    public Builder rules(@Nullable List<Map<String, Object>> rules) {
      this.rules = rules;
      return this;
    }

    public PipelineConfig build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Pipeline name is required");
      }
      if (!name.matches("[A-Za-z_][A-Za-z0-9_]*")) {
        throw new IllegalArgumentException("Pipeline name must be an identifier: " + name);
      }
      if (source == null) {
        throw new IllegalArgumentException("Source is required");
      }
      if (sink == null || sink.isEmpty()) {
        throw new IllegalArgumentException("Sink is required");
      }
      if (workDirectory == null) {
        throw new IllegalArgumentException("Work directory is required");
      }
      if (chunkSize <= 0) {
        throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
      }
      if (concurrency <= 0) {
        throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
      }
      if (writeAttempts <= 0) {
        throw new IllegalArgumentException("writeAttempts must be positive: " + writeAttempts);
      }
      if (stageTimeout.isNegative() || stageTimeout.isZero()) {
        throw new IllegalArgumentException("stageTimeout must be positive: " + stageTimeout);
      }
      if (partitionColumns.isEmpty()) {
        throw new IllegalArgumentException("At least one partition column is required");
      }
      return new PipelineConfig(this);
    }
  }
}
