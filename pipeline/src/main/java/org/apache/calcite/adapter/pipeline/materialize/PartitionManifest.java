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

import org.apache.calcite.adapter.pipeline.storage.StorageProvider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Record of the partitions promoted into a sink, stored as
 * {@code _manifest.json} at the sink root.
 *
 * <pre>{@code
 * {
 *   "pipeline" : "transactions",
 *   "runId" : "20180102-...",
 *   "partitions" : {
 *     "txn_date=2017-12-01" : {
 *       "fingerprint" : "9f2c...",
 *       "rowCount" : 1234,
 *       "file" : "/sink/txn_date=2017-12-01/part-00000.parquet",
 *       "writtenAt" : 1700000000000
 *     }
 *   }
 * }
 * }</pre>
 *
 * <p>The manifest is replaced as a whole with an atomic move, so readers
 * never see a partially written one.
 */
public class PartitionManifest {
  /** File name of the manifest within the sink. */
  public static final String FILE_NAME = "_manifest.json";

  private static final ObjectMapper MAPPER = new ObjectMapper()
      .enable(SerializationFeature.INDENT_OUTPUT);

  private final String pipeline;
  private @Nullable String runId;
  private final Map<String, Entry> partitions = new TreeMap<>();

  public PartitionManifest(String pipeline) {
    this.pipeline = pipeline;
  }

  /**
   * Loads the manifest of a sink, or returns an empty one if there is none.
   *
   * @throws IOException If the manifest exists but cannot be read
   */
  @SuppressWarnings("unchecked")
  public static PartitionManifest load(StorageProvider storage, String sink, String pipeline)
      throws IOException {
    String path = storage.resolvePath(sink, FILE_NAME);
    PartitionManifest manifest = new PartitionManifest(pipeline);
    if (!storage.exists(path)) {
      return manifest;
    }
    Map<String, Object> root = MAPPER.readValue(storage.readAll(path), Map.class);
    manifest.runId = (String) root.get("runId");
    Map<String, Map<String, Object>> parts =
        (Map<String, Map<String, Object>>) root.get("partitions");
    if (parts != null) {
      for (Map.Entry<String, Map<String, Object>> e : parts.entrySet()) {
        Map<String, Object> v = e.getValue();
        manifest.partitions.put(e.getKey(),
            new Entry((String) v.get("fingerprint"), ((Number) v.get("rowCount")).longValue(),
                (String) v.get("file"), ((Number) v.get("writtenAt")).longValue()));
      }
    }
    return manifest;
  }

  /** Writes the manifest atomically to the sink root. */
  public void save(StorageProvider storage, String sink) throws IOException {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("pipeline", pipeline);
    root.put("runId", runId);
    Map<String, Object> parts = new LinkedHashMap<>();
    for (Map.Entry<String, Entry> e : partitions.entrySet()) {
      Map<String, Object> v = new LinkedHashMap<>();
      v.put("fingerprint", e.getValue().getFingerprint());
      v.put("rowCount", e.getValue().getRowCount());
      v.put("file", e.getValue().getFile());
      v.put("writtenAt", e.getValue().getWrittenAt());
      parts.put(e.getKey(), v);
    }
    root.put("partitions", parts);
    storage.writeAtomic(storage.resolvePath(sink, FILE_NAME), MAPPER.writeValueAsBytes(root));
  }

  public String getPipeline() {
    return pipeline;
  }

  /** Run that last saved the manifest. */
  public @Nullable String getRunId() {
    return runId;
  }

  public void setRunId(String runId) {
    this.runId = runId;
  }

  public @Nullable Entry get(String partitionPath) {
    return partitions.get(partitionPath);
  }

  public void put(String partitionPath, Entry entry) {
    partitions.put(partitionPath, entry);
  }

  /** Partitions by relative path, sorted. */
  public Map<String, Entry> getPartitions() {
    return Collections.unmodifiableMap(partitions);
  }

  /** Data files of all partitions, in partition path order. */
  public List<String> files() {
    List<String> files = new ArrayList<>();
    for (Entry entry : partitions.values()) {
      files.add(entry.getFile());
    }
    return files;
  }

  public long totalRows() {
    long total = 0;
    for (Entry entry : partitions.values()) {
      total += entry.getRowCount();
    }
    return total;
  }

  /** One promoted partition. */
  public static class Entry {
    private final String fingerprint;
    private final long rowCount;
    private final String file;
    private final long writtenAt;

    public Entry(String fingerprint, long rowCount, String file, long writtenAt) {
      this.fingerprint = fingerprint;
      this.rowCount = rowCount;
      this.file = file;
      this.writtenAt = writtenAt;
    }

    public String getFingerprint() {
      return fingerprint;
    }

    public long getRowCount() {
      return rowCount;
    }

    public String getFile() {
      return file;
    }

    public long getWrittenAt() {
      return writtenAt;
    }

    @Override public String toString() {
      return file + "{rows=" + rowCount + ", fingerprint=" + fingerprint + "}";
    }
  }
}
