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

import java.io.IOException;

/**
 * Addressable location that yields raw, row-oriented records.
 *
 * <p>How the location is reached (path, bucket, credentials) is the
 * implementation's concern. The staging loader only opens a reader, pulls
 * records, and closes it.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * RawSource source = new CsvRawSource(Paths.get("/data/train_transaction.csv"));
 * try (RawRowReader reader = source.open()) {
 *   RawRecord record;
 *   while ((record = reader.next()) != null) {
 *     ...
 *   }
 * }
 * }</pre>
 *
 * @see StagingLoader
 */
public interface RawSource {

  /** Returns a description of where the data lives, for logs and errors. */
  String getLocation();

  /**
   * Opens a reader positioned after the header.
   *
   * @throws IOException If the source cannot be reached or has no header
   */
  RawRowReader open() throws IOException;

  /**
   * Returns a deterministic identifier of the source content. Equal content
   * gives an equal fingerprint across runs.
   *
   * @throws IOException If the source cannot be read
   */
  String fingerprint() throws IOException;
}
