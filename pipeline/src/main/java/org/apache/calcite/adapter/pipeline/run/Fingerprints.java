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
package org.apache.calcite.adapter.pipeline.run;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * Combines strings into a SHA-256 fingerprint.
 */
public final class Fingerprints {
  private Fingerprints() {
  }

  /** Hashes the parts in order; each part is terminated so that boundaries count. */
  public static String of(Object... parts) {
    Hasher hasher = Hashing.sha256().newHasher();
    for (Object part : parts) {
      hasher.putString(String.valueOf(part), StandardCharsets.UTF_8);
      hasher.putByte((byte) 0);
    }
    return hasher.hash().toString();
  }
}
