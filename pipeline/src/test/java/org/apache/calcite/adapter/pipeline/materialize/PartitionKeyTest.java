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

import com.google.common.collect.ImmutableMap;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link PartitionKey}.
 */
@Tag("unit")
public class PartitionKeyTest {

  @Test void testHivePath() {
    PartitionKey key = PartitionKey.of(ImmutableMap.of("txn_date", "2018-01-02", "isFraud", "0"));
    assertEquals("txn_date=2018-01-02/isFraud=0", key.toPath());
  }

  @Test void testEscaping() {
    PartitionKey key = PartitionKey.of(ImmutableMap.of("domain", "a/b=c%d"));
    assertEquals("domain=a%2Fb%3Dc%25d", key.toPath());
  }

  @Test void testEqualityFollowsValuesAndOrder() {
    PartitionKey a = PartitionKey.of(ImmutableMap.of("x", "1", "y", "2"));
    PartitionKey b = PartitionKey.of(ImmutableMap.of("x", "1", "y", "2"));
    PartitionKey c = PartitionKey.of(ImmutableMap.of("x", "1", "y", "3"));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test void testEmptyKeyIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> PartitionKey.of(Collections.<String, String>emptyMap()));
  }
}
