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

import com.google.common.base.Preconditions;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff.
 *
 * <p>Attempt {@code n} (1-based) that fails is followed by a wait of
 * {@code min(initialBackoff * multiplier^(n-1), maxBackoff)}.
 */
public final class RetryPolicy {
  /** Single attempt, no retry. */
  public static final RetryPolicy NONE =
      new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);

  private final int maxAttempts;
  private final Duration initialBackoff;
  private final double multiplier;
  private final Duration maxBackoff;

  public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier,
      Duration maxBackoff) {
    Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be >= 1: %s", maxAttempts);
    Preconditions.checkArgument(multiplier >= 1.0, "multiplier must be >= 1: %s", multiplier);
    Preconditions.checkArgument(!initialBackoff.isNegative() && !maxBackoff.isNegative(),
        "backoff must not be negative");
    this.maxAttempts = maxAttempts;
    this.initialBackoff = initialBackoff;
    this.multiplier = multiplier;
    this.maxBackoff = maxBackoff;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  /** Wait after a failed attempt (1-based). */
  public Duration backoff(int attempt) {
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt - 1);
    long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
    return Duration.ofMillis(capped);
  }

  @Override public String toString() {
    return "RetryPolicy{maxAttempts=" + maxAttempts + ", initialBackoff=" + initialBackoff
        + ", multiplier=" + multiplier + ", maxBackoff=" + maxBackoff + "}";
  }
}
