/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.query;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** What result assembly does when some partitions failed. */
@RequiredArgsConstructor
public enum PartialFailurePolicy {
  /** Fail the whole query, citing the first failed partition. */
  ABORT("abort"),

  /** Return the rows of the successful partitions together with a failure count. */
  BEST_EFFORT("best-effort");

  @Getter private final String policyName;

  /** Parses {@code abort} or {@code best-effort}, case-insensitively. */
  public static PartialFailurePolicy fromName(String name) {
    return Arrays.stream(values())
        .filter(policy -> policy.policyName.equalsIgnoreCase(name.trim()))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException("Unknown partial failure policy: " + name));
  }
}
