/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.planner;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.batchsql.planner.plan.OperatorKind;

/** Outcome of checking whether a plan can be split at its root. */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
@ToString
public final class RootPartitionableDecision {

  private final boolean partitionable;

  /** Why the plan is not partitionable; null when it is. */
  private final String reason;

  private final OperatorKind rootKind;

  /** Table scanned by the plan, when the plan names it. */
  private final String scanTarget;

  public static RootPartitionableDecision partitionable(OperatorKind rootKind, String scanTarget) {
    return new RootPartitionableDecision(true, null, rootKind, scanTarget);
  }

  public static RootPartitionableDecision notPartitionable(OperatorKind rootKind, String reason) {
    return new RootPartitionableDecision(false, reason, rootKind, null);
  }

  public Optional<String> getScanTarget() {
    return Optional.ofNullable(scanTarget);
  }
}
