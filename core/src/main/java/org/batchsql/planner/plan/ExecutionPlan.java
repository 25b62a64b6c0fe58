/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.planner.plan;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Execution plan of one query. A null root means the backend returned no plan nodes. */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
@ToString
public final class ExecutionPlan {

  private final PlanNode root;

  public static ExecutionPlan empty() {
    return new ExecutionPlan(null);
  }

  public boolean isEmpty() {
    return root == null;
  }

  /** Returns the table the plan scans first, if the plan names one. */
  public Optional<String> getScanTarget() {
    return root == null ? Optional.empty() : root.findScanTarget();
  }
}
