/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.planner;

import lombok.extern.log4j.Log4j2;
import org.batchsql.client.DatabaseClient;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;
import org.batchsql.planner.plan.ExecutionPlan;
import org.batchsql.planner.plan.OperatorKind;
import org.batchsql.planner.plan.PlanNode;
import org.batchsql.query.Query;

/**
 * Decides whether a query is root-partitionable by fetching its execution plan and checking the
 * root operator. Only the root is inspected: when a partitioned read is possible at all, the
 * database plans it with a distributed union on top.
 */
@Log4j2
public class PlanInspector {

  /**
   * Inspects the plan of a query.
   *
   * @param client open database connection
   * @param query query to inspect
   * @return the decision, with a reason when the query is not partitionable
   * @throws BatchSqlException INVALID_QUERY, BACKEND_UNAVAILABLE or PLAN_INSPECTION_FAILED
   */
  public RootPartitionableDecision inspect(DatabaseClient client, Query query) {
    query.validate();

    ExecutionPlan plan = fetchPlan(client, query);
    if (plan == null || plan.isEmpty()) {
      throw new BatchSqlException(
          ErrorCode.PLAN_INSPECTION_FAILED,
          "Database returned an empty plan for: " + query.getSql());
    }

    PlanNode root = plan.getRoot();
    if (root.getKind() == null) {
      throw new BatchSqlException(
          ErrorCode.PLAN_INSPECTION_FAILED, "Plan root has no operator kind: " + root);
    }

    RootPartitionableDecision decision = decide(root);
    log.debug(
        "Plan root {} ({}) partitionable={}",
        root.getKind(),
        root.getDisplayName(),
        decision.isPartitionable());
    return decision;
  }

  private ExecutionPlan fetchPlan(DatabaseClient client, Query query) {
    try {
      return client.getQueryPlan(query);
    } catch (BatchSqlException e) {
      throw e;
    } catch (RuntimeException e) {
      if (client.isTransient(e)) {
        throw new BatchSqlException(
            ErrorCode.BACKEND_UNAVAILABLE, "Database unavailable while fetching plan", e);
      }
      throw new BatchSqlException(
          ErrorCode.PLAN_INSPECTION_FAILED, "Failed to fetch plan: " + e.getMessage(), e);
    }
  }

  private RootPartitionableDecision decide(PlanNode root) {
    OperatorKind kind = root.getKind();
    String reason =
        switch (kind) {
          case DISTRIBUTED_UNION -> null;
          case AGGREGATE -> "Plan root is an aggregate that merges all partitions";
          case SORT, MERGE_SORT -> "Plan root sorts rows across partitions";
          case LIMIT -> "Plan root applies a global limit";
          case JOIN, DISTRIBUTED_CROSS_APPLY ->
              "Plan root joins tables that are not co-located";
          case LOCAL_DISTRIBUTED_UNION,
              SERIALIZE_RESULT,
              SCAN,
              FILTER,
              FILTER_SCAN,
              COMPUTE,
              CROSS_APPLY,
              UNION_ALL,
              SCALAR ->
              "Plan root " + root.getDisplayName() + " is not a distributed union";
          case OTHER -> "Plan root " + root.getDisplayName() + " is not a recognized operator";
        };
    if (reason == null) {
      return RootPartitionableDecision.partitionable(kind, root.findScanTarget().orElse(null));
    }
    return RootPartitionableDecision.notPartitionable(kind, reason);
  }
}
