/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.Struct;
import com.google.protobuf.TextFormat;
import com.google.protobuf.Value;
import com.google.spanner.v1.QueryPlan;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.log4j.Log4j2;
import org.batchsql.planner.plan.ExecutionPlan;
import org.batchsql.planner.plan.OperatorKind;
import org.batchsql.planner.plan.PlanNode;

/**
 * Rebuilds the tree of a Spanner {@link QueryPlan}. Spanner returns plan nodes as a flat list
 * linked by child index, with node 0 as the root.
 */
@Log4j2
public final class SpannerPlanConverter {

  private static final Map<String, OperatorKind> KINDS_BY_DISPLAY_NAME =
      ImmutableMap.<String, OperatorKind>builder()
          .put("Distributed Union", OperatorKind.DISTRIBUTED_UNION)
          .put("Local Distributed Union", OperatorKind.LOCAL_DISTRIBUTED_UNION)
          .put("Distributed Cross Apply", OperatorKind.DISTRIBUTED_CROSS_APPLY)
          .put("Distributed Outer Apply", OperatorKind.DISTRIBUTED_CROSS_APPLY)
          .put("Distributed Merge Union", OperatorKind.MERGE_SORT)
          .put("Serialize Result", OperatorKind.SERIALIZE_RESULT)
          .put("Aggregate", OperatorKind.AGGREGATE)
          .put("Sort", OperatorKind.SORT)
          .put("Sort Limit", OperatorKind.SORT)
          .put("Limit", OperatorKind.LIMIT)
          .put("Hash Join", OperatorKind.JOIN)
          .put("Merge Join", OperatorKind.JOIN)
          .put("Push Broadcast Hash Join", OperatorKind.JOIN)
          .put("Cross Apply", OperatorKind.CROSS_APPLY)
          .put("Outer Apply", OperatorKind.CROSS_APPLY)
          .put("Filter", OperatorKind.FILTER)
          .put("Filter Scan", OperatorKind.FILTER_SCAN)
          .put("Scan", OperatorKind.SCAN)
          .put("Table Scan", OperatorKind.SCAN)
          .put("Index Scan", OperatorKind.SCAN)
          .put("Compute", OperatorKind.COMPUTE)
          .put("Compute Struct", OperatorKind.COMPUTE)
          .put("Union All", OperatorKind.UNION_ALL)
          .build();

  private SpannerPlanConverter() {}

  /**
   * Converts a Spanner plan.
   *
   * @param plan plan from {@code ResultSetStats.getQueryPlan()}
   * @return the plan tree, empty when Spanner returned no nodes
   * @throws IllegalStateException when a child link points outside the plan or forms a cycle
   */
  public static ExecutionPlan convert(QueryPlan plan) {
    if (plan.getPlanNodesCount() == 0) {
      return ExecutionPlan.empty();
    }
    return new ExecutionPlan(convertNode(plan.getPlanNodesList(), 0, new HashSet<>()));
  }

  /** Maps a Spanner operator to its kind. Scalar nodes are SCALAR whatever their name. */
  public static OperatorKind toOperatorKind(com.google.spanner.v1.PlanNode node) {
    if (node.getKind() == com.google.spanner.v1.PlanNode.Kind.SCALAR) {
      return OperatorKind.SCALAR;
    }
    return KINDS_BY_DISPLAY_NAME.getOrDefault(node.getDisplayName(), OperatorKind.OTHER);
  }

  private static PlanNode convertNode(
      List<com.google.spanner.v1.PlanNode> nodes, int index, Set<Integer> path) {
    if (index < 0 || index >= nodes.size()) {
      throw new IllegalStateException(
          "Plan links to node " + index + " but has " + nodes.size() + " node(s)");
    }
    if (!path.add(index)) {
      throw new IllegalStateException("Plan node " + index + " is its own ancestor");
    }
    com.google.spanner.v1.PlanNode node = nodes.get(index);
    ImmutableList.Builder<PlanNode> children = ImmutableList.builder();
    for (com.google.spanner.v1.PlanNode.ChildLink link : node.getChildLinksList()) {
      children.add(convertNode(nodes, link.getChildIndex(), path));
    }
    path.remove(index);

    OperatorKind kind = toOperatorKind(node);
    if (kind == OperatorKind.OTHER) {
      log.debug("Unrecognized plan operator {} at node {}", node.getDisplayName(), index);
    }
    return new PlanNode(
        kind, node.getDisplayName(), children.build(), metadata(node.getMetadata()));
  }

  private static Map<String, String> metadata(Struct struct) {
    ImmutableMap.Builder<String, String> values = ImmutableMap.builder();
    for (Map.Entry<String, Value> field : struct.getFieldsMap().entrySet()) {
      Value value = field.getValue();
      switch (value.getKindCase()) {
        case STRING_VALUE:
          values.put(field.getKey(), value.getStringValue());
          break;
        case BOOL_VALUE:
          values.put(field.getKey(), Boolean.toString(value.getBoolValue()));
          break;
        case NUMBER_VALUE:
          double number = value.getNumberValue();
          values.put(
              field.getKey(),
              number == Math.rint(number) && !Double.isInfinite(number)
                  ? Long.toString((long) number)
                  : Double.toString(number));
          break;
        case NULL_VALUE:
        case KIND_NOT_SET:
          break;
        default:
          values.put(field.getKey(), TextFormat.shortDebugString(value));
      }
    }
    return values.build();
  }
}
