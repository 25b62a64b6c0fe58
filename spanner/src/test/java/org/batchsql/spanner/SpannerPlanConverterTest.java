/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import com.google.spanner.v1.PlanNode;
import com.google.spanner.v1.QueryPlan;
import org.batchsql.planner.plan.ExecutionPlan;
import org.batchsql.planner.plan.OperatorKind;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SpannerPlanConverterTest {

  @Test
  void should_rebuild_tree_from_child_links() {
    // Given
    QueryPlan plan =
        QueryPlan.newBuilder()
            .addPlanNodes(relational(0, "Distributed Union", 1, 4))
            .addPlanNodes(relational(1, "Local Distributed Union", 2))
            .addPlanNodes(relational(2, "Serialize Result", 3))
            .addPlanNodes(
                relational(3, "Scan")
                    .setMetadata(
                        Struct.newBuilder()
                            .putFields("scan_target", string("Singers"))
                            .putFields("scan_type", string("TableScan"))
                            .putFields(
                                "execution_method", Value.newBuilder().setNumberValue(2).build())))
            .addPlanNodes(
                PlanNode.newBuilder()
                    .setIndex(4)
                    .setKind(PlanNode.Kind.SCALAR)
                    .setDisplayName("Function"))
            .build();

    // When
    ExecutionPlan converted = SpannerPlanConverter.convert(plan);

    // Then
    org.batchsql.planner.plan.PlanNode root = converted.getRoot();
    assertEquals(OperatorKind.DISTRIBUTED_UNION, root.getKind());
    assertEquals(2, root.getChildren().size());
    assertEquals(OperatorKind.SCALAR, root.getChildren().get(1).getKind());
    org.batchsql.planner.plan.PlanNode scan =
        root.getChildren().get(0).getChildren().get(0).getChildren().get(0);
    assertEquals(OperatorKind.SCAN, scan.getKind());
    assertEquals("2", scan.getMetadata().get("execution_method"));
    assertEquals("Singers", converted.getScanTarget().orElseThrow());
  }

  @Test
  void should_map_non_partitionable_roots() {
    assertEquals(OperatorKind.AGGREGATE, kindOf("Aggregate"));
    assertEquals(OperatorKind.SORT, kindOf("Sort Limit"));
    assertEquals(OperatorKind.JOIN, kindOf("Hash Join"));
    assertEquals(OperatorKind.MERGE_SORT, kindOf("Distributed Merge Union"));
    assertEquals(OperatorKind.OTHER, kindOf("Something New"));
  }

  @Test
  void should_return_empty_plan_when_spanner_returns_no_nodes() {
    assertTrue(SpannerPlanConverter.convert(QueryPlan.getDefaultInstance()).isEmpty());
  }

  @Test
  void should_reject_dangling_child_link() {
    QueryPlan plan =
        QueryPlan.newBuilder().addPlanNodes(relational(0, "Distributed Union", 7)).build();

    assertThrows(IllegalStateException.class, () -> SpannerPlanConverter.convert(plan));
  }

  @Test
  void should_reject_cyclic_plan() {
    QueryPlan plan =
        QueryPlan.newBuilder()
            .addPlanNodes(relational(0, "Distributed Union", 1))
            .addPlanNodes(relational(1, "Filter", 0))
            .build();

    assertThrows(IllegalStateException.class, () -> SpannerPlanConverter.convert(plan));
  }

  private static OperatorKind kindOf(String displayName) {
    return SpannerPlanConverter.toOperatorKind(relational(0, displayName).build());
  }

  private static PlanNode.Builder relational(int index, String displayName, int... children) {
    PlanNode.Builder node =
        PlanNode.newBuilder()
            .setIndex(index)
            .setKind(PlanNode.Kind.RELATIONAL)
            .setDisplayName(displayName);
    for (int child : children) {
      node.addChildLinks(PlanNode.ChildLink.newBuilder().setChildIndex(child));
    }
    return node;
  }

  private static Value string(String value) {
    return Value.newBuilder().setStringValue(value).build();
  }
}
