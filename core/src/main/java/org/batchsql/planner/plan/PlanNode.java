/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.planner.plan;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** Read-only node of an execution plan tree. */
@Getter
@EqualsAndHashCode
@ToString
public final class PlanNode {

  /** Metadata key holding the table or index a scan reads. */
  public static final String SCAN_TARGET = "scan_target";

  private final OperatorKind kind;

  /** Operator name as the database displays it. */
  private final String displayName;

  private final List<PlanNode> children;

  /** Operator specific attributes, such as the scan target or join type. */
  private final Map<String, String> metadata;

  public PlanNode(
      OperatorKind kind,
      String displayName,
      List<PlanNode> children,
      Map<String, String> metadata) {
    this.kind = kind;
    this.displayName = displayName;
    this.children = ImmutableList.copyOf(children);
    this.metadata = ImmutableMap.copyOf(metadata);
  }

  public static PlanNode of(OperatorKind kind, PlanNode... children) {
    return new PlanNode(kind, kind.name(), List.of(children), Map.of());
  }

  public Optional<String> getMetadataValue(String key) {
    return Optional.ofNullable(metadata.get(key));
  }

  /** Returns the scan target of the first scan found depth first, if any. */
  public Optional<String> findScanTarget() {
    if (kind == OperatorKind.SCAN || kind == OperatorKind.FILTER_SCAN) {
      Optional<String> target = getMetadataValue(SCAN_TARGET);
      if (target.isPresent()) {
        return target;
      }
    }
    for (PlanNode child : children) {
      Optional<String> target = child.findScanTarget();
      if (target.isPresent()) {
        return target;
      }
    }
    return Optional.empty();
  }
}
