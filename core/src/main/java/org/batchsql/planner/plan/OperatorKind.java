/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.planner.plan;

/** Operator of an execution plan node. */
public enum OperatorKind {
  /** Fans a subplan out to every split of the keyspace and unions the results. */
  DISTRIBUTED_UNION,
  /** Union of the splits held by one server. */
  LOCAL_DISTRIBUTED_UNION,
  /** Distributed join that ships rows from the input to the map side. */
  DISTRIBUTED_CROSS_APPLY,
  SERIALIZE_RESULT,
  SCAN,
  FILTER,
  FILTER_SCAN,
  COMPUTE,
  /** Join whose inputs are not co-located. */
  JOIN,
  /** Join evaluated per input row, local when the tables are interleaved. */
  CROSS_APPLY,
  AGGREGATE,
  SORT,
  /** Sort that merges streams from several splits. */
  MERGE_SORT,
  LIMIT,
  UNION_ALL,
  /** Expression node (function, constant, reference). */
  SCALAR,
  /** Operator this library does not recognize. */
  OTHER
}
