/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor;

import java.util.Collections;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.batchsql.data.ColumnarTable;
import org.batchsql.data.Schema;
import org.batchsql.executor.partition.PartitionResult;

/**
 * Merged output of a partitioned query: the shared schema and the rows of every successful
 * partition, concatenated in dispatch order. Rows are not globally sorted.
 */
@Getter
@EqualsAndHashCode(exclude = "failedPartitions")
@ToString(exclude = "rows")
public final class QueryResult {

  private final Schema schema;
  private final List<List<Object>> rows;

  /** Partitions skipped under the best-effort policy; empty otherwise. */
  private final List<PartitionResult> failedPartitions;

  public QueryResult(
      Schema schema, List<List<Object>> rows, List<PartitionResult> failedPartitions) {
    this.schema = schema;
    this.rows = Collections.unmodifiableList(rows);
    this.failedPartitions = List.copyOf(failedPartitions);
  }

  public static QueryResult empty() {
    return new QueryResult(Schema.empty(), List.of(), List.of());
  }

  public int getRowCount() {
    return rows.size();
  }

  public int getFailedPartitionCount() {
    return failedPartitions.size();
  }

  public boolean isComplete() {
    return failedPartitions.isEmpty();
  }

  /** Returns the result as one value list per column. */
  public ColumnarTable toColumnar() {
    return ColumnarTable.fromRows(schema, rows);
  }
}
