/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor.partition;

import java.util.List;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.batchsql.client.PartitionToken;
import org.batchsql.data.Schema;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;

/** Outcome of reading exactly one partition: its rows, or the failure that ended the read. */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@ToString(exclude = "rows")
public final class PartitionResult {

  /** Terminal state of a partition read. */
  public enum Status {
    SUCCEEDED,
    FAILED,
    CANCELLED
  }

  private final PartitionToken token;
  private final Status status;
  private final Schema schema;
  private final List<List<Object>> rows;
  private final BatchSqlException failure;

  /** Number of read attempts made, zero when the read never started. */
  private final int attempts;

  public static PartitionResult succeeded(
      PartitionToken token, Schema schema, List<List<Object>> rows, int attempts) {
    return new PartitionResult(token, Status.SUCCEEDED, schema, List.copyOf(rows), null, attempts);
  }

  public static PartitionResult failed(
      PartitionToken token, BatchSqlException failure, int attempts) {
    return new PartitionResult(token, Status.FAILED, null, List.of(), failure, attempts);
  }

  public static PartitionResult cancelled(PartitionToken token, int attempts) {
    return new PartitionResult(
        token,
        Status.CANCELLED,
        null,
        List.of(),
        new BatchSqlException(
            ErrorCode.CANCELLED,
            "Partition " + token.getIndex() + " was cancelled",
            token,
            null),
        attempts);
  }

  public boolean isSuccess() {
    return status == Status.SUCCEEDED;
  }

  public int getRowCount() {
    return rows.size();
  }

  public Optional<BatchSqlException> getFailure() {
    return Optional.ofNullable(failure);
  }
}
