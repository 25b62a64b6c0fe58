/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.exception;

import lombok.Getter;
import org.batchsql.client.PartitionToken;

/**
 * Raised under the abort policy when at least one partition failed. Cites the first failed
 * partition in dispatch order and counts the remaining failures.
 */
@Getter
public class PartialFailureException extends BatchSqlException {

  private static final long serialVersionUID = 1L;

  private final int otherFailureCount;

  public PartialFailureException(
      PartitionToken partitionToken, Throwable cause, int otherFailureCount) {
    super(
        ErrorCode.PARTIAL_FAILURE,
        String.format(
            "Partition %d failed (%d other partition(s) also failed): %s",
            partitionToken.getIndex(),
            otherFailureCount,
            cause == null ? "unknown cause" : cause.getMessage()),
        partitionToken,
        cause);
    this.otherFailureCount = otherFailureCount;
  }
}
