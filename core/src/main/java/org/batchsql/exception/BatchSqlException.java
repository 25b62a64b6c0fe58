/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.exception;

import lombok.Getter;
import org.batchsql.client.PartitionToken;

/**
 * Structured failure of a partitioned query. Carries the failure kind, the partition token the
 * failure is attributed to (if any) and the underlying cause chain.
 */
@Getter
public class BatchSqlException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final ErrorCode errorCode;

  /** Token the failure belongs to, or null when the failure is not partition specific. */
  private final transient PartitionToken partitionToken;

  public BatchSqlException(ErrorCode errorCode, String message) {
    this(errorCode, message, null, null);
  }

  public BatchSqlException(ErrorCode errorCode, String message, Throwable cause) {
    this(errorCode, message, null, cause);
  }

  public BatchSqlException(
      ErrorCode errorCode, String message, PartitionToken partitionToken, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
    this.partitionToken = partitionToken;
  }

  @Override
  public String getMessage() {
    return "[" + errorCode + "] " + super.getMessage();
  }
}
