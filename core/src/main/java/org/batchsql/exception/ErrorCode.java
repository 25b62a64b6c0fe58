/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.exception;

/** Failure kinds surfaced by partitioned query execution. */
public enum ErrorCode {
  INVALID_QUERY,
  /** Root operator of the plan is not a distributed union. */
  NOT_PARTITIONABLE,
  BACKEND_UNAVAILABLE,
  PLAN_INSPECTION_FAILED,
  PARTITION_DISCOVERY_FAILED,
  /** Token used against a session other than the one that issued it. */
  INVALID_PARTITION_TOKEN,
  /** Per-partition read failure, after retries where the failure was transient. */
  PARTITION_READ_FAILED,
  /** Partitions reported different column schemas. Always fatal. */
  SCHEMA_MISMATCH,
  PARTIAL_FAILURE,
  UNSUPPORTED_TYPE,
  CANCELLED,
  TIMEOUT
}
