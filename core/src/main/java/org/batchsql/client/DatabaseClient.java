/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.client;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.batchsql.planner.plan.ExecutionPlan;
import org.batchsql.query.Query;

/**
 * Connection to a range-partitioned database. Implementations wrap the database's own client
 * library; the network protocol, sessions and planning all live behind this interface.
 *
 * <p>A partitioned read is opened with {@link #openReadSession(Query)}, split into tokens with
 * {@link #partitionQuery(ReadSession, Query, Integer)}, read token by token with {@link
 * #executePartition(ReadSession, PartitionToken)} and finally released with {@link
 * #releaseSession(ReadSession)}. {@link #executePartition} is called concurrently from several
 * threads against the same session.
 */
public interface DatabaseClient {

  /**
   * Fetches the execution plan the database would use for the query.
   *
   * @param query the query to plan
   * @return the plan tree
   */
  ExecutionPlan getQueryPlan(Query query);

  /**
   * Opens a partitioned-read session on the isolated compute tier.
   *
   * @param query the query the session will partition
   * @return session handle, to be released exactly once
   */
  ReadSession openReadSession(Query query);

  /**
   * Splits the query into partition tokens for the given session.
   *
   * @param session session opened for the query
   * @param query the query to partition
   * @param maxPartitionsHint desired partition count, or null to let the backend decide
   * @return tokens in dispatch order
   */
  List<PartitionToken> partitionQuery(ReadSession session, Query query, Integer maxPartitionsHint);

  /**
   * Reads one partition.
   *
   * @param session session that issued the token
   * @param token partition to read
   * @return rows of the partition, closed by the caller
   */
  RowIterator executePartition(ReadSession session, PartitionToken token);

  /** Releases server-side resources of the session. */
  void releaseSession(ReadSession session);

  /**
   * Returns whether the failure is worth retrying. The default recognizes {@link
   * TransientBackendException} and timeouts anywhere in the cause chain.
   */
  default boolean isTransient(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof TransientBackendException
          || t instanceof TimeoutException
          || t instanceof SocketTimeoutException) {
        return true;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return false;
  }
}
