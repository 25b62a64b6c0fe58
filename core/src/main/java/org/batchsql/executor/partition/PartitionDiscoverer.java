/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor.partition;

import java.util.List;
import lombok.extern.log4j.Log4j2;
import org.batchsql.client.DatabaseClient;
import org.batchsql.client.PartitionToken;
import org.batchsql.client.ReadSession;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;
import org.batchsql.planner.RootPartitionableDecision;
import org.batchsql.query.Query;

/** Opens a partitioned-read session for a root-partitionable query and collects its tokens. */
@Log4j2
public class PartitionDiscoverer {

  /**
   * Discovers the partitions of a query.
   *
   * @param client open database connection
   * @param query query already found partitionable
   * @param decision the plan inspection outcome for the query
   * @param maxPartitionsHint desired partition count, or null
   * @return the session and its tokens; the caller closes it exactly once
   * @throws BatchSqlException NOT_PARTITIONABLE when the decision is missing or negative,
   *     PARTITION_DISCOVERY_FAILED when the backend fails
   */
  public PartitionedRead discover(
      DatabaseClient client,
      Query query,
      RootPartitionableDecision decision,
      Integer maxPartitionsHint) {
    if (decision == null || !decision.isPartitionable()) {
      throw new BatchSqlException(
          ErrorCode.NOT_PARTITIONABLE,
          "Partition discovery requires a root-partitionable query"
              + (decision == null ? "" : ": " + decision.getReason()));
    }

    ReadSession session;
    try {
      session = client.openReadSession(query);
    } catch (RuntimeException e) {
      throw new BatchSqlException(
          ErrorCode.PARTITION_DISCOVERY_FAILED, "Failed to open read session", e);
    }

    List<PartitionToken> tokens;
    try {
      tokens = client.partitionQuery(session, query, maxPartitionsHint);
    } catch (RuntimeException e) {
      releaseAfterFailure(client, session, e);
      throw new BatchSqlException(
          ErrorCode.PARTITION_DISCOVERY_FAILED,
          "Failed to partition query: " + e.getMessage(),
          e);
    }

    log.info(
        "Discovered {} partition(s) for table {} in session {} (hint={})",
        tokens.size(),
        decision.getScanTarget().orElse("<unknown>"),
        session.getSessionId(),
        maxPartitionsHint);
    return new PartitionedRead(client, session, tokens);
  }

  private void releaseAfterFailure(DatabaseClient client, ReadSession session, Exception cause) {
    try {
      client.releaseSession(session);
    } catch (RuntimeException releaseFailure) {
      cause.addSuppressed(releaseFailure);
    }
  }
}
