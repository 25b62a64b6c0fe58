/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.batchsql.client.DatabaseClient;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;
import org.batchsql.executor.partition.CancellationSignal;
import org.batchsql.executor.partition.ParallelPartitionExecutor;
import org.batchsql.executor.partition.PartitionDiscoverer;
import org.batchsql.executor.partition.PartitionResult;
import org.batchsql.executor.partition.PartitionedRead;
import org.batchsql.planner.PlanInspector;
import org.batchsql.planner.RootPartitionableDecision;
import org.batchsql.query.Query;
import org.batchsql.query.QueryOptions;

/**
 * Entry point for running a root-partitionable query as parallel partition reads.
 *
 * <ol>
 *   <li>Inspect the plan; fail with NOT_PARTITIONABLE before any session is opened
 *   <li>Open a read session and discover partition tokens
 *   <li>Read all partitions on a bounded worker pool
 *   <li>Assemble the partial results under the configured failure policy
 * </ol>
 *
 * <p>The read session is released exactly once on every exit path: success, partial failure,
 * schema mismatch, cancellation and timeout.
 */
@Log4j2
@RequiredArgsConstructor
public class PartitionedQueryExecutor {

  private final PlanInspector planInspector;
  private final PartitionDiscoverer partitionDiscoverer;
  private final ParallelPartitionExecutor partitionExecutor;
  private final ResultAssembler resultAssembler;

  public PartitionedQueryExecutor() {
    this(
        new PlanInspector(),
        new PartitionDiscoverer(),
        new ParallelPartitionExecutor(),
        new ResultAssembler());
  }

  /** Runs a query with default options. */
  public QueryResult runPartitionedQuery(DatabaseClient client, String sql) {
    return runPartitionedQuery(client, sql, Map.of(), QueryOptions.defaults());
  }

  /** Runs a query without external cancellation. */
  public QueryResult runPartitionedQuery(
      DatabaseClient client, String sql, Map<String, ?> params, QueryOptions options) {
    return runPartitionedQuery(
        client, Query.of(sql, params), options, new CancellationSignal());
  }

  /**
   * Runs a query.
   *
   * @param client open database connection
   * @param query query and parameters
   * @param options execution options
   * @param cancellation caller's stop signal
   * @return the merged result
   * @throws BatchSqlException identifying the failure kind, offending token and cause
   */
  public QueryResult runPartitionedQuery(
      DatabaseClient client,
      Query query,
      QueryOptions options,
      CancellationSignal cancellation) {
    long start = System.nanoTime();
    log.info("Running partitioned query: {}", query.getSql());

    RootPartitionableDecision decision = planInspector.inspect(client, query);
    if (!decision.isPartitionable()) {
      log.info("Query is not root-partitionable: {}", decision.getReason());
      throw new BatchSqlException(ErrorCode.NOT_PARTITIONABLE, decision.getReason());
    }
    if (cancellation.isCancelled()) {
      throw new BatchSqlException(ErrorCode.CANCELLED, "Query cancelled before discovery");
    }

    try (PartitionedRead read =
        partitionDiscoverer.discover(client, query, decision, options.getMaxPartitionsHint())) {
      List<PartitionResult> results =
          partitionExecutor.execute(
              client, read.getSession(), read.getTokens(), options, cancellation);
      QueryResult result = resultAssembler.assemble(results, options.getOnPartialFailure());
      log.info(
          "Partitioned query returned {} row(s) from {} partition(s) in {} ms",
          result.getRowCount(),
          results.size(),
          (System.nanoTime() - start) / 1_000_000);
      return result;
    }
  }
}
