/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor.partition;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.resilience4j.retry.Retry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import lombok.extern.log4j.Log4j2;
import org.batchsql.client.DatabaseClient;
import org.batchsql.client.PartitionToken;
import org.batchsql.client.ReadSession;
import org.batchsql.client.RowIterator;
import org.batchsql.data.Schema;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;
import org.batchsql.query.QueryOptions;

/**
 * Reads every partition of a session on a bounded worker pool and returns one {@link
 * PartitionResult} per token, in token order.
 *
 * <p>Each worker owns exactly one result slot, indexed by the token's dispatch position, so the
 * output order never depends on completion order. A failed partition never aborts its siblings;
 * only the cancellation signal or the overall timeout stop the batch, in which case queued tokens
 * are abandoned, in-flight reads are interrupted and the call waits (bounded by the shutdown
 * timeout) for workers to stop before raising CANCELLED or TIMEOUT. A worker that dies with an
 * unexpected error stops the pool the same way before the error is rethrown.
 */
@Log4j2
public class ParallelPartitionExecutor {

  private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

  /** Executes with default options and no external cancellation. */
  public List<PartitionResult> execute(
      DatabaseClient client,
      ReadSession session,
      List<PartitionToken> tokens,
      int concurrencyLimit) {
    return execute(
        client,
        session,
        tokens,
        QueryOptions.builder().concurrencyLimit(concurrencyLimit).build(),
        new CancellationSignal());
  }

  /**
   * Reads all partitions.
   *
   * @param client connection used for every read
   * @param session session that issued the tokens, shared read-only by all workers
   * @param tokens partitions in dispatch order
   * @param options concurrency, retry and timeout settings
   * @param cancellation caller's stop signal
   * @return results with {@code results.get(i)} belonging to {@code tokens.get(i)}
   * @throws BatchSqlException CANCELLED or TIMEOUT when the batch was stopped
   */
  public List<PartitionResult> execute(
      DatabaseClient client,
      ReadSession session,
      List<PartitionToken> tokens,
      QueryOptions options,
      CancellationSignal cancellation) {
    int count = tokens.size();
    if (cancellation.isCancelled()) {
      throw new BatchSqlException(ErrorCode.CANCELLED, "Query cancelled before dispatch");
    }
    if (count == 0) {
      return List.of();
    }

    CancellationSignal stop = cancellation.newChild();
    PartitionReadRetry retry = new PartitionReadRetry(options, client, stop);
    AtomicReferenceArray<PartitionResult> slots = new AtomicReferenceArray<>(count);
    int workers = Math.min(options.getConcurrencyLimit(), count);
    ExecutorService pool =
        Executors.newFixedThreadPool(
            workers,
            new ThreadFactoryBuilder()
                .setNameFormat("partition-reader-" + POOL_SEQUENCE.incrementAndGet() + "-%d")
                .setDaemon(true)
                .build());

    log.info("Dispatching {} partition(s) on {} worker(s)", count, workers);
    List<CompletableFuture<Void>> futures = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      final int slot = i;
      futures.add(
          CompletableFuture.runAsync(
              () -> {
                PartitionToken token = tokens.get(slot);
                PartitionResult result =
                    readPartition(client, session, token, retry.forPartition(slot), stop);
                slots.compareAndSet(slot, null, result);
              },
              pool));
    }

    ErrorCode abortCode;
    try {
      abortCode = awaitSettled(futures, stop, options.getOverallTimeout().orElse(null));
    } catch (RuntimeException e) {
      stop.cancel();
      pool.shutdownNow();
      awaitTermination(pool, options.getShutdownTimeout());
      throw e;
    }

    if (abortCode == null) {
      pool.shutdown();
    } else {
      stop.cancel();
      List<Runnable> abandoned = pool.shutdownNow();
      awaitTermination(pool, options.getShutdownTimeout());
      int unsettled = 0;
      for (int i = 0; i < count; i++) {
        if (slots.compareAndSet(i, null, PartitionResult.cancelled(tokens.get(i), 0))) {
          unsettled++;
        }
      }
      log.warn(
          "Partitioned read stopped ({}): {} partition(s) unsettled, {} never dispatched",
          abortCode,
          unsettled,
          abandoned.size());
      throw new BatchSqlException(
          abortCode,
          abortCode == ErrorCode.TIMEOUT
              ? "Partitioned read exceeded overall timeout of " + options.getOverallTimeout().get()
              : "Partitioned read cancelled");
    }

    List<PartitionResult> results = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      results.add(slots.get(i));
    }
    long failed = results.stream().filter(r -> !r.isSuccess()).count();
    log.info("Partitioned read settled: {} succeeded, {} failed", count - failed, failed);
    return Collections.unmodifiableList(results);
  }

  /** Returns null once every read settled, or the code of the condition that stopped the wait. */
  private ErrorCode awaitSettled(
      List<CompletableFuture<Void>> futures, CancellationSignal stop, Duration overallTimeout) {
    CompletableFuture<Void> settled =
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
    CompletableFuture<Object> firstOf = CompletableFuture.anyOf(settled, stop.whenCancelled());
    try {
      if (overallTimeout == null) {
        firstOf.get();
      } else {
        firstOf.get(overallTimeout.toMillis(), TimeUnit.MILLISECONDS);
      }
    } catch (TimeoutException e) {
      return ErrorCode.TIMEOUT;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ErrorCode.CANCELLED;
    } catch (ExecutionException e) {
      throw new IllegalStateException("Partition worker failed unexpectedly", e.getCause());
    }
    return stop.isCancelled() ? ErrorCode.CANCELLED : null;
  }

  private void awaitTermination(ExecutorService pool, Duration shutdownTimeout) {
    try {
      if (!pool.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Partition workers did not stop within {}", shutdownTimeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private PartitionResult readPartition(
      DatabaseClient client,
      ReadSession session,
      PartitionToken token,
      Retry retry,
      CancellationSignal stop) {
    if (stop.isCancelled()) {
      return PartitionResult.cancelled(token, 0);
    }
    if (!token.belongsTo(session)) {
      return PartitionResult.failed(
          token,
          new BatchSqlException(
              ErrorCode.INVALID_PARTITION_TOKEN,
              "Token of session "
                  + token.getSessionId()
                  + " used with session "
                  + session.getSessionId(),
              token,
              null),
          0);
    }

    AtomicInteger attempts = new AtomicInteger();
    Callable<PartitionData> read =
        Retry.decorateCallable(
            retry,
            () -> {
              attempts.incrementAndGet();
              return readOnce(client, session, token, stop);
            });
    log.debug("Reading partition {}", token.getIndex());
    try {
      PartitionData data = read.call();
      log.debug(
          "Partition {} returned {} row(s) after {} attempt(s)",
          token.getIndex(),
          data.rows.size(),
          attempts.get());
      return PartitionResult.succeeded(token, data.schema, data.rows, attempts.get());
    } catch (Exception e) {
      if (stop.isCancelled() || isCancellation(e)) {
        return PartitionResult.cancelled(token, attempts.get());
      }
      log.error("Partition {} failed after {} attempt(s)", token.getIndex(), attempts.get(), e);
      return PartitionResult.failed(token, toReadFailure(token, e), attempts.get());
    }
  }

  private PartitionData readOnce(
      DatabaseClient client, ReadSession session, PartitionToken token, CancellationSignal stop) {
    try (RowIterator rows = client.executePartition(session, token)) {
      Schema schema = rows.getSchema();
      List<List<Object>> data = new ArrayList<>();
      while (rows.hasNext()) {
        if (stop.isCancelled() || Thread.currentThread().isInterrupted()) {
          throw new BatchSqlException(
              ErrorCode.CANCELLED,
              "Read of partition " + token.getIndex() + " stopped",
              token,
              null);
        }
        data.add(Collections.unmodifiableList(new ArrayList<>(rows.next())));
      }
      return new PartitionData(schema, data);
    }
  }

  private static boolean isCancellation(Exception e) {
    return e instanceof InterruptedException
        || (e instanceof BatchSqlException
            && ((BatchSqlException) e).getErrorCode() == ErrorCode.CANCELLED);
  }

  private static BatchSqlException toReadFailure(PartitionToken token, Exception e) {
    if (e instanceof BatchSqlException
        && ((BatchSqlException) e).getErrorCode() == ErrorCode.INVALID_PARTITION_TOKEN) {
      return (BatchSqlException) e;
    }
    return new BatchSqlException(
        ErrorCode.PARTITION_READ_FAILED,
        "Read of partition " + token.getIndex() + " failed: " + e.getMessage(),
        token,
        e);
  }

  private static final class PartitionData {
    private final Schema schema;
    private final List<List<Object>> rows;

    private PartitionData(Schema schema, List<List<Object>> rows) {
      this.schema = schema;
      this.rows = rows;
    }
  }
}
