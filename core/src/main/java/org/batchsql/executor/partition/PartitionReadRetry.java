/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor.partition;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.log4j.Log4j2;
import org.batchsql.client.DatabaseClient;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.query.QueryOptions;

/**
 * Retry policy of partition reads: exponential backoff with jitter, applied only to failures the
 * client classifies as transient, and never once the stop signal fired.
 */
@Log4j2
class PartitionReadRetry {

  private final RetryConfig config;

  PartitionReadRetry(QueryOptions options, DatabaseClient client, CancellationSignal stop) {
    this.config =
        RetryConfig.custom()
            .maxAttempts(options.maxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialRandomBackoff(
                    options.getInitialBackoff().toMillis(),
                    options.getBackoffMultiplier(),
                    options.getJitter()))
            .retryOnException(
                failure ->
                    !(failure instanceof BatchSqlException)
                        && !stop.isCancelled()
                        && client.isTransient(failure))
            .build();
  }

  /** Returns a retry instance for one partition; retry events are logged under its name. */
  Retry forPartition(int index) {
    Retry retry = Retry.of("partition-" + index, config);
    retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Retrying {} (attempt {}) in {} after: {}",
                    event.getName(),
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(),
                    String.valueOf(event.getLastThrowable())));
    return retry;
  }
}
