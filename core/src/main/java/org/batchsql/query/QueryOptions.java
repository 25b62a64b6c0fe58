/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.query;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.util.Optional;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.batchsql.common.setting.Settings;

/** Tuning knobs of one partitioned query execution. */
@Getter
@EqualsAndHashCode
@ToString
public final class QueryOptions {

  public static final int DEFAULT_RETRY_BUDGET = 3;
  public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofMillis(100);
  public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
  public static final double DEFAULT_JITTER = 0.5;
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);
  public static final long MIN_BACKOFF_MILLIS = 10;

  /** Maximum number of partitions read at the same time. */
  private final int concurrencyLimit;

  /** Desired number of partitions, or null to let the backend decide. */
  private final Integer maxPartitionsHint;

  /** Retries of a transient partition failure after the first attempt. */
  private final int retryBudget;

  private final Duration initialBackoff;
  private final double backoffMultiplier;

  /** Randomization factor applied to each backoff interval, in [0, 1). */
  private final double jitter;

  /** Deadline for the whole execution, or null for none. */
  private final Duration overallTimeout;

  /** How long cancellation waits for in-flight workers to stop. */
  private final Duration shutdownTimeout;

  private final PartialFailurePolicy onPartialFailure;

  @Builder(toBuilder = true)
  private QueryOptions(
      Integer concurrencyLimit,
      Integer maxPartitionsHint,
      Integer retryBudget,
      Duration initialBackoff,
      Double backoffMultiplier,
      Double jitter,
      Duration overallTimeout,
      Duration shutdownTimeout,
      PartialFailurePolicy onPartialFailure) {
    this.concurrencyLimit =
        concurrencyLimit != null ? concurrencyLimit : Runtime.getRuntime().availableProcessors();
    this.maxPartitionsHint = maxPartitionsHint;
    this.retryBudget = retryBudget != null ? retryBudget : DEFAULT_RETRY_BUDGET;
    this.initialBackoff = initialBackoff != null ? initialBackoff : DEFAULT_INITIAL_BACKOFF;
    this.backoffMultiplier =
        backoffMultiplier != null ? backoffMultiplier : DEFAULT_BACKOFF_MULTIPLIER;
    this.jitter = jitter != null ? jitter : DEFAULT_JITTER;
    this.overallTimeout = overallTimeout;
    this.shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : DEFAULT_SHUTDOWN_TIMEOUT;
    this.onPartialFailure =
        onPartialFailure != null ? onPartialFailure : PartialFailurePolicy.ABORT;

    checkArgument(this.concurrencyLimit > 0, "concurrencyLimit must be positive");
    checkArgument(
        maxPartitionsHint == null || maxPartitionsHint > 0, "maxPartitionsHint must be positive");
    checkArgument(this.retryBudget >= 0, "retryBudget must not be negative");
    checkArgument(
        this.initialBackoff.toMillis() >= MIN_BACKOFF_MILLIS,
        "initialBackoff must be at least %s ms",
        MIN_BACKOFF_MILLIS);
    checkArgument(this.backoffMultiplier >= 1.0, "backoffMultiplier must be at least 1");
    checkArgument(this.jitter >= 0.0 && this.jitter < 1.0, "jitter must be in [0, 1)");
    checkArgument(
        overallTimeout == null || (!overallTimeout.isNegative() && !overallTimeout.isZero()),
        "overallTimeout must be positive");
    checkArgument(!this.shutdownTimeout.isNegative(), "shutdownTimeout must not be negative");
  }

  /** Options with every value at its default. */
  public static QueryOptions defaults() {
    return builder().build();
  }

  /** Reads options from settings, falling back to defaults for unset keys. */
  public static QueryOptions fromSettings(Settings settings) {
    return builder()
        .concurrencyLimit(settings.<Integer>getSettingValue(Settings.Key.CONCURRENCY_LIMIT))
        .maxPartitionsHint(settings.<Integer>getSettingValue(Settings.Key.MAX_PARTITIONS_HINT))
        .retryBudget(settings.<Integer>getSettingValue(Settings.Key.RETRY_BUDGET))
        .initialBackoff(millis(settings.getSettingValue(Settings.Key.RETRY_INITIAL_BACKOFF_MS)))
        .backoffMultiplier(
            settings.<Double>getSettingValue(Settings.Key.RETRY_BACKOFF_MULTIPLIER))
        .jitter(settings.<Double>getSettingValue(Settings.Key.RETRY_JITTER))
        .overallTimeout(millis(settings.getSettingValue(Settings.Key.OVERALL_TIMEOUT_MS)))
        .shutdownTimeout(millis(settings.getSettingValue(Settings.Key.SHUTDOWN_TIMEOUT_MS)))
        .onPartialFailure(
            Optional.ofNullable(settings.<String>getSettingValue(Settings.Key.ON_PARTIAL_FAILURE))
                .map(PartialFailurePolicy::fromName)
                .orElse(null))
        .build();
  }

  public Optional<Duration> getOverallTimeout() {
    return Optional.ofNullable(overallTimeout);
  }

  /** Maximum number of read attempts per partition. */
  public int maxAttempts() {
    return retryBudget + 1;
  }

  private static Duration millis(Long value) {
    return value == null ? null : Duration.ofMillis(value);
  }
}
