/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Setting source for partitioned query execution. */
public abstract class Settings {

  /** Known setting keys, with the parser that turns the raw value into its Java type. */
  @RequiredArgsConstructor
  public enum Key {
    CONCURRENCY_LIMIT("batchsql.partition.concurrency_limit", Integer::valueOf),
    MAX_PARTITIONS_HINT("batchsql.partition.max_partitions_hint", Integer::valueOf),
    RETRY_BUDGET("batchsql.partition.retry_budget", Integer::valueOf),
    RETRY_INITIAL_BACKOFF_MS("batchsql.partition.retry_initial_backoff_ms", Long::valueOf),
    RETRY_BACKOFF_MULTIPLIER("batchsql.partition.retry_backoff_multiplier", Double::valueOf),
    RETRY_JITTER("batchsql.partition.retry_jitter", Double::valueOf),
    OVERALL_TIMEOUT_MS("batchsql.query.overall_timeout_ms", Long::valueOf),
    SHUTDOWN_TIMEOUT_MS("batchsql.query.shutdown_timeout_ms", Long::valueOf),
    ON_PARTIAL_FAILURE("batchsql.query.on_partial_failure", Function.identity()),
    DATA_BOOST_ENABLED("batchsql.spanner.data_boost_enabled", Boolean::valueOf);

    @Getter private final String keyValue;

    private final Function<String, ?> parser;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ImmutableMap.Builder<String, Key> builder = new ImmutableMap.Builder<>();
      for (Key key : Key.values()) {
        builder.put(key.getKeyValue(), key);
      }
      ALL_KEYS = builder.build();
    }

    public static Optional<Key> of(String keyValue) {
      return Optional.ofNullable(ALL_KEYS.get(keyValue));
    }

    /** Converts a raw string into the value type of this key. */
    public Object parse(String raw) {
      try {
        return parser.apply(raw.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(
            "Invalid value [" + raw + "] for setting " + keyValue, e);
      }
    }

    @Override
    public String toString() {
      return keyValue;
    }
  }

  /**
   * Returns the value of the setting, or null when it is not set.
   *
   * @param key setting key
   * @return typed value or null
   */
  public abstract <T> T getSettingValue(Key key);

  /** Returns the value of the setting, or the fallback when it is not set. */
  public <T> T getSettingValue(Key key, T fallback) {
    T value = getSettingValue(key);
    return value != null ? value : fallback;
  }

  /** Lists keys that currently have a value. */
  public Map<Key, Object> getSettings() {
    ImmutableMap.Builder<Key, Object> builder = new ImmutableMap.Builder<>();
    Arrays.stream(Key.values())
        .forEach(
            key -> {
              Object value = getSettingValue(key);
              if (value != null) {
                builder.put(key, value);
              }
            });
    return builder.build();
  }
}
