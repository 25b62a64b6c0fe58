/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.cloud.ByteArray;
import com.google.cloud.Date;
import com.google.cloud.Timestamp;
import com.google.cloud.spanner.Statement;
import com.google.cloud.spanner.Value;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import org.batchsql.exception.BatchSqlException;
import org.batchsql.exception.ErrorCode;
import org.batchsql.query.Query;

/** Turns a {@link Query} into a Spanner {@link Statement} with named parameters bound. */
public final class SpannerStatementBinder {

  private SpannerStatementBinder() {}

  public static Statement bind(Query query) {
    Statement.Builder builder = Statement.newBuilder(query.getSql());
    for (Map.Entry<String, Object> parameter : query.getParameters().entrySet()) {
      builder.bind(parameter.getKey()).to(toValue(parameter.getKey(), parameter.getValue()));
    }
    return builder.build();
  }

  /**
   * Converts a Java parameter value. A null binds as a STRING NULL, which Spanner coerces in
   * comparisons against STRING columns only.
   */
  static Value toValue(String name, Object value) {
    if (value == null) {
      return Value.string(null);
    }
    if (value instanceof Boolean) {
      return Value.bool((Boolean) value);
    }
    if (value instanceof Long || value instanceof Integer || value instanceof Short) {
      return Value.int64(((Number) value).longValue());
    }
    if (value instanceof Double || value instanceof Float) {
      return Value.float64(((Number) value).doubleValue());
    }
    if (value instanceof BigDecimal) {
      return Value.numeric((BigDecimal) value);
    }
    if (value instanceof String) {
      return Value.string((String) value);
    }
    if (value instanceof byte[]) {
      return Value.bytes(ByteArray.copyFrom((byte[]) value));
    }
    if (value instanceof JsonNode) {
      return Value.json(value.toString());
    }
    if (value instanceof LocalDate) {
      LocalDate date = (LocalDate) value;
      return Value.date(
          Date.fromYearMonthDay(date.getYear(), date.getMonthValue(), date.getDayOfMonth()));
    }
    if (value instanceof Instant) {
      Instant instant = (Instant) value;
      return Value.timestamp(
          Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano()));
    }
    throw new BatchSqlException(
        ErrorCode.INVALID_QUERY,
        "Parameter @" + name + " has unsupported type " + value.getClass().getName());
  }
}
