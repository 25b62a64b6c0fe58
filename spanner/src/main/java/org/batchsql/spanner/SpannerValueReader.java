/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.ByteArray;
import com.google.cloud.Date;
import com.google.cloud.Timestamp;
import com.google.cloud.spanner.StructReader;
import com.google.cloud.spanner.Type;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;
import org.batchsql.data.DataType;
import org.batchsql.data.Schema;

/**
 * Reads the current row of a Spanner result into Java values.
 *
 * <p>BYTES become {@code byte[]}, JSON is parsed into a Jackson {@link JsonNode}, DATE becomes
 * {@link LocalDate} and TIMESTAMP becomes {@link Instant} at microsecond precision. STRUCT and
 * OTHER columns, arrays of them included, are passed through as the Spanner {@code Value}; result
 * assembly rejects STRUCT.
 *
 * <p>PostgreSQL-dialect NUMERIC allows {@code NaN}, which {@link BigDecimal} cannot hold, so a NaN
 * cell reads as {@link Double#NaN}. FLOAT32 widens to {@code Double}.
 */
public final class SpannerValueReader {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SpannerValueReader() {}

  public static List<Object> readRow(StructReader row, Schema schema) {
    List<Schema.Column> columns = schema.getColumns();
    List<Object> values = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      values.add(row.isNull(i) ? null : readValue(row, i, columns.get(i).getType()));
    }
    // Nulls are legal cell values, so no ImmutableList here.
    return Collections.unmodifiableList(values);
  }

  private static Object readValue(StructReader row, int i, DataType type) {
    Type.Code spannerCode = row.getColumnType(i).getCode();
    switch (type.getCode()) {
      case BOOL:
        return row.getBoolean(i);
      case INT64:
        return row.getLong(i);
      case FLOAT64:
        return spannerCode == Type.Code.FLOAT32 ? (double) row.getFloat(i) : row.getDouble(i);
      case NUMERIC:
        return spannerCode == Type.Code.PG_NUMERIC
            ? toNumeric(row.getValue(i).getString())
            : row.getBigDecimal(i);
      case STRING:
        return row.getString(i);
      case BYTES:
        return row.getBytes(i).toByteArray();
      case JSON:
        return parseJson(spannerCode == Type.Code.PG_JSONB ? row.getPgJsonb(i) : row.getJson(i));
      case DATE:
        return toLocalDate(row.getDate(i));
      case TIMESTAMP:
        return toInstant(row.getTimestamp(i));
      case ARRAY:
        return readArray(row, i, type.getElementType());
      case STRUCT:
      case OTHER:
        return row.getValue(i);
      default:
        throw new IllegalStateException("No reader for column type " + type);
    }
  }

  private static Object readArray(StructReader row, int i, DataType elementType) {
    Type.Code spannerCode = row.getColumnType(i).getArrayElementType().getCode();
    switch (elementType.getCode()) {
      case BOOL:
        return copy(row.getBooleanList(i), Function.identity());
      case INT64:
        return copy(row.getLongList(i), Function.identity());
      case FLOAT64:
        return spannerCode == Type.Code.FLOAT32
            ? copy(row.getFloatList(i), Float::doubleValue)
            : copy(row.getDoubleList(i), Function.identity());
      case NUMERIC:
        return spannerCode == Type.Code.PG_NUMERIC
            ? copy(row.getValue(i).getStringArray(), SpannerValueReader::toNumeric)
            : copy(row.getBigDecimalList(i), Function.identity());
      case STRING:
        return copy(row.getStringList(i), Function.identity());
      case BYTES:
        return copy(row.getBytesList(i), ByteArray::toByteArray);
      case JSON:
        return spannerCode == Type.Code.PG_JSONB
            ? copy(row.getPgJsonbList(i), SpannerValueReader::parseJson)
            : copy(row.getJsonList(i), SpannerValueReader::parseJson);
      case DATE:
        return copy(row.getDateList(i), SpannerValueReader::toLocalDate);
      case TIMESTAMP:
        return copy(row.getTimestampList(i), SpannerValueReader::toInstant);
      case STRUCT:
      case OTHER:
        return row.getValue(i);
      default:
        throw new IllegalStateException("No reader for array element type " + elementType);
    }
  }

  /** Copies a Spanner list, keeping null elements as null. */
  private static <T> List<Object> copy(List<T> source, Function<T, ?> convert) {
    List<Object> values = new ArrayList<>(source.size());
    for (T element : source) {
      values.add(element == null ? null : convert.apply(element));
    }
    return Collections.unmodifiableList(values);
  }

  static Object toNumeric(String text) {
    return "NaN".equals(text) ? (Object) Double.NaN : new BigDecimal(text);
  }

  static JsonNode parseJson(String json) {
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new UncheckedIOException("Spanner returned malformed JSON", e);
    }
  }

  static LocalDate toLocalDate(Date date) {
    return LocalDate.of(date.getYear(), date.getMonth(), date.getDayOfMonth());
  }

  static Instant toInstant(Timestamp timestamp) {
    return Instant.ofEpochSecond(timestamp.getSeconds(), (timestamp.getNanos() / 1_000) * 1_000L);
  }
}
