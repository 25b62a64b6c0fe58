/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.data;

import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Column type as reported by the database. Arrays carry their element type; every other code has a
 * null element type.
 *
 * <p>Values of each type are exposed as: BOOL {@code Boolean}, INT64 {@code Long}, FLOAT64 {@code
 * Double}, NUMERIC {@code BigDecimal}, STRING {@code String}, BYTES {@code byte[]}, JSON Jackson
 * {@code JsonNode}, DATE {@code LocalDate}, TIMESTAMP {@code Instant}, ARRAY {@code List}.
 * OTHER covers database types with no dedicated mapping; its values are the client library's own
 * value objects, passed through as read.
 */
@Getter
@EqualsAndHashCode
public final class DataType {

  /** Type codes understood by result assembly. */
  public enum TypeCode {
    BOOL,
    INT64,
    FLOAT64,
    NUMERIC,
    STRING,
    BYTES,
    JSON,
    DATE,
    TIMESTAMP,
    ARRAY,
    STRUCT,
    OTHER
  }

  public static final DataType BOOL = new DataType(TypeCode.BOOL, null);
  public static final DataType INT64 = new DataType(TypeCode.INT64, null);
  public static final DataType FLOAT64 = new DataType(TypeCode.FLOAT64, null);
  public static final DataType NUMERIC = new DataType(TypeCode.NUMERIC, null);
  public static final DataType STRING = new DataType(TypeCode.STRING, null);
  public static final DataType BYTES = new DataType(TypeCode.BYTES, null);
  public static final DataType JSON = new DataType(TypeCode.JSON, null);
  public static final DataType DATE = new DataType(TypeCode.DATE, null);
  public static final DataType TIMESTAMP = new DataType(TypeCode.TIMESTAMP, null);
  public static final DataType STRUCT = new DataType(TypeCode.STRUCT, null);
  public static final DataType OTHER = new DataType(TypeCode.OTHER, null);

  private final TypeCode code;
  private final DataType elementType;

  private DataType(TypeCode code, DataType elementType) {
    this.code = code;
    this.elementType = elementType;
  }

  /** Returns the type of an array whose elements have the given type. */
  public static DataType array(DataType elementType) {
    return new DataType(TypeCode.ARRAY, Objects.requireNonNull(elementType, "elementType"));
  }

  /** Returns the scalar type for the code. Use {@link #array(DataType)} for arrays. */
  public static DataType of(TypeCode code) {
    switch (code) {
      case BOOL:
        return BOOL;
      case INT64:
        return INT64;
      case FLOAT64:
        return FLOAT64;
      case NUMERIC:
        return NUMERIC;
      case STRING:
        return STRING;
      case BYTES:
        return BYTES;
      case JSON:
        return JSON;
      case DATE:
        return DATE;
      case TIMESTAMP:
        return TIMESTAMP;
      case STRUCT:
        return STRUCT;
      case OTHER:
        return OTHER;
      default:
        throw new IllegalArgumentException("Array type requires an element type");
    }
  }

  /** Returns whether this type, or the element type of an array, is a STRUCT. */
  public boolean containsStruct() {
    return code == TypeCode.STRUCT || (elementType != null && elementType.containsStruct());
  }

  @Override
  public String toString() {
    return code == TypeCode.ARRAY ? "ARRAY<" + elementType + ">" : code.name();
  }
}
