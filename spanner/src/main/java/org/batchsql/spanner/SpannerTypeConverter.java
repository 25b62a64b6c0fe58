/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import com.google.cloud.spanner.Type;
import com.google.common.collect.ImmutableList;
import lombok.extern.log4j.Log4j2;
import org.batchsql.data.DataType;
import org.batchsql.data.Schema;

/** Maps Spanner column types onto {@link DataType}. Stateless. */
@Log4j2
public final class SpannerTypeConverter {

  private SpannerTypeConverter() {}

  /**
   * Converts the row type of a Spanner result set into a schema.
   *
   * @param rowType a STRUCT type as returned by {@code ResultSet.getType()}
   * @return columns in result order; names may repeat or be empty
   */
  public static Schema toSchema(Type rowType) {
    if (rowType.getCode() != Type.Code.STRUCT) {
      throw new IllegalArgumentException("Row type must be a STRUCT, got " + rowType);
    }
    ImmutableList.Builder<Schema.Column> columns = ImmutableList.builder();
    for (Type.StructField field : rowType.getStructFields()) {
      columns.add(new Schema.Column(field.getName(), toDataType(field.getType())));
    }
    return new Schema(columns.build());
  }

  /**
   * Converts one column type. STRUCT maps to {@link DataType#STRUCT} and is rejected later, when
   * the result is assembled. PostgreSQL-dialect NUMERIC and JSONB share the GoogleSQL mappings,
   * FLOAT32 widens to FLOAT64, and codes without a mapping (PROTO, ENUM, anything newer) become
   * {@link DataType#OTHER}.
   */
  public static DataType toDataType(Type type) {
    switch (type.getCode()) {
      case BOOL:
        return DataType.BOOL;
      case INT64:
        return DataType.INT64;
      case FLOAT64:
      case FLOAT32:
        return DataType.FLOAT64;
      case NUMERIC:
      case PG_NUMERIC:
        return DataType.NUMERIC;
      case STRING:
        return DataType.STRING;
      case BYTES:
        return DataType.BYTES;
      case JSON:
      case PG_JSONB:
        return DataType.JSON;
      case DATE:
        return DataType.DATE;
      case TIMESTAMP:
        return DataType.TIMESTAMP;
      case STRUCT:
        return DataType.STRUCT;
      case ARRAY:
        return DataType.array(toDataType(type.getArrayElementType()));
      default:
        log.debug("Spanner type {} has no dedicated mapping, passing values through", type);
        return DataType.OTHER;
    }
  }
}
