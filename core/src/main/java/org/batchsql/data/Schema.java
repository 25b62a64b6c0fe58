/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.data;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/** Ordered column schema shared by every partition of a result. */
@Getter
@EqualsAndHashCode
@ToString
public final class Schema {

  private static final Schema EMPTY = new Schema(List.of());

  private final List<Column> columns;

  public Schema(List<Column> columns) {
    this.columns = ImmutableList.copyOf(columns);
  }

  /** Schema with no columns, used when no partition produced a schema. */
  public static Schema empty() {
    return EMPTY;
  }

  public static Schema of(Column... columns) {
    return new Schema(List.of(columns));
  }

  public int size() {
    return columns.size();
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  public List<String> getColumnNames() {
    return columns.stream().map(Column::getName).collect(Collectors.toList());
  }

  /** A named, typed column. */
  @Getter
  @RequiredArgsConstructor
  @EqualsAndHashCode
  public static class Column {
    private final String name;
    private final DataType type;

    @Override
    public String toString() {
      return "(" + name + ", " + type + ")";
    }
  }
}
