/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * Column-oriented view of a result: one value list per column, in schema order. This is the shape
 * dataframe-style consumers expect. Column names need not be unique, since the database allows
 * duplicate and empty names for computed columns.
 */
public class ColumnarTable {

  @Getter private final Schema schema;
  private final List<List<Object>> columns;
  @Getter private final int rowCount;

  private ColumnarTable(Schema schema, List<List<Object>> columns, int rowCount) {
    this.schema = schema;
    this.columns = columns;
    this.rowCount = rowCount;
  }

  /**
   * Flips row-oriented data into columns.
   *
   * @param schema schema of every row
   * @param rows rows whose width equals the schema size
   * @return the columnar table
   */
  public static ColumnarTable fromRows(Schema schema, List<List<Object>> rows) {
    if (schema.isEmpty()) {
      return new ColumnarTable(schema, List.of(), 0);
    }
    List<List<Object>> builders = new ArrayList<>(schema.size());
    for (int i = 0; i < schema.size(); i++) {
      builders.add(new ArrayList<>(rows.size()));
    }
    for (List<Object> row : rows) {
      if (row.size() != schema.size()) {
        throw new IllegalArgumentException(
            "Row width " + row.size() + " does not match schema width " + schema.size());
      }
      for (int i = 0; i < row.size(); i++) {
        builders.get(i).add(row.get(i));
      }
    }
    List<List<Object>> frozen = new ArrayList<>(builders.size());
    // Guava immutable collections reject nulls, and SQL columns hold them.
    builders.forEach(values -> frozen.add(Collections.unmodifiableList(values)));
    return new ColumnarTable(schema, Collections.unmodifiableList(frozen), rows.size());
  }

  public int getColumnCount() {
    return columns.size();
  }

  public List<String> getColumnNames() {
    return schema.getColumnNames();
  }

  /** Returns the values of the column at the given position. */
  public List<Object> getColumn(int index) {
    return columns.get(index);
  }

  /** Returns the values of the first column with the given name. */
  public List<Object> getColumn(String name) {
    int index = getColumnNames().indexOf(name);
    if (index < 0) {
      throw new IllegalArgumentException("Unknown column: " + name);
    }
    return columns.get(index);
  }
}
