/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import com.google.cloud.spanner.ResultSet;
import java.util.List;
import java.util.NoSuchElementException;
import org.batchsql.client.RowIterator;
import org.batchsql.data.Schema;

/**
 * {@link RowIterator} over a Spanner {@link ResultSet}. The first row is fetched eagerly, since
 * Spanner only reports the row type once the stream has started.
 */
class SpannerRowIterator implements RowIterator {

  private final ResultSet resultSet;
  private final Schema schema;
  private boolean hasRow;

  SpannerRowIterator(ResultSet resultSet) {
    this.resultSet = resultSet;
    try {
      this.hasRow = resultSet.next();
      this.schema = SpannerTypeConverter.toSchema(resultSet.getType());
    } catch (RuntimeException e) {
      resultSet.close();
      throw e;
    }
  }

  @Override
  public Schema getSchema() {
    return schema;
  }

  @Override
  public boolean hasNext() {
    return hasRow;
  }

  @Override
  public List<Object> next() {
    if (!hasRow) {
      throw new NoSuchElementException();
    }
    List<Object> row = SpannerValueReader.readRow(resultSet, schema);
    hasRow = resultSet.next();
    return row;
  }

  @Override
  public void close() {
    resultSet.close();
  }
}
