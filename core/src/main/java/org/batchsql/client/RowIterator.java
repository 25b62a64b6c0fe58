/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.client;

import java.util.Iterator;
import java.util.List;
import org.batchsql.data.Schema;

/** Rows of one partition read. Each row is ordered to match {@link #getSchema()}. */
public interface RowIterator extends Iterator<List<Object>>, AutoCloseable {

  /** Returns the column schema of this partition. Valid before the first call to next. */
  Schema getSchema();

  /** Releases the underlying stream. Does not throw. */
  @Override
  void close();
}
