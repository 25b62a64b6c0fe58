/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.client;

/**
 * Handle to a partitioned-read session opened against the isolated compute tier. A session is
 * released exactly once, through {@link DatabaseClient#releaseSession(ReadSession)}.
 */
public interface ReadSession {

  /** Returns the identifier that partition tokens issued by this session carry. */
  String getSessionId();
}
