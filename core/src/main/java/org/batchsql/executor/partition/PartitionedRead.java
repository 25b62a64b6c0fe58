/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.executor.partition;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.batchsql.client.DatabaseClient;
import org.batchsql.client.PartitionToken;
import org.batchsql.client.ReadSession;

/**
 * An open partitioned-read session and the tokens it issued. Closing it is the only path that
 * releases the session, and it releases at most once no matter how many exit paths call it.
 */
@Log4j2
public class PartitionedRead implements AutoCloseable {

  private final DatabaseClient client;
  @Getter private final ReadSession session;
  @Getter private final List<PartitionToken> tokens;
  private final AtomicBoolean released = new AtomicBoolean(false);

  PartitionedRead(DatabaseClient client, ReadSession session, List<PartitionToken> tokens) {
    this.client = client;
    this.session = session;
    this.tokens = ImmutableList.copyOf(tokens);
  }

  public boolean isReleased() {
    return released.get();
  }

  /** Releases the session on the first call; later calls do nothing. */
  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      log.debug("Releasing read session {}", session.getSessionId());
      client.releaseSession(session);
    }
  }
}
