/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.client;

import java.io.Serializable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Opaque identifier of one independent unit of a partitioned read. Tokens are immutable and only
 * valid for the session that issued them.
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@ToString(onlyExplicitlyIncluded = true)
public class PartitionToken implements Serializable {

  private static final long serialVersionUID = 1L;

  /** Id of the issuing {@link ReadSession}. */
  @EqualsAndHashCode.Include @ToString.Include private final String sessionId;

  /** Position of the token in dispatch order. */
  @EqualsAndHashCode.Include @ToString.Include private final int index;

  /** Backend specific partition descriptor. */
  private final Serializable payload;

  /** Returns whether this token was issued by the given session. */
  public boolean belongsTo(ReadSession session) {
    return session != null && sessionId.equals(session.getSessionId());
  }
}
