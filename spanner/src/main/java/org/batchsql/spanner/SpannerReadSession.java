/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.spanner;

import com.google.cloud.spanner.BatchReadOnlyTransaction;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.batchsql.client.ReadSession;

/** A Spanner batch read-only transaction used as a partitioned-read session. */
@Getter
@RequiredArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
public class SpannerReadSession implements ReadSession {

  @ToString.Include private final String sessionId;

  private final BatchReadOnlyTransaction transaction;
}
