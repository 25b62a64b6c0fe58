/*
 * Copyright batch-sql Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.batchsql.client;

/**
 * Failure that may succeed when retried, such as a network timeout or backend throttling. Client
 * implementations throw it, or override {@link DatabaseClient#isTransient(Throwable)}, to make a
 * partition read eligible for retry.
 */
public class TransientBackendException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public TransientBackendException(String message) {
    super(message);
  }

  public TransientBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
