/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

/**
 * The store as a whole cannot be reached. Callers must not count this as a
 * per-record error but abort the current run.
 */
public class StoreUnavailableException extends StoreException {

  private static final long serialVersionUID = 4417066913220452316L;

  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
