/* Copyright 2025--2026 The Tor Project
 * See LICENSE for licensing information */

package org.torproject.metrics.recordmirror.store;

/**
 * Failure of a single store operation, e.g., a malformed record or a file
 * that could not be written.
 */
public class StoreException extends Exception {

  private static final long serialVersionUID = -3215487740925102712L;

  /** See {@link Exception#Exception(String)}. */
  public StoreException(String message) {
    super(message);
  }

  /** See {@link Exception#Exception(String, Throwable)}. */
  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
